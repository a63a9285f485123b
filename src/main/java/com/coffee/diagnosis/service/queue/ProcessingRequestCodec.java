package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.model.ProcessingRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * JSON form of queue messages.
 */
@Component
public class ProcessingRequestCodec {

    private final ObjectMapper objectMapper;

    public ProcessingRequestCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ProcessingRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialise request " + request.requestId(), ex);
        }
    }

    public ProcessingRequest decode(String payload) {
        try {
            return objectMapper.readValue(payload, ProcessingRequest.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed queue message", ex);
        }
    }
}
