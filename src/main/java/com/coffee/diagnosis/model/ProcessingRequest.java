package com.coffee.diagnosis.model;

import java.time.Instant;
import java.util.List;

/**
 * Message published to the processing queue. {@code requestId} is the caller's idempotency
 * token and the key every persisted row for the request is written under.
 */
public record ProcessingRequest(String requestId, String imageRef, List<Integer> symptomIds, Instant requestedAt) {

    public ProcessingRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        if (imageRef == null || imageRef.isBlank()) {
            throw new IllegalArgumentException("imageRef must not be blank");
        }
        symptomIds = symptomIds == null ? List.of() : List.copyOf(symptomIds);
    }
}
