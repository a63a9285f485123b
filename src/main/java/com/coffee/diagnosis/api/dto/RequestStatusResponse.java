package com.coffee.diagnosis.api.dto;

import com.coffee.diagnosis.model.ProcessingMode;
import com.coffee.diagnosis.model.RequestStatus;
import com.coffee.diagnosis.model.RequestStatusRecord;
import java.time.Instant;

public record RequestStatusResponse(
        String requestId,
        String imageRef,
        RequestStatus status,
        ProcessingMode mode,
        String error,
        Instant requestedAt,
        Instant updatedAt,
        PredictionResponse result) {

    public static RequestStatusResponse from(RequestStatusRecord record, PredictionResponse result) {
        return new RequestStatusResponse(record.requestId(), record.imageRef(), record.status(), record.mode(),
                record.error(), record.requestedAt(), record.updatedAt(), result);
    }
}
