package com.coffee.diagnosis.model;

import java.time.Instant;

public record RequestStatusRecord(
        String requestId,
        String imageRef,
        RequestStatus status,
        ProcessingMode mode,
        String error,
        Long predictionId,
        Instant requestedAt,
        Instant updatedAt) {
}
