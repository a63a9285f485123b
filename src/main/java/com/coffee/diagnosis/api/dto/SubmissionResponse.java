package com.coffee.diagnosis.api.dto;

import com.coffee.diagnosis.service.queue.SubmissionOutcome;
import com.coffee.diagnosis.service.queue.SubmissionStatus;

public record SubmissionResponse(
        String requestId,
        String imageRef,
        SubmissionStatus status,
        PredictionResponse result,
        String message) {

    public static SubmissionResponse from(SubmissionOutcome outcome) {
        PredictionResponse result = outcome.result().map(PredictionResponse::from).orElse(null);
        String message = outcome.status() == SubmissionStatus.PROCESSING
                ? "Image queued for processing, poll the request status for the result"
                : "Queue unavailable, the image was processed immediately";
        return new SubmissionResponse(outcome.request().requestId(), outcome.request().imageRef(),
                outcome.status(), result, message);
    }
}
