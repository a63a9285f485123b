package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.ProcessingRequest;
import java.util.Optional;

public record SubmissionOutcome(SubmissionStatus status, ProcessingRequest request, Optional<PredictionResult> result) {

    public static SubmissionOutcome queued(ProcessingRequest request) {
        return new SubmissionOutcome(SubmissionStatus.PROCESSING, request, Optional.empty());
    }

    public static SubmissionOutcome completed(ProcessingRequest request, PredictionResult result) {
        return new SubmissionOutcome(SubmissionStatus.COMPLETED, request, Optional.of(result));
    }
}
