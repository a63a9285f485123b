package com.coffee.diagnosis.api.dto;

import com.coffee.diagnosis.model.ClassProbability;
import com.coffee.diagnosis.model.PredictionResult;
import java.time.Instant;
import java.util.List;

public record PredictionResponse(
        Long predictionId,
        String diseaseName,
        double confidence,
        Double finalConfidence,
        String severity,
        String description,
        String treatmentSuggestion,
        String modelVersion,
        long processingTimeMs,
        Instant createdAt,
        List<ClassProbability> probabilities) {

    public static PredictionResponse from(PredictionResult result) {
        return new PredictionResponse(
                result.id(),
                result.diseaseName(),
                result.confidence(),
                result.finalConfidence(),
                result.severityLevel().label(),
                result.description(),
                result.treatmentSuggestion(),
                result.modelVersion(),
                result.processingTimeMs(),
                result.createdAt(),
                result.probabilities());
    }
}
