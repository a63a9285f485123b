package com.coffee.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one prediction call. Instances are built once and never changed; derived copies
 * come from {@link #withId(Long)} after the row is persisted and from
 * {@link #withFinalConfidence(double)} when symptoms are fused in afterwards.
 */
public record PredictionResult(
        Long id,
        String diseaseName,
        double confidence,
        Double finalConfidence,
        SeverityLevel severityLevel,
        String modelVersion,
        long processingTimeMs,
        Instant createdAt,
        String description,
        String treatmentSuggestion,
        List<ClassProbability> probabilities,
        String imageHash) {

    public PredictionResult {
        if (modelVersion == null || modelVersion.isBlank()) {
            throw new IllegalArgumentException("modelVersion tag must always be set");
        }
        probabilities = probabilities == null ? List.of() : List.copyOf(probabilities);
    }

    public double effectiveConfidence() {
        return finalConfidence != null ? finalConfidence : confidence;
    }

    @JsonIgnore
    public boolean isCoffeeLeaf() {
        return !DiseaseClass.NOT_COFFEE_LEAF.equals(diseaseName);
    }

    public PredictionResult withId(Long newId) {
        return new PredictionResult(newId, diseaseName, confidence, finalConfidence, severityLevel, modelVersion,
                processingTimeMs, createdAt, description, treatmentSuggestion, probabilities, imageHash);
    }

    /** Copy carrying a fused confidence, with the severity recomputed from it. */
    public PredictionResult withFinalConfidence(double fused) {
        return new PredictionResult(id, diseaseName, confidence, fused, SeverityLevel.fromConfidence(fused),
                modelVersion, processingTimeMs, createdAt, description, treatmentSuggestion, probabilities,
                imageHash);
    }
}
