package com.coffee.diagnosis.service.ensemble;

import com.coffee.diagnosis.service.symptom.SymptomPrediction;
import java.util.Optional;

/**
 * Fused confidence. {@code symptom} is empty when the image confidence was used unchanged.
 */
public record FusionOutcome(double finalConfidence, Optional<SymptomPrediction> symptom) {

    public static FusionOutcome imageOnly(double imageConfidence) {
        return new FusionOutcome(imageConfidence, Optional.empty());
    }

    public boolean fused() {
        return symptom.isPresent();
    }
}
