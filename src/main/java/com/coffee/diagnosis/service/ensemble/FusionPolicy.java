package com.coffee.diagnosis.service.ensemble;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.service.symptom.SymptomClassifier;
import com.coffee.diagnosis.service.symptom.SymptomPrediction;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Weighted blend of the image and symptom classifiers. Fusion never fails a prediction: any
 * error from the symptom side leaves the image confidence as the answer.
 */
@Component
public class FusionPolicy {

    private static final Logger log = LoggerFactory.getLogger(FusionPolicy.class);

    private final SymptomClassifier symptomClassifier;
    private final double imageWeight;

    public FusionPolicy(SymptomClassifier symptomClassifier, DiagnosisProperties properties) {
        this.symptomClassifier = symptomClassifier;
        this.imageWeight = properties.pipeline().imageWeight();
    }

    public FusionOutcome fuse(double imageConfidence, List<Integer> symptomIds) {
        if (symptomIds == null || symptomIds.isEmpty() || !symptomClassifier.isAvailable()) {
            return FusionOutcome.imageOnly(imageConfidence);
        }
        try {
            SymptomPrediction symptom = symptomClassifier.predict(symptomIds);
            double fused = imageWeight * imageConfidence + (1.0 - imageWeight) * symptom.confidence();
            log.debug("Fused image confidence {} with symptom confidence {} ({}) into {}",
                    imageConfidence, symptom.confidence(), symptom.modelVersion(), fused);
            return new FusionOutcome(fused, Optional.of(symptom));
        } catch (RuntimeException ex) {
            log.warn("Symptom classifier failed, using image confidence only", ex);
            return FusionOutcome.imageOnly(imageConfidence);
        }
    }
}
