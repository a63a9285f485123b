package com.coffee.diagnosis.service.ensemble;

import com.coffee.diagnosis.service.features.LeafFeatures;
import com.coffee.diagnosis.service.features.QualityAnalysis;
import org.springframework.stereotype.Component;

/**
 * Nudges the ensemble confidence by how trustworthy the input looked.
 */
@Component
public class ConfidenceAdjuster {

    static final double MIN_CONFIDENCE = 0.1;
    static final double MAX_CONFIDENCE = 0.98;

    public double adjust(double confidence, QualityAnalysis quality, LeafFeatures leaf) {
        double adjustment = 0.0;
        if (quality.qualityScore() > 0.8) {
            adjustment += 0.05;
        } else if (quality.qualityScore() < 0.5) {
            adjustment -= 0.1;
        }
        if (leaf.coffeeLeafScore() > 0.8) {
            adjustment += 0.03;
        } else if (leaf.coffeeLeafScore() < 0.4) {
            adjustment -= 0.05;
        }
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence + adjustment));
    }
}
