package com.coffee.diagnosis.service;

import com.coffee.diagnosis.model.ClassProbability;
import com.coffee.diagnosis.model.DiseaseClass;
import com.coffee.diagnosis.model.PipelineVariant;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.SeverityLevel;
import com.coffee.diagnosis.service.features.FeatureExtractor;
import com.coffee.diagnosis.service.features.ImageAnalysis;
import com.coffee.diagnosis.service.features.LeafFeatures;
import com.coffee.diagnosis.service.features.QualityAnalysis;
import com.coffee.diagnosis.service.image.LeafImage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in for the image model, driven by the colour and texture features. It is
 * a placeholder heuristic with no accuracy target; it only guarantees a plausible label and
 * confidence when no model can answer.
 */
@Component
public class MockPredictor {

    private static final Logger log = LoggerFactory.getLogger(MockPredictor.class);

    static final double MIN_CONFIDENCE = 0.5;
    static final double MAX_CONFIDENCE = 0.95;

    private final FeatureExtractor featureExtractor;
    private final DiseaseKnowledgeBase knowledgeBase;

    public MockPredictor(FeatureExtractor featureExtractor, DiseaseKnowledgeBase knowledgeBase) {
        this.featureExtractor = featureExtractor;
        this.knowledgeBase = knowledgeBase;
    }

    /**
     * @param analysis features already computed for the image, or {@code null}
     */
    public PredictionResult predict(LeafImage image, ImageAnalysis analysis, PipelineVariant variant,
            String imageHash, long startNanos) {
        ImageAnalysis features = analysis != null ? analysis : featureExtractor.analyze(image);
        QualityAnalysis quality = features.quality();
        LeafFeatures leaf = features.leaf();
        DiseaseClass disease = selectDisease(leaf);
        double confidence = confidence(quality, leaf);

        String description = knowledgeBase.describeWithQuality(disease.label(), quality);
        List<String> warnings = knowledgeBase.qualityWarnings(quality);
        if (!warnings.isEmpty()) {
            description = description + " Warning: " + String.join("; ", warnings) + ".";
        }
        log.info("Mock prediction {} ({}) with confidence {}", disease.label(), variant, confidence);
        return new PredictionResult(
                null,
                disease.label(),
                confidence,
                null,
                SeverityLevel.fromConfidence(confidence),
                variant.tag(null),
                elapsedMillis(startNanos),
                Instant.now(),
                description,
                knowledgeBase.treatment(disease.label()),
                distribution(disease, confidence),
                imageHash);
    }

    /**
     * Last resort when even feature extraction failed.
     */
    public PredictionResult minimal(String imageHash, long startNanos) {
        DiseaseClass disease = DiseaseClass.HEALTHY;
        return new PredictionResult(
                null,
                disease.label(),
                MIN_CONFIDENCE,
                null,
                SeverityLevel.fromConfidence(MIN_CONFIDENCE),
                PipelineVariant.FALLBACK.tag(null),
                elapsedMillis(startNanos),
                Instant.now(),
                knowledgeBase.describe(disease.label()) + " Analysis failed, this is a default answer.",
                knowledgeBase.treatment(disease.label()),
                distribution(disease, MIN_CONFIDENCE),
                imageHash);
    }

    static DiseaseClass selectDisease(LeafFeatures leaf) {
        if (leaf.brownRatio() > 0.3) {
            return leaf.avgTexture() >= 30 ? DiseaseClass.CERCOSPORA : DiseaseClass.PHOMA;
        }
        if (leaf.yellowRatio() > 0.2) {
            return DiseaseClass.RUST;
        }
        if (leaf.greenRatio() > 0.5) {
            return DiseaseClass.HEALTHY;
        }
        if (leaf.avgTexture() > 50) {
            return DiseaseClass.MINER;
        }
        return DiseaseClass.RUST;
    }

    static double confidence(QualityAnalysis quality, LeafFeatures leaf) {
        double confidence = 0.7 + quality.qualityScore() * 0.2 + leaf.coffeeLeafScore() * 0.15 - 0.05;
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    /** Winner gets {@code confidence}, the rest share the remainder evenly. */
    static List<ClassProbability> distribution(DiseaseClass winner, double confidence) {
        DiseaseClass[] classes = DiseaseClass.values();
        double share = (1.0 - confidence) / (classes.length - 1);
        List<ClassProbability> probabilities = new ArrayList<>(classes.length);
        probabilities.add(new ClassProbability(winner.label(), confidence));
        for (DiseaseClass candidate : classes) {
            if (candidate != winner) {
                probabilities.add(new ClassProbability(candidate.label(), share));
            }
        }
        return probabilities;
    }

    private static long elapsedMillis(long startNanos) {
        return Math.max(0, (System.nanoTime() - startNanos) / 1_000_000);
    }
}
