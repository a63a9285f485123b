package com.coffee.diagnosis.service;

import com.coffee.diagnosis.model.ClassProbability;
import com.coffee.diagnosis.model.DiseaseClass;
import com.coffee.diagnosis.model.PipelineVariant;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.SeverityLevel;
import com.coffee.diagnosis.service.features.FeatureExtractor;
import com.coffee.diagnosis.service.features.LeafFeatures;
import com.coffee.diagnosis.service.features.QualityAnalysis;
import com.coffee.diagnosis.service.image.LeafImageFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MockPredictorTest {

    private final MockPredictor predictor = new MockPredictor(new FeatureExtractor(), new DiseaseKnowledgeBase());

    @Test
    void greenLeafIsHealthyWithHighConfidence() {
        PredictionResult result = predictor.predict(LeafImageFixtures.stripedLeaf(224), null,
                PipelineVariant.SMART_MOCK, "hash", System.nanoTime());

        assertThat(result.diseaseName()).isEqualTo("Healthy");
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.severityLevel()).isEqualTo(SeverityLevel.VERY_HIGH);
        assertThat(result.modelVersion()).isEqualTo("smart-mock");
        assertThat(result.imageHash()).isEqualTo("hash");
        assertThat(result.probabilities()).hasSize(5);
        assertThat(result.probabilities().get(0)).isEqualTo(new ClassProbability("Healthy", 0.95));
    }

    @Test
    void diseaseFollowsColourAndTexture() {
        assertThat(MockPredictor.selectDisease(leaf(0.1, 0.4, 0.0, 40))).isEqualTo(DiseaseClass.CERCOSPORA);
        assertThat(MockPredictor.selectDisease(leaf(0.1, 0.4, 0.0, 20))).isEqualTo(DiseaseClass.PHOMA);
        assertThat(MockPredictor.selectDisease(leaf(0.6, 0.1, 0.3, 20))).isEqualTo(DiseaseClass.RUST);
        assertThat(MockPredictor.selectDisease(leaf(0.6, 0.1, 0.1, 20))).isEqualTo(DiseaseClass.HEALTHY);
        assertThat(MockPredictor.selectDisease(leaf(0.2, 0.1, 0.1, 60))).isEqualTo(DiseaseClass.MINER);
        assertThat(MockPredictor.selectDisease(leaf(0.2, 0.1, 0.1, 20))).isEqualTo(DiseaseClass.RUST);
    }

    @Test
    void confidenceStaysInsideItsBand() {
        QualityAnalysis poor = new QualityAnalysis(0.1, 0.0, 0.0, 0.0, true, true);
        QualityAnalysis fair = new QualityAnalysis(0.5, 0.1, 0.05, 0.5, false, false);

        assertThat(MockPredictor.confidence(poor, leaf(0.2, 0, 0, 0, 0.0))).isCloseTo(0.65, within(1e-9));
        assertThat(MockPredictor.confidence(fair, leaf(0.6, 0, 0, 20, 0.4))).isCloseTo(0.81, within(1e-9));
        assertThat(MockPredictor.confidence(fair, leaf(0.6, 0, 0, 20, 1.0))).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void distributionSumsToOne() {
        List<ClassProbability> distribution = MockPredictor.distribution(DiseaseClass.PHOMA, 0.6);

        assertThat(distribution.get(0).diseaseName()).isEqualTo("Phoma");
        assertThat(distribution.stream().mapToDouble(ClassProbability::confidence).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void minimalAnswerIsTaggedAsFallback() {
        PredictionResult result = predictor.minimal("hash", System.nanoTime());

        assertThat(result.diseaseName()).isEqualTo("Healthy");
        assertThat(result.confidence()).isEqualTo(0.5);
        assertThat(result.modelVersion()).isEqualTo("fallback");
    }

    private static LeafFeatures leaf(double green, double brown, double yellow, double texture) {
        return leaf(green, brown, yellow, texture, 0.8);
    }

    private static LeafFeatures leaf(double green, double brown, double yellow, double texture, double leafScore) {
        return new LeafFeatures(green, brown, yellow, 60, 0.5, 0.5, texture, 20, 0.2, leafScore);
    }
}
