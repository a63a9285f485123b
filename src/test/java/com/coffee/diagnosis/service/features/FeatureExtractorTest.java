package com.coffee.diagnosis.service.features;

import com.coffee.diagnosis.service.image.LeafImage;
import com.coffee.diagnosis.service.image.LeafImageFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    @Test
    void stripedLeafPassesEveryLeafCriterion() {
        ImageAnalysis analysis = extractor.analyze(LeafImageFixtures.stripedLeaf(224));

        LeafFeatures leaf = analysis.leaf();
        assertThat(leaf.greenRatio()).isEqualTo(1.0);
        assertThat(leaf.brownRatio()).isZero();
        assertThat(leaf.yellowRatio()).isZero();
        assertThat(leaf.avgTexture()).isBetween(15.0, 30.0);
        assertThat(leaf.shapeComplexity()).isBetween(5.0, 50.0);
        assertThat(leaf.edgeDensity()).isBetween(0.1, 0.4);
        assertThat(leaf.coffeeLeafScore()).isEqualTo(1.0);
    }

    @Test
    void stripedLeafIsSharpAndWellExposed() {
        QualityAnalysis quality = extractor.analyzeQuality(LeafImageFixtures.stripedLeaf(224));

        assertThat(quality.averageBrightness()).isCloseTo(0.5, within(0.02));
        assertThat(quality.blurry()).isFalse();
        assertThat(quality.brightnessIssue()).isFalse();
        assertThat(quality.qualityScore()).isGreaterThan(0.9);
    }

    @Test
    void flatGreyImageFailsTheLeafGate() {
        ImageAnalysis analysis = extractor.analyze(LeafImageFixtures.uniform(64, 64, 128, 128, 128));

        assertThat(analysis.leaf().coffeeLeafScore()).isLessThan(0.3);
        assertThat(analysis.quality().blurry()).isTrue();
        assertThat(analysis.quality().contrast()).isZero();
    }

    @Test
    void darkImageIsReportedAsShadowed() {
        LeafImage dark = LeafImageFixtures.uniform(32, 32, 20, 20, 20);

        EnvironmentalFactors environment = extractor.analyzeEnvironment(dark);
        QualityAnalysis quality = extractor.analyzeQuality(dark);

        assertThat(environment.hasShadow()).isTrue();
        assertThat(environment.shadowRatio()).isEqualTo(1.0);
        assertThat(environment.hasHighlight()).isFalse();
        assertThat(quality.brightnessIssue()).isTrue();
    }

    @Test
    void brownAndYellowPixelsAreCounted() {
        LeafImage brown = LeafImageFixtures.uniform(16, 16, 140, 90, 40);
        LeafImage yellow = LeafImageFixtures.uniform(16, 16, 230, 210, 30);

        assertThat(extractor.analyze(brown).leaf().brownRatio()).isEqualTo(1.0);
        assertThat(extractor.analyze(yellow).leaf().yellowRatio()).isEqualTo(1.0);
    }

    @Test
    void yellowBandTakesPriorityOverGreen() {
        assertThat(FeatureExtractor.colourBand(55, 0.7)).isEqualTo(FeatureExtractor.ColourBand.YELLOW);
        assertThat(FeatureExtractor.colourBand(55, 0.5)).isEqualTo(FeatureExtractor.ColourBand.GREEN);
        assertThat(FeatureExtractor.colourBand(25, 0.1)).isEqualTo(FeatureExtractor.ColourBand.BROWN);
        assertThat(FeatureExtractor.colourBand(200, 0.9)).isEqualTo(FeatureExtractor.ColourBand.OTHER);
    }

    @Test
    void hsvConversionUsesDegrees() {
        float[] hsv = new float[3];

        FeatureExtractor.toHsv(0, 255, 0, hsv);
        assertThat(hsv[0]).isEqualTo(120f);
        assertThat(hsv[1]).isEqualTo(1f);
        assertThat(hsv[2]).isEqualTo(1f);

        FeatureExtractor.toHsv(255, 0, 0, hsv);
        assertThat(hsv[0]).isZero();

        FeatureExtractor.toHsv(0, 0, 0, hsv);
        assertThat(hsv[1]).isZero();
    }

    @Test
    void qualityScorePenalisesPoorExposure() {
        assertThat(FeatureExtractor.qualityScore(0.5, 0.2, 0.05)).isEqualTo(1.0);
        assertThat(FeatureExtractor.qualityScore(0.1, 0.0, 0.0)).isCloseTo(0.34, within(1e-9));
    }

    @Test
    void leafScoreDropsForEveryFailedCriterion() {
        EnvironmentalFactors clean = new EnvironmentalFactors(false, false, false, 0, 0, 0.2);
        EnvironmentalFactors busy = new EnvironmentalFactors(true, true, true, 0.3, 0.2, 0.5);

        double passing = FeatureExtractor.coffeeLeafScore(0.6, 0.0, 0.5, 20, 20, 0.2, clean);
        double failing = FeatureExtractor.coffeeLeafScore(0.0, 0.0, 0.1, 0, 0, 0.0, busy);

        assertThat(passing).isEqualTo(1.0);
        assertThat(failing).isZero();
    }
}
