package com.coffee.diagnosis.service.preprocessing;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.service.features.EnvironmentalFactors;
import com.coffee.diagnosis.service.features.FeatureExtractor;
import com.coffee.diagnosis.service.features.ImageAnalysis;
import com.coffee.diagnosis.service.features.LeafFeatures;
import com.coffee.diagnosis.service.features.QualityAnalysis;
import com.coffee.diagnosis.service.image.LeafImage;
import com.coffee.diagnosis.service.image.LeafImageFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImageEnhancerTest {

    private static final LeafFeatures LEAF = new LeafFeatures(0.6, 0, 0, 70, 0.5, 0.5, 20, 20, 0.2, 0.9);
    private static final EnvironmentalFactors CLEAN = new EnvironmentalFactors(false, false, false, 0, 0, 0.2);

    private final ImageEnhancer enhancer = new ImageEnhancer(DiagnosisProperties.defaults());

    @Test
    void goodImagesAreReturnedUntouched() {
        LeafImage image = LeafImageFixtures.stripedLeaf(64);
        ImageAnalysis analysis = new FeatureExtractor().analyze(image);

        assertThat(enhancer.needsEnhancement(analysis.quality())).isFalse();
        assertThat(enhancer.enhance(image, analysis)).isSameAs(image);
    }

    @Test
    void underexposedImageIsBrightened() {
        LeafImage image = LeafImageFixtures.uniform(16, 16, 38, 38, 38);
        QualityAnalysis quality = new QualityAnalysis(0.15, 0.2, 0.1, 0.4, false, true);

        LeafImage enhanced = enhancer.enhance(image, new ImageAnalysis(quality, LEAF, CLEAN));

        assertThat(enhanced).isNotSameAs(image);
        assertThat(enhanced.red(5, 5)).isEqualTo(95);
        assertThat(image.red(5, 5)).isEqualTo(38);
    }

    @Test
    void flatImageGetsContrastStretch() {
        LeafImage image = LeafImageFixtures.uniform(16, 16, 200, 50, 128);
        QualityAnalysis quality = new QualityAnalysis(0.5, 0.05, 0.1, 0.6, false, false);

        LeafImage enhanced = enhancer.enhance(image, new ImageAnalysis(quality, LEAF, CLEAN));

        assertThat(enhanced.red(0, 0)).isEqualTo(222);
        assertThat(enhanced.green(0, 0)).isEqualTo(27);
        assertThat(enhanced.blue(0, 0)).isBetween(127, 129);
    }

    @Test
    void brightnessGainTargetsTheMidBand() {
        assertThat(ImageEnhancer.brightnessGain(0.1)).isEqualTo(2.5);
        assertThat(ImageEnhancer.brightnessGain(0.2)).isCloseTo(2.0, within(1e-9));
        assertThat(ImageEnhancer.brightnessGain(0.9)).isCloseTo(0.6667, within(1e-4));
        assertThat(ImageEnhancer.brightnessGain(0.5)).isEqualTo(1.0);
    }

    @Test
    void thresholdComesFromConfiguration() {
        QualityAnalysis quality = new QualityAnalysis(0.5, 0.2, 0.1, 0.65, false, false);
        DiagnosisProperties strict = new DiagnosisProperties(null,
                new DiagnosisProperties.PipelineProperties(true, 0.3, 0.6, 0.7, 2), null, null, null);

        assertThat(enhancer.needsEnhancement(quality)).isTrue();
        assertThat(new ImageEnhancer(strict).needsEnhancement(quality)).isFalse();
    }
}
