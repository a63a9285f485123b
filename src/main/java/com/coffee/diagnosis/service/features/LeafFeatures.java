package com.coffee.diagnosis.service.features;

public record LeafFeatures(
        double greenRatio,
        double brownRatio,
        double yellowRatio,
        double avgHue,
        double avgSaturation,
        double avgValue,
        double avgTexture,
        double shapeComplexity,
        double edgeDensity,
        double coffeeLeafScore) {
}
