package com.coffee.diagnosis.service.features;

/**
 * Everything the feature extractor knows about one image, computed together so the leaf score
 * sees the same environment flags the enhancer does.
 */
public record ImageAnalysis(QualityAnalysis quality, LeafFeatures leaf, EnvironmentalFactors environment) {
}
