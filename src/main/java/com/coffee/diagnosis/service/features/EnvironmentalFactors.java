package com.coffee.diagnosis.service.features;

public record EnvironmentalFactors(
        boolean hasShadow,
        boolean hasHighlight,
        boolean complexBackground,
        double shadowRatio,
        double highlightRatio,
        double edgeDensity) {
}
