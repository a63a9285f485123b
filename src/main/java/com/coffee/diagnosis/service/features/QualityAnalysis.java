package com.coffee.diagnosis.service.features;

public record QualityAnalysis(
        double averageBrightness,
        double contrast,
        double sharpness,
        double qualityScore,
        boolean blurry,
        boolean brightnessIssue) {
}
