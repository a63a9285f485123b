package com.coffee.diagnosis.model;

public enum SeverityLevel {

    VERY_LOW("Very Low"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    VERY_HIGH("Very High");

    private final String label;

    SeverityLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SeverityLevel fromConfidence(double confidence) {
        if (confidence >= 0.9) {
            return VERY_HIGH;
        }
        if (confidence >= 0.8) {
            return HIGH;
        }
        if (confidence >= 0.7) {
            return MEDIUM;
        }
        if (confidence >= 0.6) {
            return LOW;
        }
        return VERY_LOW;
    }
}
