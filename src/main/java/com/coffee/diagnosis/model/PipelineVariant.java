package com.coffee.diagnosis.model;

/**
 * Identifies which branch of the prediction pipeline produced a result. The tag ends up in
 * {@link PredictionResult#modelVersion()} so logs and stored rows show where a label came from.
 */
public enum PipelineVariant {

    REAL("_REAL"),
    ENHANCED("_ENHANCED"),
    SMART_MOCK("smart-mock"),
    FALLBACK("fallback"),
    NOT_A_LEAF("_LEAF_GATE");

    private final String suffix;

    PipelineVariant(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Builds the version tag for a result. Model-backed variants append their suffix to the
     * active model version, the mock variants ignore it.
     */
    public String tag(String modelVersion) {
        return switch (this) {
            case SMART_MOCK, FALLBACK -> suffix;
            default -> (modelVersion == null || modelVersion.isBlank() ? "unknown" : modelVersion) + suffix;
        };
    }
}
