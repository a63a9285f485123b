package com.coffee.diagnosis.service.inference;

/**
 * How a model expects its input tensor to be arranged.
 */
public enum TensorLayout {

    /** {@code [N, C, H, W]}, ImageNet normalised. */
    CHANNEL_FIRST,

    /** {@code [N, H, W, C]}, scaled to {@code [0, 1]}. */
    CHANNEL_LAST,

    /** {@code [N, features]}. */
    FLAT;

    /**
     * Infers the layout from a declared input shape by locating the three channel dimension.
     * Image shapes that do not show it are treated as channel-first, the common export format.
     */
    public static TensorLayout infer(long[] shape) {
        if (shape == null || shape.length <= 2) {
            return FLAT;
        }
        if (shape.length == 4) {
            if (shape[1] == 3) {
                return CHANNEL_FIRST;
            }
            if (shape[3] == 3) {
                return CHANNEL_LAST;
            }
        }
        return CHANNEL_FIRST;
    }
}
