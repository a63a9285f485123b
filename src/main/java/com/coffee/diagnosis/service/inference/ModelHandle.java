package com.coffee.diagnosis.service.inference;

import com.coffee.diagnosis.model.ModelType;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;

/**
 * Immutable description of one loaded model. The engine publishes a handle as a single
 * reference, so the tensor names, layout and session a caller reads always belong together.
 */
public record ModelHandle(
        ModelType modelType,
        String version,
        String inputName,
        String outputName,
        TensorLayout layout,
        long[] inputShape,
        int inputHeight,
        int inputWidth,
        int featureLength,
        ModelSession session,
        Path source,
        Instant loadedAt) {

    public ModelHandle {
        inputShape = inputShape == null ? new long[0] : inputShape.clone();
    }

    @Override
    public long[] inputShape() {
        return inputShape.clone();
    }

    @Override
    public String toString() {
        return "ModelHandle[" + modelType + " " + version + ", input=" + inputName + Arrays.toString(inputShape)
                + ", output=" + outputName + ", layout=" + layout + ", source=" + source + "]";
    }
}
