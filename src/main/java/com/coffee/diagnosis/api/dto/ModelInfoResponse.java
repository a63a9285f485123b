package com.coffee.diagnosis.api.dto;

import com.coffee.diagnosis.model.ModelType;
import com.coffee.diagnosis.service.inference.InferenceEngine;
import com.coffee.diagnosis.service.inference.ModelHandle;
import com.coffee.diagnosis.service.inference.TensorLayout;
import java.time.Instant;

public record ModelInfoResponse(
        ModelType modelType,
        boolean loaded,
        String version,
        String inputName,
        String outputName,
        TensorLayout layout,
        long[] inputShape,
        String source,
        Instant loadedAt,
        long forwardPasses) {

    public static ModelInfoResponse from(InferenceEngine engine) {
        return engine.activeHandle()
                .map(handle -> from(engine, handle))
                .orElseGet(() -> new ModelInfoResponse(engine.modelType(), false, null, null, null, null,
                        new long[0], null, null, engine.forwardPassCount()));
    }

    private static ModelInfoResponse from(InferenceEngine engine, ModelHandle handle) {
        return new ModelInfoResponse(engine.modelType(), true, handle.version(), handle.inputName(),
                handle.outputName(), handle.layout(), handle.inputShape(),
                handle.source() == null ? null : handle.source().toString(), handle.loadedAt(),
                engine.forwardPassCount());
    }
}
