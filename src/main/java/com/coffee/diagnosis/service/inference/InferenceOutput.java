package com.coffee.diagnosis.service.inference;

/**
 * Raw scores plus the handle that produced them.
 */
public record InferenceOutput(ModelHandle handle, float[] scores) {
}
