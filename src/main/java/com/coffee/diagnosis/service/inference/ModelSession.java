package com.coffee.diagnosis.service.inference;

/**
 * A loaded network able to run one forward pass. Implementations must be safe for concurrent
 * {@link #run} calls.
 */
public interface ModelSession extends AutoCloseable {

    /**
     * Runs the network on a single tensor and returns the raw scores of the first output.
     *
     * @throws InferenceFailedException when the runtime produces no usable output
     */
    float[] run(String inputName, float[] data, long[] shape);

    @Override
    default void close() {
    }
}
