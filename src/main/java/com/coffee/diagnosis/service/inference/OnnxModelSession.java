package com.coffee.diagnosis.service.inference;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import java.nio.FloatBuffer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ModelSession} backed by an ONNX Runtime session.
 */
public class OnnxModelSession implements ModelSession {

    private static final Logger log = LoggerFactory.getLogger(OnnxModelSession.class);

    private final OrtEnvironment environment;
    private final OrtSession session;

    public OnnxModelSession(OrtEnvironment environment, OrtSession session) {
        this.environment = environment;
        this.session = session;
    }

    @Override
    public float[] run(String inputName, float[] data, long[] shape) {
        long start = System.nanoTime();
        try (OnnxTensor tensor = OnnxTensor.createTensor(environment, FloatBuffer.wrap(data), shape);
                OrtSession.Result result = session.run(Map.of(inputName, tensor))) {
            if (result.size() == 0) {
                throw new InferenceFailedException("Model returned no outputs");
            }
            OnnxValue value = result.get(0);
            if (!(value instanceof OnnxTensor output)) {
                throw new InferenceFailedException("First model output is not a tensor");
            }
            FloatBuffer buffer = output.getFloatBuffer();
            if (buffer == null || !buffer.hasRemaining()) {
                throw new InferenceFailedException("Model output tensor is empty");
            }
            float[] scores = new float[buffer.remaining()];
            buffer.get(scores);
            log.debug("Forward pass on {} produced {} scores in {} ms", inputName, scores.length,
                    (System.nanoTime() - start) / 1_000_000);
            return scores;
        } catch (OrtException ex) {
            throw new InferenceFailedException("ONNX Runtime failed to run the model", ex);
        }
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            log.warn("Failed to close OrtSession", e);
        }
    }
}
