package com.coffee.diagnosis.service.inference;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.coffee.diagnosis.model.ModelType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens ONNX files and reads their single input and output declaration into a
 * {@link ModelHandle}. Dynamic dimensions fall back to the configured defaults.
 */
public class OnnxModelLoader implements ModelLoader {

    private static final Logger log = LoggerFactory.getLogger(OnnxModelLoader.class);

    private final OrtEnvironment environment;
    private final int defaultImageSize;
    private final int defaultFeatureLength;

    public OnnxModelLoader(OrtEnvironment environment, int defaultImageSize, int defaultFeatureLength) {
        this.environment = environment;
        this.defaultImageSize = defaultImageSize;
        this.defaultFeatureLength = defaultFeatureLength;
    }

    @Override
    public ModelHandle load(ModelType type, String version, Path modelFile) {
        if (modelFile == null || !Files.isRegularFile(modelFile)) {
            throw new ModelNotFoundException("Model file not found: " + modelFile);
        }
        Path absolute = modelFile.toAbsolutePath();
        log.info("Loading {} model {} from {}", type, version, absolute);
        OrtSession session = null;
        try {
            OrtSession.SessionOptions options = new OrtSession.SessionOptions();
            options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            session = environment.createSession(absolute.toString(), options);

            Map<String, NodeInfo> inputs = session.getInputInfo();
            if (inputs.isEmpty() || session.getOutputNames().isEmpty()) {
                throw new InferenceFailedException("Model " + absolute + " declares no input or output");
            }
            Map.Entry<String, NodeInfo> input = inputs.entrySet().iterator().next();
            String outputName = session.getOutputNames().iterator().next();
            long[] shape = input.getValue().getInfo() instanceof TensorInfo tensorInfo
                    ? tensorInfo.getShape()
                    : new long[0];
            ModelHandle handle = describe(type, version, input.getKey(), outputName, shape,
                    new OnnxModelSession(environment, session), absolute);
            log.info("Loaded {} model: input {} {} layout {}, output {}", type, handle.inputName(),
                    Arrays.toString(shape), handle.layout(), outputName);
            return handle;
        } catch (OrtException ex) {
            closeQuietly(session);
            throw new InferenceFailedException("Unable to load model " + absolute, ex);
        } catch (RuntimeException ex) {
            closeQuietly(session);
            throw ex;
        }
    }

    ModelHandle describe(ModelType type, String version, String inputName, String outputName, long[] shape,
            ModelSession session, Path source) {
        TensorLayout layout = TensorLayout.infer(shape);
        int height = defaultImageSize;
        int width = defaultImageSize;
        int featureLength = defaultFeatureLength;
        switch (layout) {
            case CHANNEL_FIRST -> {
                height = dimension(shape, 2, defaultImageSize);
                width = dimension(shape, 3, defaultImageSize);
            }
            case CHANNEL_LAST -> {
                height = dimension(shape, 1, defaultImageSize);
                width = dimension(shape, 2, defaultImageSize);
            }
            case FLAT -> featureLength = dimension(shape, shape.length - 1, defaultFeatureLength);
        }
        return new ModelHandle(type, version, inputName, outputName, layout, shape, height, width, featureLength,
                session, source, Instant.now());
    }

    private static int dimension(long[] shape, int index, int fallback) {
        if (index < 0 || index >= shape.length || shape[index] <= 0) {
            return fallback;
        }
        return (int) shape[index];
    }

    private static void closeQuietly(OrtSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (OrtException e) {
            log.warn("Failed to close OrtSession after load failure", e);
        }
    }
}
