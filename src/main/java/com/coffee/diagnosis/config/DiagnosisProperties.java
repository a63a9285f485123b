package com.coffee.diagnosis.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "diagnosis")
public record DiagnosisProperties(
        ModelProperties model,
        PipelineProperties pipeline,
        CacheProperties cache,
        QueueProperties queue,
        StorageProperties storage) {

    public DiagnosisProperties {
        model = model == null ? new ModelProperties(null, null, null, null, null, 0, true) : model;
        pipeline = pipeline == null ? new PipelineProperties(true, 0, 0, 0, 0) : pipeline;
        cache = cache == null ? new CacheProperties(null, null, 0, null) : cache;
        queue = queue == null ? new QueueProperties(null, null, null, null, null, null, true) : queue;
        storage = storage == null ? new StorageProperties(null, 0, null) : storage;
    }

    public static DiagnosisProperties defaults() {
        return new DiagnosisProperties(null, null, null, null, null);
    }

    public record ModelProperties(
            List<String> directories,
            String imageFile,
            String imageVersion,
            String symptomFile,
            String symptomVersion,
            int inputSize,
            boolean loadOnStartup) {

        public ModelProperties {
            directories = directories == null || directories.isEmpty()
                    ? List.of("./models", "./wwwroot/models")
                    : List.copyOf(directories);
            imageFile = imageFile == null ? "coffee_resnet50_v1.1.onnx" : imageFile;
            imageVersion = imageVersion == null ? "v1.1" : imageVersion;
            symptomFile = symptomFile == null ? "coffee_mlp_v1.0.onnx" : symptomFile;
            symptomVersion = symptomVersion == null ? "v1.0" : symptomVersion;
            inputSize = inputSize <= 0 ? 224 : inputSize;
        }
    }

    public record PipelineProperties(
            boolean ensembleEnabled,
            double leafScoreThreshold,
            double enhancementThreshold,
            double imageWeight,
            int parallelism) {

        public PipelineProperties {
            leafScoreThreshold = leafScoreThreshold <= 0 ? 0.3 : leafScoreThreshold;
            enhancementThreshold = enhancementThreshold <= 0 ? 0.7 : enhancementThreshold;
            imageWeight = imageWeight <= 0 || imageWeight > 1 ? 0.7 : imageWeight;
            parallelism = parallelism <= 0 ? Math.max(2, Runtime.getRuntime().availableProcessors()) : parallelism;
        }
    }

    public record CacheProperties(
            Duration ttl,
            Duration fastTierMaxTtl,
            long fastTierMaximumSize,
            SharedTier shared) {

        public CacheProperties {
            ttl = ttl == null ? Duration.ofDays(7) : ttl;
            fastTierMaxTtl = fastTierMaxTtl == null ? Duration.ofHours(1) : fastTierMaxTtl;
            fastTierMaximumSize = fastTierMaximumSize <= 0 ? 1_000 : fastTierMaximumSize;
            shared = shared == null ? new SharedTier(false, null) : shared;
        }

        public record SharedTier(boolean enabled, String keyPrefix) {

            public SharedTier {
                keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "pred:" : keyPrefix;
            }
        }
    }

    public record QueueProperties(
            String mode,
            String topic,
            Duration publishTimeout,
            Duration pollTimeout,
            String consumerId,
            Duration deadLetterTtl,
            boolean workerEnabled) {

        public QueueProperties {
            mode = mode == null || mode.isBlank() ? "disabled" : mode.trim().toLowerCase();
            topic = topic == null || topic.isBlank() ? "image-processing-queue" : topic;
            publishTimeout = publishTimeout == null ? Duration.ofSeconds(3) : publishTimeout;
            pollTimeout = pollTimeout == null ? Duration.ofSeconds(2) : pollTimeout;
            consumerId = consumerId == null || consumerId.isBlank() ? "worker-1" : consumerId;
            deadLetterTtl = deadLetterTtl == null ? Duration.ofDays(3) : deadLetterTtl;
        }
    }

    public record StorageProperties(
            String uploadDirectory,
            long maxImageBytes,
            List<String> allowedContentTypes) {

        public StorageProperties {
            uploadDirectory = uploadDirectory == null || uploadDirectory.isBlank() ? "./data/uploads" : uploadDirectory;
            maxImageBytes = maxImageBytes <= 0 ? 50L * 1024 * 1024 : maxImageBytes;
            allowedContentTypes = allowedContentTypes == null || allowedContentTypes.isEmpty()
                    ? List.of("image/jpeg", "image/png", "image/bmp", "image/gif")
                    : List.copyOf(allowedContentTypes);
        }
    }
}
