package com.coffee.diagnosis.service;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.model.ClassProbability;
import com.coffee.diagnosis.model.DiseaseClass;
import com.coffee.diagnosis.model.PipelineVariant;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.SeverityLevel;
import com.coffee.diagnosis.service.cache.ImageHasher;
import com.coffee.diagnosis.service.cache.PredictionCache;
import com.coffee.diagnosis.service.ensemble.ConfidenceAdjuster;
import com.coffee.diagnosis.service.ensemble.EnsembleCombiner;
import com.coffee.diagnosis.service.ensemble.EnsembleDecision;
import com.coffee.diagnosis.service.ensemble.FusionOutcome;
import com.coffee.diagnosis.service.ensemble.FusionPolicy;
import com.coffee.diagnosis.service.features.FeatureExtractor;
import com.coffee.diagnosis.service.features.ImageAnalysis;
import com.coffee.diagnosis.service.image.DecodeFailedException;
import com.coffee.diagnosis.service.image.ImageDecoder;
import com.coffee.diagnosis.service.image.LeafImage;
import com.coffee.diagnosis.service.inference.InferenceEngine;
import com.coffee.diagnosis.service.inference.InferenceOutput;
import com.coffee.diagnosis.service.inference.Softmax;
import com.coffee.diagnosis.service.preprocessing.Augmentation;
import com.coffee.diagnosis.service.preprocessing.AugmentationGenerator;
import com.coffee.diagnosis.service.preprocessing.ImageEnhancer;
import com.coffee.diagnosis.service.preprocessing.TensorCodec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one image through the prediction pipeline:
 *
 * <pre>
 * cache check -> model ready? -> quality and leaf analysis -> leaf gate -> enhance
 *   -> augment -> infer per variant -> ensemble -> confidence adjust -> fuse -> cache write
 * </pre>
 *
 * A missing model routes to the mock predictor, and so does any unexpected failure after
 * decoding. Undecodable bytes are the only error a caller sees.
 */
@Service
public class PredictionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PredictionOrchestrator.class);

    private final ImageHasher hasher;
    private final ImageDecoder decoder;
    private final FeatureExtractor featureExtractor;
    private final ImageEnhancer enhancer;
    private final AugmentationGenerator augmentationGenerator;
    private final TensorCodec tensorCodec;
    private final InferenceEngine imageEngine;
    private final EnsembleCombiner ensembleCombiner;
    private final ConfidenceAdjuster confidenceAdjuster;
    private final FusionPolicy fusionPolicy;
    private final PredictionCache cache;
    private final MockPredictor mockPredictor;
    private final DiseaseKnowledgeBase knowledgeBase;
    private final ExecutorService augmentationExecutor;
    private final DiagnosisProperties.PipelineProperties pipeline;
    private final AtomicLong inferenceRuns = new AtomicLong();

    public PredictionOrchestrator(
            ImageHasher hasher,
            ImageDecoder decoder,
            FeatureExtractor featureExtractor,
            ImageEnhancer enhancer,
            AugmentationGenerator augmentationGenerator,
            TensorCodec tensorCodec,
            @Qualifier("imageInferenceEngine") InferenceEngine imageEngine,
            EnsembleCombiner ensembleCombiner,
            ConfidenceAdjuster confidenceAdjuster,
            FusionPolicy fusionPolicy,
            PredictionCache cache,
            MockPredictor mockPredictor,
            DiseaseKnowledgeBase knowledgeBase,
            @Qualifier("augmentationExecutor") ExecutorService augmentationExecutor,
            DiagnosisProperties properties) {
        this.hasher = hasher;
        this.decoder = decoder;
        this.featureExtractor = featureExtractor;
        this.enhancer = enhancer;
        this.augmentationGenerator = augmentationGenerator;
        this.tensorCodec = tensorCodec;
        this.imageEngine = imageEngine;
        this.ensembleCombiner = ensembleCombiner;
        this.confidenceAdjuster = confidenceAdjuster;
        this.fusionPolicy = fusionPolicy;
        this.cache = cache;
        this.mockPredictor = mockPredictor;
        this.knowledgeBase = knowledgeBase;
        this.augmentationExecutor = augmentationExecutor;
        this.pipeline = properties.pipeline();
    }

    /**
     * @throws DecodeFailedException when the bytes are not an image
     */
    public PredictionResult predict(byte[] imageBytes, List<Integer> symptomIds) {
        long start = System.nanoTime();
        String imageHash = hasher.hash(imageBytes);
        Optional<PredictionResult> cached = cache.get(imageHash);
        if (cached.isPresent()) {
            log.debug("Serving cached prediction for {}", imageHash);
            return cached.get();
        }

        LeafImage image = decoder.decode(imageBytes);
        ImageAnalysis analysis = null;
        try {
            if (!imageEngine.isReady()) {
                log.warn("Image model not loaded, using mock prediction");
                return fuseSymptoms(
                        mockPredictor.predict(image, null, PipelineVariant.SMART_MOCK, imageHash, start), symptomIds);
            }
            analysis = featureExtractor.analyze(image);
            double leafScore = analysis.leaf().coffeeLeafScore();
            log.debug("Quality {} leaf score {} for {}", analysis.quality().qualityScore(), leafScore, imageHash);
            if (leafScore < pipeline.leafScoreThreshold()) {
                log.info("Leaf score {} below {}, rejecting image {}", leafScore, pipeline.leafScoreThreshold(),
                        imageHash);
                return notCoffeeLeaf(leafScore, imageHash, start);
            }
            PredictionResult result = runModel(image, analysis, symptomIds, imageHash, start);
            cache.put(imageHash, result);
            log.info("Predicted {} ({}, final {}) via {} in {} ms", result.diseaseName(), result.confidence(),
                    result.finalConfidence(), result.modelVersion(), result.processingTimeMs());
            return result;
        } catch (RuntimeException ex) {
            log.error("Prediction pipeline failed for {}, falling back to mock prediction", imageHash, ex);
            return fallback(image, analysis, symptomIds, imageHash, start);
        }
    }

    public BatchPrediction predictBatch(List<byte[]> images, List<Integer> symptomIds) {
        long start = System.nanoTime();
        List<BatchPrediction.Item> items = new ArrayList<>(images.size());
        int succeeded = 0;
        for (int i = 0; i < images.size(); i++) {
            try {
                items.add(new BatchPrediction.Item(i, predict(images.get(i), symptomIds), null));
                succeeded++;
            } catch (RuntimeException ex) {
                log.warn("Batch item {} failed: {}", i, ex.getMessage());
                items.add(new BatchPrediction.Item(i, null, ex.getMessage()));
            }
        }
        long elapsed = (System.nanoTime() - start) / 1_000_000;
        log.info("Batch of {} images finished: {} succeeded in {} ms", images.size(), succeeded, elapsed);
        return new BatchPrediction(List.copyOf(items), succeeded, images.size() - succeeded, elapsed);
    }

    /** Number of predictions that reached the model, cache hits excluded. */
    public long inferenceRunCount() {
        return inferenceRuns.get();
    }

    private PredictionResult runModel(LeafImage image, ImageAnalysis analysis, List<Integer> symptomIds,
            String imageHash, long start) {
        inferenceRuns.incrementAndGet();
        LeafImage base = enhancer.enhance(image, analysis);
        List<Augmentation> augmentations = pipeline.ensembleEnabled()
                ? List.of(Augmentation.values())
                : List.of(Augmentation.IDENTITY);
        List<BranchResult> branches = runBranches(base, augmentations);

        List<ClassProbability> votes = branches.stream().map(BranchResult::top).toList();
        EnsembleDecision decision = ensembleCombiner.combine(votes, analysis.leaf());
        double adjusted = confidenceAdjuster.adjust(decision.confidence(), analysis.quality(), analysis.leaf());
        FusionOutcome fusion = fusionPolicy.fuse(adjusted, symptomIds);

        Double finalConfidence = fusion.fused() ? fusion.finalConfidence() : null;
        double severityBasis = finalConfidence != null ? finalConfidence : adjusted;
        PipelineVariant variant = pipeline.ensembleEnabled() ? PipelineVariant.ENHANCED : PipelineVariant.REAL;
        String modelVersion = branches.get(0).modelVersion();
        return new PredictionResult(
                null,
                decision.diseaseName(),
                adjusted,
                finalConfidence,
                SeverityLevel.fromConfidence(severityBasis),
                variant.tag(modelVersion),
                elapsedMillis(start),
                Instant.now(),
                knowledgeBase.describeWithQuality(decision.diseaseName(), analysis.quality()),
                knowledgeBase.treatment(decision.diseaseName()),
                averageDistribution(branches),
                imageHash);
    }

    /**
     * Runs every branch on the augmentation pool and waits for all of them. Failed branches are
     * dropped; the combiner decides whether what is left is enough.
     */
    private List<BranchResult> runBranches(LeafImage base, List<Augmentation> augmentations) {
        List<CompletableFuture<Optional<BranchResult>>> futures = augmentations.stream()
                .map(augmentation -> CompletableFuture.supplyAsync(() -> runBranch(base, augmentation),
                        augmentationExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<BranchResult> results = futures.stream()
                .map(CompletableFuture::join)
                .flatMap(Optional::stream)
                .toList();
        log.debug("{} of {} augmentation branches produced a prediction", results.size(), augmentations.size());
        return results;
    }

    private Optional<BranchResult> runBranch(LeafImage base, Augmentation augmentation) {
        try {
            LeafImage variant = augmentationGenerator.apply(base, augmentation);
            InferenceOutput output = imageEngine.run(handle -> tensorCodec.encode(variant, handle));
            return Optional.of(BranchResult.of(augmentation, output));
        } catch (RuntimeException ex) {
            log.warn("Dropping augmentation branch {}: {}", augmentation, ex.getMessage());
            return Optional.empty();
        }
    }

    private PredictionResult notCoffeeLeaf(double leafScore, String imageHash, long start) {
        double confidence = 1.0 - leafScore;
        String version = imageEngine.activeHandle().map(handle -> handle.version()).orElse(null);
        return new PredictionResult(
                null,
                DiseaseClass.NOT_COFFEE_LEAF,
                confidence,
                null,
                SeverityLevel.VERY_LOW,
                PipelineVariant.NOT_A_LEAF.tag(version),
                elapsedMillis(start),
                Instant.now(),
                knowledgeBase.notCoffeeLeafDescription(leafScore),
                knowledgeBase.notCoffeeLeafTreatment(),
                List.of(),
                imageHash);
    }

    private PredictionResult fallback(LeafImage image, ImageAnalysis analysis, List<Integer> symptomIds,
            String imageHash, long start) {
        try {
            return fuseSymptoms(
                    mockPredictor.predict(image, analysis, PipelineVariant.FALLBACK, imageHash, start), symptomIds);
        } catch (RuntimeException ex) {
            log.error("Mock prediction failed as well for {}", imageHash, ex);
            return mockPredictor.minimal(imageHash, start);
        }
    }

    private PredictionResult fuseSymptoms(PredictionResult mock, List<Integer> symptomIds) {
        FusionOutcome fusion = fusionPolicy.fuse(mock.confidence(), symptomIds);
        return fusion.fused() ? mock.withFinalConfidence(fusion.finalConfidence()) : mock;
    }

    private static List<ClassProbability> averageDistribution(List<BranchResult> branches) {
        int classes = branches.stream().mapToInt(branch -> branch.probabilities().length).min().orElse(0);
        List<ClassProbability> distribution = new ArrayList<>(classes);
        for (int i = 0; i < classes; i++) {
            double sum = 0.0;
            for (BranchResult branch : branches) {
                sum += branch.probabilities()[i];
            }
            distribution.add(new ClassProbability(DiseaseClass.fromIndex(i).label(), sum / branches.size()));
        }
        distribution.sort(Comparator.comparingDouble(ClassProbability::confidence).reversed());
        return distribution;
    }

    private static long elapsedMillis(long startNanos) {
        return Math.max(0, (System.nanoTime() - startNanos) / 1_000_000);
    }

    private record BranchResult(Augmentation augmentation, double[] probabilities, String modelVersion) {

        static BranchResult of(Augmentation augmentation, InferenceOutput output) {
            float[] scores = output.scores();
            int classes = Math.min(scores.length, DiseaseClass.values().length);
            float[] relevant = new float[classes];
            System.arraycopy(scores, 0, relevant, 0, classes);
            return new BranchResult(augmentation, Softmax.apply(relevant), output.handle().version());
        }

        ClassProbability top() {
            int best = 0;
            for (int i = 1; i < probabilities.length; i++) {
                if (probabilities[i] > probabilities[best]) {
                    best = i;
                }
            }
            return new ClassProbability(DiseaseClass.fromIndex(best).label(), probabilities[best]);
        }
    }
}
