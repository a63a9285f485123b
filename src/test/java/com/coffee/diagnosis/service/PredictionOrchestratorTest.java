package com.coffee.diagnosis.service;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.model.DiseaseClass;
import com.coffee.diagnosis.model.ModelType;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.SeverityLevel;
import com.coffee.diagnosis.service.cache.ImageHasher;
import com.coffee.diagnosis.service.cache.NoOpSharedCacheTier;
import com.coffee.diagnosis.service.cache.PredictionCache;
import com.coffee.diagnosis.service.ensemble.ConfidenceAdjuster;
import com.coffee.diagnosis.service.ensemble.EnsembleCombiner;
import com.coffee.diagnosis.service.ensemble.FusionPolicy;
import com.coffee.diagnosis.service.features.FeatureExtractor;
import com.coffee.diagnosis.service.image.DecodeFailedException;
import com.coffee.diagnosis.service.image.ImageDecoder;
import com.coffee.diagnosis.service.image.LeafImage;
import com.coffee.diagnosis.service.image.LeafImageFixtures;
import com.coffee.diagnosis.service.inference.FakeModels;
import com.coffee.diagnosis.service.inference.FakeModels.ScriptedSession;
import com.coffee.diagnosis.service.inference.InferenceEngine;
import com.coffee.diagnosis.service.inference.InferenceFailedException;
import com.coffee.diagnosis.service.inference.ModelHandle;
import com.coffee.diagnosis.service.inference.ModelSession;
import com.coffee.diagnosis.service.preprocessing.AugmentationGenerator;
import com.coffee.diagnosis.service.preprocessing.ImageEnhancer;
import com.coffee.diagnosis.service.preprocessing.TensorCodec;
import com.coffee.diagnosis.service.store.ModelCatalog;
import com.coffee.diagnosis.service.symptom.SymptomClassifier;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PredictionOrchestratorTest {

    private static final byte[] LEAF_BYTES = {1, 1, 1};
    private static final byte[] GREY_BYTES = {2, 2, 2};
    private static final float[] RUST_SCORES = {0f, 0f, 0f, 0f, 5f};

    private final ModelCatalog catalog = mock(ModelCatalog.class);
    private final ImageDecoder decoder = mock(ImageDecoder.class);
    private final FeatureExtractor featureExtractor = new FeatureExtractor();
    private final DiseaseKnowledgeBase knowledgeBase = new DiseaseKnowledgeBase();
    private ExecutorService executor;
    private InferenceEngine imageEngine;
    private ModelHandle nextHandle;
    private PredictionCache cache;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        imageEngine = new InferenceEngine(ModelType.IMAGE, (type, version, file) -> nextHandle, catalog);
        cache = new PredictionCache(new NoOpSharedCacheTier(),
                () -> imageEngine.activeHandle().map(ModelHandle::version).orElse("none"),
                DiagnosisProperties.defaults().cache());
        LeafImage leaf = LeafImageFixtures.stripedLeaf(224);
        LeafImage grey = LeafImageFixtures.uniform(64, 64, 128, 128, 128);
        when(decoder.decode(LEAF_BYTES)).thenReturn(leaf);
        when(decoder.decode(GREY_BYTES)).thenReturn(grey);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void missingModelUsesTheFeatureHeuristic() {
        PredictionResult result = orchestrator(true).predict(LEAF_BYTES, List.of());

        assertThat(result.diseaseName()).isEqualTo("Healthy");
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.modelVersion()).isEqualTo("smart-mock");
        assertThat(result.finalConfidence()).isNull();
    }

    @Test
    void symptomsAreFusedIntoTheHeuristicWhenNoModelIsLoaded() {
        PredictionResult result = orchestrator(true).predict(LEAF_BYTES, List.of(1, 2, 3));

        assertThat(result.modelVersion()).isEqualTo("smart-mock");
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.finalConfidence()).isCloseTo(0.7 * 0.95 + 0.3 * 0.5, within(1e-9));
        assertThat(result.severityLevel()).isEqualTo(SeverityLevel.HIGH);
    }

    @Test
    void ensembleRunsEveryAugmentationAndCachesTheResult() {
        ScriptedSession session = load(RUST_SCORES);
        PredictionOrchestrator orchestrator = orchestrator(true);

        PredictionResult first = orchestrator.predict(LEAF_BYTES, List.of());
        PredictionResult second = orchestrator.predict(LEAF_BYTES, List.of());

        assertThat(first.diseaseName()).isEqualTo(DiseaseClass.RUST.label());
        assertThat(first.confidence()).isEqualTo(0.98);
        assertThat(first.finalConfidence()).isNull();
        assertThat(first.severityLevel()).isEqualTo(SeverityLevel.VERY_HIGH);
        assertThat(first.modelVersion()).isEqualTo("v1.1_ENHANCED");
        assertThat(first.probabilities()).hasSize(5);
        assertThat(first.probabilities().get(0).diseaseName()).isEqualTo("Rust");
        assertThat(first.imageHash()).isEqualTo(new ImageHasher().hash(LEAF_BYTES));
        assertThat(second).isEqualTo(first);
        assertThat(session.calls()).isEqualTo(8);
        assertThat(orchestrator.inferenceRunCount()).isEqualTo(1);
    }

    @Test
    void singlePassWhenEnsembleIsDisabled() {
        ScriptedSession session = load(RUST_SCORES);

        PredictionResult result = orchestrator(false).predict(LEAF_BYTES, List.of());

        assertThat(result.modelVersion()).isEqualTo("v1.1_REAL");
        assertThat(session.calls()).isEqualTo(1);
    }

    @Test
    void symptomsAreFusedIntoTheFinalConfidence() {
        load(RUST_SCORES);

        PredictionResult result = orchestrator(true).predict(LEAF_BYTES, List.of(1, 2, 3));

        assertThat(result.confidence()).isEqualTo(0.98);
        assertThat(result.finalConfidence()).isCloseTo(0.7 * 0.98 + 0.3 * 0.5, within(1e-9));
        assertThat(result.effectiveConfidence()).isEqualTo(result.finalConfidence());
        assertThat(result.severityLevel()).isEqualTo(SeverityLevel.HIGH);
    }

    @Test
    void nonLeafImagesAreRejectedAndNotCached() {
        ScriptedSession session = load(RUST_SCORES);
        PredictionOrchestrator orchestrator = orchestrator(true);

        PredictionResult result = orchestrator.predict(GREY_BYTES, List.of());

        assertThat(result.diseaseName()).isEqualTo(DiseaseClass.NOT_COFFEE_LEAF);
        assertThat(result.isCoffeeLeaf()).isFalse();
        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.severityLevel()).isEqualTo(SeverityLevel.VERY_LOW);
        assertThat(result.modelVersion()).isEqualTo("v1.1_LEAF_GATE");
        assertThat(session.calls()).isZero();
        assertThat(cache.get(new ImageHasher().hash(GREY_BYTES))).isEmpty();
    }

    @Test
    void failingBranchesFallBackToTheHeuristic() {
        load((name, data, shape) -> {
            throw new InferenceFailedException("kernel exploded");
        });

        PredictionResult result = orchestrator(true).predict(LEAF_BYTES, List.of());

        assertThat(result.modelVersion()).isEqualTo("fallback");
        assertThat(result.diseaseName()).isEqualTo("Healthy");
    }

    @Test
    void fallbackResultAlsoFusesSymptoms() {
        load((name, data, shape) -> {
            throw new InferenceFailedException("kernel exploded");
        });

        PredictionResult result = orchestrator(true).predict(LEAF_BYTES, List.of(4));

        assertThat(result.modelVersion()).isEqualTo("fallback");
        assertThat(result.finalConfidence()).isCloseTo(0.7 * result.confidence() + 0.3 * 0.5, within(1e-9));
    }

    @Test
    void undecodableBytesAreTheCallersProblem() {
        when(decoder.decode(any())).thenThrow(new DecodeFailedException("not an image"));

        assertThatThrownBy(() -> orchestrator(true).predict(new byte[] {7}, List.of()))
                .isInstanceOf(DecodeFailedException.class);
    }

    @Test
    void batchReportsEachImage() {
        load(RUST_SCORES);
        when(decoder.decode(new byte[] {3})).thenThrow(new DecodeFailedException("not an image"));

        BatchPrediction batch = orchestrator(true).predictBatch(
                List.of(LEAF_BYTES, new byte[] {3}, GREY_BYTES), List.of());

        assertThat(batch.successCount()).isEqualTo(2);
        assertThat(batch.failureCount()).isEqualTo(1);
        assertThat(batch.items()).extracting(BatchPrediction.Item::succeeded).containsExactly(true, false, true);
        assertThat(batch.items().get(1).error()).isEqualTo("not an image");
    }

    private ScriptedSession load(float... scores) {
        ScriptedSession session = new ScriptedSession(scores);
        load(session);
        return session;
    }

    private void load(ModelSession session) {
        nextHandle = FakeModels.imageHandle("v1.1", session, 32);
        imageEngine.swap("v1.1", Path.of("coffee_resnet50_v1.1.onnx"));
    }

    private PredictionOrchestrator orchestrator(boolean ensembleEnabled) {
        DiagnosisProperties properties = new DiagnosisProperties(null,
                new DiagnosisProperties.PipelineProperties(ensembleEnabled, 0.3, 0.7, 0.7, 4), null, null, null);
        SymptomClassifier symptomClassifier = new SymptomClassifier(
                new InferenceEngine(ModelType.SYMPTOM, (type, version, file) -> null, catalog));
        return new PredictionOrchestrator(
                new ImageHasher(),
                decoder,
                featureExtractor,
                new ImageEnhancer(properties),
                new AugmentationGenerator(),
                new TensorCodec(),
                imageEngine,
                new EnsembleCombiner(),
                new ConfidenceAdjuster(),
                new FusionPolicy(symptomClassifier, properties),
                cache,
                new MockPredictor(featureExtractor, knowledgeBase),
                knowledgeBase,
                executor,
                properties);
    }
}
