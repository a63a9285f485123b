package com.coffee.diagnosis.service.symptom;

import com.coffee.diagnosis.model.ClassProbability;
import com.coffee.diagnosis.model.DiseaseClass;
import com.coffee.diagnosis.service.inference.InferenceEngine;
import com.coffee.diagnosis.service.inference.InferenceOutput;
import com.coffee.diagnosis.service.inference.InputTensor;
import com.coffee.diagnosis.service.inference.ModelHandle;
import com.coffee.diagnosis.service.inference.ModelNotFoundException;
import com.coffee.diagnosis.service.inference.Softmax;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a disease from caller-reported symptom identifiers. Identifier {@code k} sets slot
 * {@code k - 1} of the indicator vector; identifiers outside the vector are ignored. Without a
 * loaded model the classifier answers with a flat distribution.
 */
public class SymptomClassifier {

    private static final Logger log = LoggerFactory.getLogger(SymptomClassifier.class);

    public static final int DEFAULT_FEATURE_LENGTH = 20;
    public static final String FALLBACK_VERSION = "symptom-rules";
    static final int MIN_SYMPTOMS_FOR_RELIABILITY = 3;
    static final double FALLBACK_CONFIDENCE = 0.5;

    private final InferenceEngine engine;

    public SymptomClassifier(InferenceEngine engine) {
        this.engine = engine;
    }

    /** The rule fallback is always there, so the classifier is always available. */
    public boolean isAvailable() {
        return true;
    }

    public boolean isModelLoaded() {
        return engine.isReady();
    }

    public SymptomPrediction predict(List<Integer> symptomIds) {
        List<Integer> ids = symptomIds == null ? List.of() : symptomIds;
        if (!engine.isReady()) {
            return fallback(ids.size());
        }
        InferenceOutput output;
        try {
            output = engine.run(handle -> encode(ids, handle));
        } catch (ModelNotFoundException ex) {
            log.debug("Symptom model unloaded mid-request, using rule fallback");
            return fallback(ids.size());
        }
        double[] probabilities = toProbabilities(output.scores());
        List<ClassProbability> ranked = rank(probabilities);
        ClassProbability top = ranked.get(0);
        boolean reliable = ids.size() >= MIN_SYMPTOMS_FOR_RELIABILITY;
        return new SymptomPrediction(top.diseaseName(), top.confidence(), ranked, reliable,
                output.handle().version(), ids.size());
    }

    static InputTensor encode(List<Integer> symptomIds, ModelHandle handle) {
        int length = handle.featureLength() > 0 ? handle.featureLength() : DEFAULT_FEATURE_LENGTH;
        return new InputTensor(encode(symptomIds, length), new long[] {1, length});
    }

    static float[] encode(List<Integer> symptomIds, int length) {
        float[] vector = new float[length];
        for (Integer id : symptomIds) {
            if (id != null && id >= 1 && id <= length) {
                vector[id - 1] = 1f;
            }
        }
        return vector;
    }

    /**
     * Uses the scores directly when they already form a distribution, otherwise applies softmax.
     */
    static double[] toProbabilities(float[] scores) {
        int classes = Math.min(scores.length, DiseaseClass.values().length);
        float[] relevant = new float[classes];
        System.arraycopy(scores, 0, relevant, 0, classes);
        double sum = 0.0;
        boolean bounded = true;
        for (float score : relevant) {
            sum += score;
            bounded &= score >= 0f && score <= 1f;
        }
        if (bounded && Math.abs(sum - 1.0) < 1e-3) {
            double[] copy = new double[classes];
            for (int i = 0; i < classes; i++) {
                copy[i] = relevant[i];
            }
            return copy;
        }
        return Softmax.apply(relevant);
    }

    private static List<ClassProbability> rank(double[] probabilities) {
        List<ClassProbability> ranked = new ArrayList<>(probabilities.length);
        for (int i = 0; i < probabilities.length; i++) {
            ranked.add(new ClassProbability(DiseaseClass.fromIndex(i).label(), probabilities[i]));
        }
        ranked.sort(Comparator.comparingDouble(ClassProbability::confidence).reversed());
        return List.copyOf(ranked);
    }

    private static SymptomPrediction fallback(int symptomCount) {
        double share = 1.0 / DiseaseClass.values().length;
        List<ClassProbability> uniform = DiseaseClass.labels().stream()
                .map(label -> new ClassProbability(label, share))
                .toList();
        return new SymptomPrediction(DiseaseClass.HEALTHY.label(), FALLBACK_CONFIDENCE, uniform, false,
                FALLBACK_VERSION, symptomCount);
    }
}
