package com.coffee.diagnosis.service.ensemble;

import com.coffee.diagnosis.model.ClassProbability;
import com.coffee.diagnosis.model.DiseaseClass;
import com.coffee.diagnosis.service.features.LeafFeatures;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Votes over the top label of each augmentation branch. The label whose votes carry the highest
 * mean confidence wins; agreement across at least three branches earns a stability bonus that
 * shrinks as the spread between the branch confidences grows. Branches that failed are simply
 * missing from the input.
 */
@Component
public class EnsembleCombiner {

    private static final Logger log = LoggerFactory.getLogger(EnsembleCombiner.class);

    static final int MIN_MEMBERS_FOR_BONUS = 3;
    static final double BONUS_WEIGHT = 0.1;
    static final double MIN_CONFIDENCE = 0.01;
    static final double MAX_CONFIDENCE = 0.99;

    public EnsembleDecision combine(List<ClassProbability> votes, LeafFeatures features) {
        if (votes == null || votes.isEmpty()) {
            throw new EmptyEnsembleException("Every augmentation branch failed, nothing to combine");
        }
        Map<String, Group> groups = new LinkedHashMap<>();
        for (ClassProbability vote : votes) {
            groups.computeIfAbsent(vote.diseaseName(), Group::new).observe(vote.confidence());
        }

        Group winner = null;
        for (Group group : groups.values()) {
            if (winner == null
                    || group.mean() > winner.mean()
                    || (group.mean() == winner.mean() && group.count > winner.count)) {
                winner = group;
            }
        }

        double bonus = winner.count >= MIN_MEMBERS_FOR_BONUS
                ? (1.0 - (winner.max - winner.min)) * BONUS_WEIGHT
                : 0.0;
        double confidence = winner.mean() + bonus;
        if (DiseaseClass.HEALTHY.label().equals(winner.label) && features.greenRatio() < 0.3) {
            confidence *= 0.8;
        }
        if (DiseaseClass.MINER.label().equals(winner.label) && features.avgTexture() < 10) {
            confidence *= 0.7;
        }
        confidence = Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));

        log.debug("Ensemble picked {} from {} of {} votes (mean {}, bonus {}, final {})",
                winner.label, winner.count, votes.size(), winner.mean(), bonus, confidence);
        return new EnsembleDecision(winner.label, confidence, winner.count, votes.size(), winner.mean(), bonus);
    }

    private static final class Group {

        private final String label;
        private int count;
        private double sum;
        private double min = Double.MAX_VALUE;
        private double max = -Double.MAX_VALUE;

        private Group(String label) {
            this.label = label;
        }

        private void observe(double confidence) {
            count++;
            sum += confidence;
            min = Math.min(min, confidence);
            max = Math.max(max, confidence);
        }

        private double mean() {
            return sum / count;
        }
    }
}
