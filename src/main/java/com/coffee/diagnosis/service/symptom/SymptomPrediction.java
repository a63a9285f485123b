package com.coffee.diagnosis.service.symptom;

import com.coffee.diagnosis.model.ClassProbability;
import java.util.List;

public record SymptomPrediction(
        String diseaseName,
        double confidence,
        List<ClassProbability> probabilities,
        boolean reliable,
        String modelVersion,
        int symptomCount) {
}
