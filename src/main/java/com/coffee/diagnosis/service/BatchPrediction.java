package com.coffee.diagnosis.service;

import com.coffee.diagnosis.model.PredictionResult;
import java.util.List;

public record BatchPrediction(List<Item> items, int successCount, int failureCount, long totalTimeMs) {

    public record Item(int index, PredictionResult result, String error) {

        public boolean succeeded() {
            return result != null;
        }
    }
}
