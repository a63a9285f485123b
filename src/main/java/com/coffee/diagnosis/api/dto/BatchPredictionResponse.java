package com.coffee.diagnosis.api.dto;

import java.util.List;

public record BatchPredictionResponse(
        int totalImages,
        int successCount,
        int failureCount,
        long totalTimeMs,
        List<Item> items) {

    public record Item(int index, String fileName, PredictionResponse result, String error) {
    }
}
