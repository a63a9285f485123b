package com.coffee.diagnosis.service.cache;

import com.coffee.diagnosis.model.HealthStatus;
import com.coffee.diagnosis.model.PredictionResult;
import java.time.Duration;
import java.util.Optional;

/**
 * Stand-in used when no shared cache is configured. Every lookup misses.
 */
public class NoOpSharedCacheTier implements SharedCacheTier {

    @Override
    public Optional<PredictionResult> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, PredictionResult result, Duration ttl) {
    }

    @Override
    public void evict(String key) {
    }

    @Override
    public HealthStatus health() {
        return HealthStatus.up("shared-cache", "disabled, running with the in-process tier only");
    }
}
