package com.coffee.diagnosis.service.cache;

import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.service.health.ComponentHealthCheck;
import java.time.Duration;
import java.util.Optional;

/**
 * Distributed tier of the prediction cache. Implementations signal trouble with
 * {@link CacheUnavailableException}; the caller decides how to degrade.
 */
public interface SharedCacheTier extends ComponentHealthCheck {

    Optional<PredictionResult> get(String key);

    void put(String key, PredictionResult result, Duration ttl);

    void evict(String key);
}
