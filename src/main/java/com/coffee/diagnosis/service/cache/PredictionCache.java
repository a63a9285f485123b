package com.coffee.diagnosis.service.cache;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.model.HealthStatus;
import com.coffee.diagnosis.model.ModelType;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.service.health.ComponentHealthCheck;
import com.coffee.diagnosis.service.store.ModelSwappedEvent;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;

/**
 * Lookaside cache of prediction results keyed by image digest.
 *
 * <p>The fast tier is an in-process Caffeine cache whose per-entry TTL never exceeds
 * {@code fastTierMaxTtl}. The shared tier keeps the requested TTL. Keys are namespaced by the
 * active image model version, so results from a replaced model are never served. Shared-tier
 * failures are logged and treated as misses.
 */
public class PredictionCache implements ComponentHealthCheck {

    private static final Logger log = LoggerFactory.getLogger(PredictionCache.class);

    private final Cache<String, FastEntry> fastTier;
    private final SharedCacheTier sharedTier;
    private final Supplier<String> modelVersion;
    private final String keyPrefix;
    private final Duration defaultTtl;
    private final Duration fastTierMaxTtl;
    private final AtomicLong fastHits = new AtomicLong();
    private final AtomicLong sharedHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sharedFailures = new AtomicLong();

    public PredictionCache(SharedCacheTier sharedTier, Supplier<String> modelVersion,
            DiagnosisProperties.CacheProperties properties) {
        this(sharedTier, modelVersion, properties, Ticker.systemTicker());
    }

    PredictionCache(SharedCacheTier sharedTier, Supplier<String> modelVersion,
            DiagnosisProperties.CacheProperties properties, Ticker ticker) {
        this.sharedTier = sharedTier;
        this.modelVersion = modelVersion;
        this.keyPrefix = properties.shared().keyPrefix();
        this.defaultTtl = properties.ttl();
        this.fastTierMaxTtl = properties.fastTierMaxTtl();
        this.fastTier = Caffeine.newBuilder()
                .maximumSize(properties.fastTierMaximumSize())
                .expireAfter(new FastEntryExpiry())
                .ticker(ticker)
                .build();
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public String keyFor(String imageHash) {
        return keyPrefix + modelVersion.get() + ":" + imageHash;
    }

    public Optional<PredictionResult> get(String imageHash) {
        String key = keyFor(imageHash);
        FastEntry entry = fastTier.getIfPresent(key);
        if (entry != null) {
            fastHits.incrementAndGet();
            log.debug("Fast tier hit for {}", key);
            return Optional.of(entry.result());
        }
        Optional<PredictionResult> shared = readShared(key);
        if (shared.isPresent()) {
            sharedHits.incrementAndGet();
            fastTier.put(key, new FastEntry(shared.get(), fastTierTtl(defaultTtl)));
            log.debug("Shared tier hit for {}, repopulated fast tier", key);
            return shared;
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    public void put(String imageHash, PredictionResult result) {
        put(imageHash, result, defaultTtl);
    }

    public void put(String imageHash, PredictionResult result, Duration ttl) {
        String key = keyFor(imageHash);
        fastTier.put(key, new FastEntry(result, fastTierTtl(ttl)));
        try {
            sharedTier.put(key, result, ttl);
        } catch (RuntimeException ex) {
            sharedFailures.incrementAndGet();
            log.warn("Shared cache write failed for {}, continuing with the in-process tier: {}", key,
                    ex.getMessage());
        }
    }

    public void invalidate(String imageHash) {
        String key = keyFor(imageHash);
        fastTier.invalidate(key);
        try {
            sharedTier.evict(key);
        } catch (RuntimeException ex) {
            sharedFailures.incrementAndGet();
            log.warn("Shared cache eviction failed for {}: {}", key, ex.getMessage());
        }
        log.info("Invalidated cached prediction {}", key);
    }

    @EventListener
    public void onModelSwapped(ModelSwappedEvent event) {
        if (event.modelType() == ModelType.IMAGE) {
            long dropped = fastTier.estimatedSize();
            fastTier.invalidateAll();
            log.info("Image model switched to {}, dropped {} fast tier entries", event.version(), dropped);
        }
    }

    Duration fastTierTtl(Duration requested) {
        if (requested == null || requested.isNegative() || requested.isZero()) {
            return fastTierMaxTtl;
        }
        return requested.compareTo(fastTierMaxTtl) > 0 ? fastTierMaxTtl : requested;
    }

    long fastTierSize() {
        fastTier.cleanUp();
        return fastTier.estimatedSize();
    }

    @Override
    public HealthStatus health() {
        return HealthStatus.up("prediction-cache", String.format(
                "fast entries=%d, fast hits=%d, shared hits=%d, misses=%d, shared failures=%d",
                fastTier.estimatedSize(), fastHits.get(), sharedHits.get(), misses.get(), sharedFailures.get()));
    }

    private Optional<PredictionResult> readShared(String key) {
        try {
            return sharedTier.get(key);
        } catch (RuntimeException ex) {
            sharedFailures.incrementAndGet();
            log.warn("Shared cache read failed for {}, treating as miss: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    private record FastEntry(PredictionResult result, Duration ttl) {
    }

    private static final class FastEntryExpiry implements Expiry<String, FastEntry> {

        @Override
        public long expireAfterCreate(String key, FastEntry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, FastEntry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, FastEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
