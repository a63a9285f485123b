package com.coffee.diagnosis.service.cache;

import com.coffee.diagnosis.model.HealthStatus;
import com.coffee.diagnosis.model.PredictionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Stores predictions as JSON strings in Redis with a per-key expiry.
 */
public class RedisSharedCacheTier implements SharedCacheTier {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    public RedisSharedCacheTier(StringRedisTemplate redis, ObjectMapper objectMapper) {
        this.redis = redis;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<PredictionResult> get(String key) {
        String json;
        try {
            json = redis.opsForValue().get(key);
        } catch (RuntimeException ex) {
            throw new CacheUnavailableException("Redis read failed for " + key, ex);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PredictionResult.class));
        } catch (JsonProcessingException ex) {
            throw new CacheUnavailableException("Unreadable cache entry " + key, ex);
        }
    }

    @Override
    public void put(String key, PredictionResult result, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new CacheUnavailableException("Unable to serialise prediction for " + key, ex);
        }
        try {
            redis.opsForValue().set(key, json, ttl);
        } catch (RuntimeException ex) {
            throw new CacheUnavailableException("Redis write failed for " + key, ex);
        }
    }

    @Override
    public void evict(String key) {
        try {
            redis.delete(key);
        } catch (RuntimeException ex) {
            throw new CacheUnavailableException("Redis delete failed for " + key, ex);
        }
    }

    @Override
    public HealthStatus health() {
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return HealthStatus.up("shared-cache", "redis " + pong);
        } catch (RuntimeException ex) {
            return HealthStatus.down("shared-cache", ex.getMessage());
        }
    }
}
