package com.coffee.diagnosis.config;

import com.coffee.diagnosis.service.cache.NoOpSharedCacheTier;
import com.coffee.diagnosis.service.cache.PredictionCache;
import com.coffee.diagnosis.service.cache.RedisSharedCacheTier;
import com.coffee.diagnosis.service.cache.SharedCacheTier;
import com.coffee.diagnosis.service.inference.InferenceEngine;
import com.coffee.diagnosis.service.inference.ModelHandle;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class CacheConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CacheConfiguration.class);

    @Bean
    public SharedCacheTier sharedCacheTier(DiagnosisProperties properties,
            ObjectProvider<StringRedisTemplate> redis, ObjectMapper objectMapper) {
        StringRedisTemplate template = redis.getIfAvailable();
        if (properties.cache().shared().enabled() && template != null) {
            log.info("Prediction cache uses Redis as its shared tier");
            return new RedisSharedCacheTier(template, objectMapper);
        }
        log.info("Shared prediction cache disabled, using the in-process tier only");
        return new NoOpSharedCacheTier();
    }

    @Bean
    public PredictionCache predictionCache(SharedCacheTier sharedCacheTier,
            @Qualifier("imageInferenceEngine") InferenceEngine imageEngine, DiagnosisProperties properties) {
        return new PredictionCache(sharedCacheTier,
                () -> imageEngine.activeHandle().map(ModelHandle::version).orElse("none"),
                properties.cache());
    }
}
