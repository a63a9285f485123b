package com.coffee.diagnosis.config;

import com.coffee.diagnosis.service.queue.InMemoryQueueBroker;
import com.coffee.diagnosis.service.queue.QueueBroker;
import com.coffee.diagnosis.service.queue.RedisQueueBroker;
import com.coffee.diagnosis.service.queue.UnavailableQueueBroker;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Picks the queue broker from {@code diagnosis.queue.mode}: {@code redis}, {@code memory}, or
 * anything else for none.
 */
@Configuration
public class QueueConfiguration {

    private static final Logger log = LoggerFactory.getLogger(QueueConfiguration.class);

    @Bean
    public QueueBroker queueBroker(DiagnosisProperties properties, ObjectProvider<StringRedisTemplate> redis) {
        DiagnosisProperties.QueueProperties queue = properties.queue();
        switch (queue.mode()) {
            case "redis" -> {
                StringRedisTemplate template = redis.getIfAvailable();
                if (template == null) {
                    log.warn("Queue mode is redis but no Redis connection is configured");
                    return new UnavailableQueueBroker("redis not configured");
                }
                log.info("Using Redis queue broker on topic {}", queue.topic());
                return new RedisQueueBroker(template, queue.topic(), queue.consumerId(), queue.deadLetterTtl());
            }
            case "memory" -> {
                log.info("Using in-memory queue broker on topic {}", queue.topic());
                return new InMemoryQueueBroker();
            }
            default -> {
                log.info("Queueing disabled, asynchronous submissions run synchronously");
                return new UnavailableQueueBroker("mode " + queue.mode());
            }
        }
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService publishExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "queue-publish");
            thread.setDaemon(true);
            return thread;
        });
    }
}
