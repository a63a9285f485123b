package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.model.HealthStatus;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Reliable queue on Redis lists. Producers push to {@code queue:<topic>}. A consumer atomically
 * moves each message onto its own {@code queue:<topic>:processing:<consumer>} list, removes it
 * from there on ack, and on reject also pushes it to {@code queue:<topic>:dead}, which expires
 * after the dead-letter TTL.
 */
public class RedisQueueBroker implements QueueBroker {

    private static final Logger log = LoggerFactory.getLogger(RedisQueueBroker.class);

    private final StringRedisTemplate redis;
    private final String healthTopic;
    private final String consumerId;
    private final Duration deadLetterTtl;

    public RedisQueueBroker(StringRedisTemplate redis, String healthTopic, String consumerId, Duration deadLetterTtl) {
        this.redis = redis;
        this.healthTopic = healthTopic;
        this.consumerId = consumerId;
        this.deadLetterTtl = deadLetterTtl;
    }

    static String queueKey(String topic) {
        return "queue:" + topic;
    }

    static String processingKey(String topic, String consumerId) {
        return "queue:" + topic + ":processing:" + consumerId;
    }

    static String deadLetterKey(String topic) {
        return "queue:" + topic + ":dead";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void publish(String topic, String payload) {
        try {
            redis.opsForList().leftPush(queueKey(topic), payload);
        } catch (RuntimeException ex) {
            throw new QueueUnavailableException("Unable to publish to " + topic, ex);
        }
    }

    @Override
    public Optional<QueueDelivery> poll(String topic, Duration timeout) {
        String processing = processingKey(topic, consumerId);
        String payload;
        try {
            payload = redis.opsForList().rightPopAndLeftPush(queueKey(topic), processing, timeout);
        } catch (RuntimeException ex) {
            throw new QueueUnavailableException("Unable to poll " + topic, ex);
        }
        if (payload == null) {
            return Optional.empty();
        }
        return Optional.of(new RedisDelivery(topic, processing, payload));
    }

    @Override
    public int recoverUnacknowledged(String topic) {
        ListOperations<String, String> lists = redis.opsForList();
        String processing = processingKey(topic, consumerId);
        int moved = 0;
        try {
            while (lists.rightPopAndLeftPush(processing, queueKey(topic)) != null) {
                moved++;
            }
        } catch (RuntimeException ex) {
            throw new QueueUnavailableException("Unable to requeue messages from " + processing, ex);
        }
        if (moved > 0) {
            log.info("Requeued {} unacknowledged messages from {}", moved, processing);
        }
        return moved;
    }

    void pushToDeadLetters(String topic, String payload) {
        String key = deadLetterKey(topic);
        redis.opsForList().leftPush(key, payload);
        redis.expire(key, deadLetterTtl);
    }

    @Override
    public HealthStatus health() {
        try {
            Long depth = redis.opsForList().size(queueKey(healthTopic));
            return HealthStatus.up("queue", "redis, " + depth + " pending on " + healthTopic);
        } catch (RuntimeException ex) {
            return HealthStatus.down("queue", ex.getMessage());
        }
    }

    private final class RedisDelivery implements QueueDelivery {

        private final String topic;
        private final String processing;
        private final String payload;

        private RedisDelivery(String topic, String processing, String payload) {
            this.topic = topic;
            this.processing = processing;
            this.payload = payload;
        }

        @Override
        public String payload() {
            return payload;
        }

        @Override
        public void ack() {
            try {
                redis.opsForList().remove(processing, 1, payload);
            } catch (RuntimeException ex) {
                throw new QueueUnavailableException("Unable to acknowledge message on " + topic, ex);
            }
        }

        @Override
        public void reject(String reason) {
            try {
                pushToDeadLetters(topic, payload);
                redis.opsForList().remove(processing, 1, payload);
            } catch (RuntimeException ex) {
                throw new QueueUnavailableException("Unable to dead-letter message on " + topic, ex);
            }
            log.warn("Dead-lettered message on {}: {}", topic, reason);
        }
    }
}
