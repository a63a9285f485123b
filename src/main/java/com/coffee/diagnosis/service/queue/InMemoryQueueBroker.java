package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.model.HealthStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-process broker with the same settle semantics as the Redis one. Messages are lost on
 * restart, so it suits development and tests.
 */
public class InMemoryQueueBroker implements QueueBroker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryQueueBroker.class);

    private final Map<String, BlockingDeque<String>> queues = new ConcurrentHashMap<>();
    private final Map<String, List<String>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, List<String>> deadLetters = new ConcurrentHashMap<>();

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void publish(String topic, String payload) {
        queue(topic).offerFirst(payload);
    }

    @Override
    public Optional<QueueDelivery> poll(String topic, Duration timeout) {
        String payload;
        try {
            payload = queue(topic).pollLast(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        if (payload == null) {
            return Optional.empty();
        }
        inFlight(topic).add(payload);
        return Optional.of(new InMemoryDelivery(topic, payload));
    }

    @Override
    public int recoverUnacknowledged(String topic) {
        List<String> pending = inFlight(topic);
        int moved = 0;
        for (String payload : new ArrayList<>(pending)) {
            if (pending.remove(payload)) {
                queue(topic).offerLast(payload);
                moved++;
            }
        }
        return moved;
    }

    public int pending(String topic) {
        return queue(topic).size();
    }

    public int inFlightCount(String topic) {
        return inFlight(topic).size();
    }

    public List<String> deadLetters(String topic) {
        return List.copyOf(deadLetters.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()));
    }

    @Override
    public HealthStatus health() {
        int depth = queues.values().stream().mapToInt(BlockingDeque::size).sum();
        return HealthStatus.up("queue", "in-memory, " + depth + " pending");
    }

    private BlockingDeque<String> queue(String topic) {
        return queues.computeIfAbsent(topic, key -> new LinkedBlockingDeque<>());
    }

    private List<String> inFlight(String topic) {
        return inFlight.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>());
    }

    private final class InMemoryDelivery implements QueueDelivery {

        private final String topic;
        private final String payload;

        private InMemoryDelivery(String topic, String payload) {
            this.topic = topic;
            this.payload = payload;
        }

        @Override
        public String payload() {
            return payload;
        }

        @Override
        public void ack() {
            inFlight(topic).remove(payload);
        }

        @Override
        public void reject(String reason) {
            inFlight(topic).remove(payload);
            deadLetters.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()).add(payload);
            log.warn("Dead-lettered message on {}: {}", topic, reason);
        }
    }
}
