package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.model.HealthStatus;
import java.time.Duration;
import java.util.Optional;

/**
 * Broker used when queueing is switched off. Publishing always fails so submissions fall back
 * to synchronous processing; consumers never receive anything.
 */
public class UnavailableQueueBroker implements QueueBroker {

    private final String reason;

    public UnavailableQueueBroker(String reason) {
        this.reason = reason;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public void publish(String topic, String payload) {
        throw new QueueUnavailableException("Queue is unavailable: " + reason);
    }

    @Override
    public Optional<QueueDelivery> poll(String topic, Duration timeout) {
        return Optional.empty();
    }

    @Override
    public int recoverUnacknowledged(String topic) {
        return 0;
    }

    @Override
    public HealthStatus health() {
        return HealthStatus.up("queue", "disabled (" + reason + "), submissions run synchronously");
    }
}
