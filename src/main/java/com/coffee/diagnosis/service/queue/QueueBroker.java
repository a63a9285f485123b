package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.service.health.ComponentHealthCheck;
import java.time.Duration;
import java.util.Optional;

/**
 * Durable at-least-once queue.
 */
public interface QueueBroker extends ComponentHealthCheck {

    boolean isAvailable();

    /**
     * @throws QueueUnavailableException when the message could not be handed to the broker
     */
    void publish(String topic, String payload);

    Optional<QueueDelivery> poll(String topic, Duration timeout);

    /**
     * Moves this consumer's unsettled deliveries back onto the topic.
     *
     * @return number of messages moved
     */
    int recoverUnacknowledged(String topic);
}
