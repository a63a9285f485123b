package com.coffee.diagnosis.service.queue;

/**
 * One message handed to a consumer. Exactly one of {@link #ack()} or {@link #reject(String)}
 * should be called; an unsettled delivery is redelivered after the consumer restarts.
 */
public interface QueueDelivery {

    String payload();

    void ack();

    /**
     * Settles the delivery as failed. It is parked on the topic's dead-letter list and never
     * requeued.
     */
    void reject(String reason);
}
