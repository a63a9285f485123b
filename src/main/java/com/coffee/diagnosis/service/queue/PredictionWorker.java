package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.model.ProcessingRequest;
import com.coffee.diagnosis.service.RequestProcessor;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single consumer of the processing queue. A delivery is acknowledged only after its result has
 * been persisted; a processing failure rejects it without requeueing. A delivery whose ack fails
 * stays in flight and is redelivered on recovery. Broker errors never end the consume loop. On
 * shutdown the in-progress message is finished before the loop exits.
 */
@Component
public class PredictionWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PredictionWorker.class);

    private final QueueBroker broker;
    private final ProcessingRequestCodec codec;
    private final RequestProcessor processor;
    private final String topic;
    private final Duration pollTimeout;
    private final boolean enabled;

    private volatile boolean running;
    private Thread thread;

    public PredictionWorker(QueueBroker broker, ProcessingRequestCodec codec, RequestProcessor processor,
            DiagnosisProperties properties) {
        this.broker = broker;
        this.codec = codec;
        this.processor = processor;
        this.topic = properties.queue().topic();
        this.pollTimeout = properties.queue().pollTimeout();
        this.enabled = properties.queue().workerEnabled();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!enabled || !broker.isAvailable()) {
            log.info("Prediction worker not started (enabled: {}, queue available: {})", enabled,
                    broker.isAvailable());
            return;
        }
        try {
            broker.recoverUnacknowledged(topic);
        } catch (QueueUnavailableException ex) {
            log.warn("Could not requeue unacknowledged messages on {}: {}", topic, ex.getMessage());
        }
        running = true;
        thread = new Thread(this::consumeLoop, "prediction-worker");
        thread.setDaemon(true);
        thread.start();
        log.info("Prediction worker consuming {}", topic);
    }

    @Override
    public void stop() {
        Thread current;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            current = thread;
        }
        try {
            current.join(pollTimeout.toMillis() * 2 + 30_000);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        log.info("Prediction worker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Handles at most one delivery.
     *
     * @return {@code true} when a message was received
     */
    boolean pollOnce() {
        Optional<QueueDelivery> delivery = broker.poll(topic, pollTimeout);
        delivery.ifPresent(this::handle);
        return delivery.isPresent();
    }

    void handle(QueueDelivery delivery) {
        ProcessingRequest request;
        try {
            request = codec.decode(delivery.payload());
        } catch (IllegalArgumentException ex) {
            reject(delivery, ex.getMessage());
            return;
        }
        try {
            processor.process(request);
        } catch (RuntimeException ex) {
            log.error("Request {} failed, rejecting without requeue", request.requestId(), ex);
            reject(delivery, ex.getMessage());
            return;
        }
        try {
            delivery.ack();
            log.debug("Acknowledged request {}", request.requestId());
        } catch (RuntimeException ex) {
            // Stays in flight and comes back on recovery; the stored result is keyed by requestId.
            log.warn("Request {} succeeded but could not be acknowledged: {}", request.requestId(),
                    ex.getMessage());
        }
    }

    private void reject(QueueDelivery delivery, String reason) {
        try {
            delivery.reject(reason);
        } catch (RuntimeException ex) {
            log.warn("Unable to dead-letter a message on {}: {}", topic, ex.getMessage());
        }
    }

    private void consumeLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (QueueUnavailableException ex) {
                log.warn("Queue poll failed: {}", ex.getMessage());
                pause();
            } catch (RuntimeException ex) {
                log.error("Unexpected failure in the consume loop on {}", topic, ex);
                pause();
            }
        }
    }

    private void pause() {
        try {
            Thread.sleep(pollTimeout.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
