package com.coffee.diagnosis.service.queue;

import com.coffee.diagnosis.config.DiagnosisProperties;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.ProcessingMode;
import com.coffee.diagnosis.model.ProcessingRequest;
import com.coffee.diagnosis.service.RequestProcessor;
import com.coffee.diagnosis.service.store.ImageStore;
import com.coffee.diagnosis.service.store.PredictionRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Accepts prediction submissions. The upload is stored and logged first, then published to the
 * processing queue. When the broker refuses the message or does not answer within the publish
 * timeout, the request runs synchronously and the caller gets a completed response instead.
 */
@Service
public class AsyncDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AsyncDispatcher.class);

    private final ImageStore imageStore;
    private final PredictionRepository repository;
    private final QueueBroker broker;
    private final ProcessingRequestCodec codec;
    private final RequestProcessor processor;
    private final ExecutorService publishExecutor;
    private final String topic;
    private final Duration publishTimeout;

    public AsyncDispatcher(ImageStore imageStore, PredictionRepository repository, QueueBroker broker,
            ProcessingRequestCodec codec, RequestProcessor processor,
            @Qualifier("publishExecutor") ExecutorService publishExecutor, DiagnosisProperties properties) {
        this.imageStore = imageStore;
        this.repository = repository;
        this.broker = broker;
        this.codec = codec;
        this.processor = processor;
        this.publishExecutor = publishExecutor;
        this.topic = properties.queue().topic();
        this.publishTimeout = properties.queue().publishTimeout();
    }

    public SubmissionOutcome submit(byte[] imageBytes, List<Integer> symptomIds, String requestId) {
        ProcessingRequest request = store(imageBytes, symptomIds, requestId, ProcessingMode.ASYNC);
        try {
            publish(codec.encode(request));
            log.info("Queued request {} for image {}", request.requestId(), request.imageRef());
            return SubmissionOutcome.queued(request);
        } catch (QueueUnavailableException ex) {
            // a timed out publish may still land; the worker then finds the request already done
            log.warn("Queue unavailable for request {}, processing synchronously: {}", request.requestId(),
                    ex.getMessage());
            PredictionResult result = processor.process(request);
            return SubmissionOutcome.completed(request, result);
        }
    }

    /**
     * Stores and runs a request on the calling thread.
     */
    public PredictionResult processNow(byte[] imageBytes, List<Integer> symptomIds, String requestId) {
        ProcessingRequest request = store(imageBytes, symptomIds, requestId, ProcessingMode.SYNC);
        return processor.process(request);
    }

    private ProcessingRequest store(byte[] imageBytes, List<Integer> symptomIds, String requestId,
            ProcessingMode mode) {
        String imageRef = imageStore.save(imageBytes);
        String id = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
        ProcessingRequest request = new ProcessingRequest(id, imageRef, symptomIds, Instant.now());
        repository.recordSubmission(request, mode);
        return request;
    }

    private void publish(String payload) {
        CompletableFuture<Void> publication =
                CompletableFuture.runAsync(() -> broker.publish(topic, payload), publishExecutor);
        try {
            publication.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new QueueUnavailableException("Publish timed out after " + publishTimeout, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof QueueUnavailableException unavailable) {
                throw unavailable;
            }
            throw new QueueUnavailableException("Publish failed", cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new QueueUnavailableException("Interrupted while publishing", ex);
        }
    }
}
