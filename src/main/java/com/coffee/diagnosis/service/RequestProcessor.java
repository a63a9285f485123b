package com.coffee.diagnosis.service;

import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.ProcessingRequest;
import com.coffee.diagnosis.model.RequestStatus;
import com.coffee.diagnosis.model.RequestStatusRecord;
import com.coffee.diagnosis.service.store.ImageStore;
import com.coffee.diagnosis.service.store.PredictionRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes a stored {@link ProcessingRequest} and records the outcome. Both the synchronous
 * endpoints and the queue worker go through here, so a request's status row looks the same
 * however it was processed.
 */
@Service
public class RequestProcessor {

    private static final Logger log = LoggerFactory.getLogger(RequestProcessor.class);

    private final ImageStore imageStore;
    private final PredictionRepository repository;
    private final PredictionOrchestrator orchestrator;

    public RequestProcessor(ImageStore imageStore, PredictionRepository repository,
            PredictionOrchestrator orchestrator) {
        this.imageStore = imageStore;
        this.repository = repository;
        this.orchestrator = orchestrator;
    }

    /**
     * Runs the request unless it already succeeded, in which case the stored result is returned.
     * Failures are recorded against the request and rethrown.
     */
    public PredictionResult process(ProcessingRequest request) {
        Optional<PredictionResult> existing = completedResult(request.requestId());
        if (existing.isPresent()) {
            log.info("Request {} already completed, returning stored prediction", request.requestId());
            return existing.get();
        }
        repository.updateRequestStatus(request.requestId(), RequestStatus.PROCESSING, null);
        try {
            byte[] imageBytes = imageStore.read(request.imageRef());
            PredictionResult result = orchestrator.predict(imageBytes, request.symptomIds());
            long predictionId = repository.savePrediction(request.requestId(), request.imageRef(), result);
            repository.updateRequestStatus(request.requestId(), RequestStatus.SUCCESS, null);
            return result.withId(predictionId);
        } catch (RuntimeException ex) {
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            repository.updateRequestStatus(request.requestId(), RequestStatus.FAILED, message);
            throw ex;
        }
    }

    public Optional<RequestStatusRecord> status(String requestId) {
        return repository.getRequestStatus(requestId);
    }

    public Optional<RequestStatusRecord> statusForImage(String imageRef) {
        return repository.findLatestByImageRef(imageRef);
    }

    public Optional<PredictionResult> resultFor(RequestStatusRecord status) {
        if (status.predictionId() == null) {
            return Optional.empty();
        }
        return repository.findPrediction(status.predictionId());
    }

    private Optional<PredictionResult> completedResult(String requestId) {
        return repository.getRequestStatus(requestId)
                .filter(status -> status.status() == RequestStatus.SUCCESS)
                .flatMap(this::resultFor);
    }
}
