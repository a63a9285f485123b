package com.coffee.diagnosis.service.store;

import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.ProcessingMode;
import com.coffee.diagnosis.model.ProcessingRequest;
import com.coffee.diagnosis.model.RequestStatus;
import com.coffee.diagnosis.model.RequestStatusRecord;
import com.coffee.diagnosis.service.health.ComponentHealthCheck;
import java.util.Optional;

/**
 * Request log and prediction rows. Every write is keyed by the request's idempotency token, so
 * replaying a request never adds a second row.
 */
public interface PredictionRepository extends ComponentHealthCheck {

    void recordSubmission(ProcessingRequest request, ProcessingMode mode);

    /**
     * Stores the result for a request, or returns the id already stored for it.
     */
    long savePrediction(String requestId, String imageRef, PredictionResult result);

    void updateRequestStatus(String requestId, RequestStatus status, String error);

    Optional<RequestStatusRecord> getRequestStatus(String requestId);

    Optional<RequestStatusRecord> findLatestByImageRef(String imageRef);

    Optional<PredictionResult> findPrediction(long predictionId);

    int countPredictions(String requestId);
}
