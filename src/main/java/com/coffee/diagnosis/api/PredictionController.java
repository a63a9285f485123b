package com.coffee.diagnosis.api;

import com.coffee.diagnosis.api.dto.BatchPredictionResponse;
import com.coffee.diagnosis.api.dto.PredictionResponse;
import com.coffee.diagnosis.api.dto.RequestStatusResponse;
import com.coffee.diagnosis.api.dto.SubmissionResponse;
import com.coffee.diagnosis.model.PredictionResult;
import com.coffee.diagnosis.model.RequestStatusRecord;
import com.coffee.diagnosis.service.BatchPrediction;
import com.coffee.diagnosis.service.PredictionOrchestrator;
import com.coffee.diagnosis.service.RequestProcessor;
import com.coffee.diagnosis.service.cache.PredictionCache;
import com.coffee.diagnosis.service.queue.AsyncDispatcher;
import com.coffee.diagnosis.service.queue.SubmissionOutcome;
import com.coffee.diagnosis.service.queue.SubmissionStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping(path = "/api/v1/predictions", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Coffee leaf disease prediction")
public class PredictionController {

    private final UploadValidator uploadValidator;
    private final AsyncDispatcher dispatcher;
    private final RequestProcessor requestProcessor;
    private final PredictionOrchestrator orchestrator;
    private final PredictionCache cache;

    public PredictionController(UploadValidator uploadValidator, AsyncDispatcher dispatcher,
            RequestProcessor requestProcessor, PredictionOrchestrator orchestrator, PredictionCache cache) {
        this.uploadValidator = uploadValidator;
        this.dispatcher = dispatcher;
        this.requestProcessor = requestProcessor;
        this.orchestrator = orchestrator;
        this.cache = cache;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Predict the disease on a coffee leaf photograph",
            description = "Runs the prediction synchronously and stores the result",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Prediction result",
                            content = @Content(schema = @Schema(implementation = PredictionResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Missing, oversized or undecodable image")
            })
    public ResponseEntity<PredictionResponse> predict(
            @RequestPart("image") MultipartFile image,
            @RequestParam(value = "symptomIds", required = false) List<Integer> symptomIds,
            @RequestParam(value = "requestId", required = false) String requestId) {
        byte[] bytes = uploadValidator.readValidated(image);
        PredictionResult result = dispatcher.processNow(bytes, symptoms(symptomIds), requestId);
        return ResponseEntity.ok(PredictionResponse.from(result));
    }

    @PostMapping(value = "/async", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Queue a photograph for prediction",
            description = "Returns PROCESSING with a request id to poll, or COMPLETED with the result when the "
                    + "queue is unavailable",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Queued",
                            content = @Content(schema = @Schema(implementation = SubmissionResponse.class))),
                    @ApiResponse(responseCode = "200", description = "Processed synchronously",
                            content = @Content(schema = @Schema(implementation = SubmissionResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid upload")
            })
    public ResponseEntity<SubmissionResponse> submit(
            @RequestPart("image") MultipartFile image,
            @RequestParam(value = "symptomIds", required = false) List<Integer> symptomIds,
            @RequestParam(value = "requestId", required = false) String requestId) {
        byte[] bytes = uploadValidator.readValidated(image);
        SubmissionOutcome outcome = dispatcher.submit(bytes, symptoms(symptomIds), requestId);
        HttpStatus status = outcome.status() == SubmissionStatus.PROCESSING ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(SubmissionResponse.from(outcome));
    }

    @PostMapping(value = "/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Predict several photographs in one call",
            description = "Each image is predicted independently; failures are reported per image")
    public ResponseEntity<BatchPredictionResponse> predictBatch(
            @RequestPart("images") List<MultipartFile> images,
            @RequestParam(value = "symptomIds", required = false) List<Integer> symptomIds) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("At least one image is required");
        }
        List<byte[]> accepted = new ArrayList<>();
        List<Integer> acceptedIndexes = new ArrayList<>();
        List<BatchPredictionResponse.Item> rejected = new ArrayList<>();
        for (int i = 0; i < images.size(); i++) {
            MultipartFile image = images.get(i);
            try {
                accepted.add(uploadValidator.readValidated(image));
                acceptedIndexes.add(i);
            } catch (IllegalArgumentException ex) {
                rejected.add(new BatchPredictionResponse.Item(i, image.getOriginalFilename(), null, ex.getMessage()));
            }
        }
        BatchPrediction batch = orchestrator.predictBatch(accepted, symptoms(symptomIds));
        List<BatchPredictionResponse.Item> items = new ArrayList<>(rejected);
        for (BatchPrediction.Item item : batch.items()) {
            int index = acceptedIndexes.get(item.index());
            items.add(new BatchPredictionResponse.Item(index, images.get(index).getOriginalFilename(),
                    item.succeeded() ? PredictionResponse.from(item.result()) : null, item.error()));
        }
        items.sort((left, right) -> Integer.compare(left.index(), right.index()));
        return ResponseEntity.ok(new BatchPredictionResponse(images.size(), batch.successCount(),
                batch.failureCount() + rejected.size(), batch.totalTimeMs(), items));
    }

    @GetMapping("/requests/{requestId}")
    @Operation(summary = "Latest status and result of a submitted request")
    public ResponseEntity<RequestStatusResponse> requestStatus(@PathVariable String requestId) {
        RequestStatusRecord status = requestProcessor.status(requestId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown request " + requestId));
        return ResponseEntity.ok(toStatusResponse(status));
    }

    @GetMapping("/images/{imageRef}/status")
    @Operation(summary = "Latest status and result recorded for an uploaded image")
    public ResponseEntity<RequestStatusResponse> imageStatus(@PathVariable String imageRef) {
        RequestStatusRecord status = requestProcessor.statusForImage(imageRef)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown image " + imageRef));
        return ResponseEntity.ok(toStatusResponse(status));
    }

    @DeleteMapping("/cache/{imageHash}")
    @Operation(summary = "Drop the cached prediction for an image digest")
    public ResponseEntity<Void> invalidate(@PathVariable String imageHash) {
        cache.invalidate(imageHash);
        return ResponseEntity.noContent().build();
    }

    private RequestStatusResponse toStatusResponse(RequestStatusRecord status) {
        PredictionResponse result = requestProcessor.resultFor(status).map(PredictionResponse::from).orElse(null);
        return RequestStatusResponse.from(status, result);
    }

    private static List<Integer> symptoms(List<Integer> symptomIds) {
        return symptomIds == null ? List.of() : symptomIds;
    }
}
