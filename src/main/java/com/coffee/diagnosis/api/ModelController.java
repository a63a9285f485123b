package com.coffee.diagnosis.api;

import com.coffee.diagnosis.api.dto.ModelInfoResponse;
import com.coffee.diagnosis.api.dto.ModelSwapRequest;
import com.coffee.diagnosis.model.ModelType;
import com.coffee.diagnosis.service.inference.InferenceEngine;
import com.coffee.diagnosis.service.store.ModelCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/v1/models", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Model management")
public class ModelController {

    private final InferenceEngine imageEngine;
    private final InferenceEngine symptomEngine;
    private final ModelCatalog catalog;

    public ModelController(@Qualifier("imageInferenceEngine") InferenceEngine imageEngine,
            @Qualifier("symptomInferenceEngine") InferenceEngine symptomEngine, ModelCatalog catalog) {
        this.imageEngine = imageEngine;
        this.symptomEngine = symptomEngine;
        this.catalog = catalog;
    }

    @GetMapping
    @Operation(summary = "Active model per type")
    public List<ModelInfoResponse> models() {
        return List.of(ModelInfoResponse.from(imageEngine), ModelInfoResponse.from(symptomEngine));
    }

    @PostMapping("/{type}/reload")
    @Operation(summary = "Re-probe the model directories and load the default file for a model type")
    public ResponseEntity<ModelInfoResponse> reload(@PathVariable String type) {
        InferenceEngine engine = engine(type);
        engine.reload();
        return ResponseEntity.ok(ModelInfoResponse.from(engine));
    }

    @PostMapping(value = "/{type}/swap", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Hot-swap a model type to another file without restarting")
    public ResponseEntity<ModelInfoResponse> swap(@PathVariable String type, @Valid @RequestBody ModelSwapRequest request) {
        InferenceEngine engine = engine(type);
        Path file = catalog.findModelFile(request.fileName());
        engine.swap(request.version(), file);
        return ResponseEntity.ok(ModelInfoResponse.from(engine));
    }

    private InferenceEngine engine(String type) {
        return ModelType.parse(type) == ModelType.IMAGE ? imageEngine : symptomEngine;
    }
}
