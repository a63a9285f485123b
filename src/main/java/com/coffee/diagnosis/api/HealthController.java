package com.coffee.diagnosis.api;

import com.coffee.diagnosis.api.dto.HealthResponse;
import com.coffee.diagnosis.model.HealthStatus;
import com.coffee.diagnosis.service.health.HealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/v1/health", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Health")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping
    @Operation(summary = "Health of every pipeline component")
    public ResponseEntity<HealthResponse> health() {
        List<HealthStatus> statuses = healthService.check();
        boolean healthy = healthService.isHealthy(statuses);
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthResponse(healthy, statuses));
    }
}
