package com.coffee.diagnosis.api.dto;

import com.coffee.diagnosis.model.HealthStatus;
import java.util.List;

public record HealthResponse(boolean healthy, List<HealthStatus> components) {
}
