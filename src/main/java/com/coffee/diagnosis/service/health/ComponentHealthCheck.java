package com.coffee.diagnosis.service.health;

import com.coffee.diagnosis.model.HealthStatus;

@FunctionalInterface
public interface ComponentHealthCheck {

    HealthStatus health();
}
