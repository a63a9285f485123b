package com.coffee.diagnosis.model;

/**
 * Result of one component health check.
 */
public record HealthStatus(String component, boolean healthy, String detail) {

    public static HealthStatus up(String component, String detail) {
        return new HealthStatus(component, true, detail);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, false, detail);
    }
}
