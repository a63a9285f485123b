package com.coffee.diagnosis.service.health;

import com.coffee.diagnosis.model.HealthStatus;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HealthServiceTest {

    @Test
    void throwingChecksAreReportedDown() {
        HealthService service = new HealthService(List.of(
                () -> HealthStatus.up("queue", "ok"),
                () -> {
                    throw new IllegalStateException("connection reset");
                }));

        List<HealthStatus> statuses = service.check();

        assertThat(statuses).hasSize(2);
        assertThat(statuses.get(1).healthy()).isFalse();
        assertThat(statuses.get(1).detail()).isEqualTo("connection reset");
        assertThat(service.isHealthy(statuses)).isFalse();
    }

    @Test
    void unloadedModelsDoNotFailOverallHealth() {
        HealthService service = new HealthService(List.of(
                () -> HealthStatus.up("persistence", "ok"),
                () -> HealthStatus.down("image-model", "not loaded")));

        assertThat(service.isHealthy(service.check())).isTrue();
    }
}
