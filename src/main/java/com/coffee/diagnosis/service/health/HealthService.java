package com.coffee.diagnosis.service.health;

import com.coffee.diagnosis.model.HealthStatus;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class HealthService {

    private static final Logger log = LoggerFactory.getLogger(HealthService.class);

    private final List<ComponentHealthCheck> checks;

    public HealthService(List<ComponentHealthCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public List<HealthStatus> check() {
        List<HealthStatus> statuses = new ArrayList<>(checks.size());
        for (ComponentHealthCheck check : checks) {
            try {
                statuses.add(check.health());
            } catch (RuntimeException ex) {
                log.warn("Health check {} threw", check.getClass().getSimpleName(), ex);
                statuses.add(HealthStatus.down(check.getClass().getSimpleName(), ex.getMessage()));
            }
        }
        return statuses;
    }

    /**
     * Overall health ignores the models: a missing model degrades predictions but does not take the
     * service down.
     */
    public boolean isHealthy(List<HealthStatus> statuses) {
        return statuses.stream()
                .filter(status -> !status.component().endsWith("-model"))
                .allMatch(HealthStatus::healthy);
    }
}
