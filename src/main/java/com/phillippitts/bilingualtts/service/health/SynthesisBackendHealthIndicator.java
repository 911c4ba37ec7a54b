package com.phillippitts.bilingualtts.service.health;

import com.phillippitts.bilingualtts.service.synthesis.SynthesisClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the speech synthesis backend.
 *
 * <p>UP when the client reports itself usable, DOWN otherwise. Exposed via /actuator/health.
 */
@Component
public class SynthesisBackendHealthIndicator implements HealthIndicator {

    private final SynthesisClient client;

    public SynthesisBackendHealthIndicator(SynthesisClient client) {
        this.client = client;
    }

    @Override
    public Health health() {
        boolean healthy = client.isHealthy();
        Health.Builder builder = healthy ? Health.up() : Health.down();
        return builder
                .withDetail("client", client.getClientName())
                .withDetail("status", healthy ? "ready" : "unavailable")
                .build();
    }
}
