package ai.ideaforge.sim.model;

import java.util.Objects;

/**
 * Result of a service health probe; {@code latencyMs} is the observed (or simulated) round trip.
 */
public record HealthReport(HealthStatus status, long latencyMs) {

    public HealthReport {
        Objects.requireNonNull(status, "status");
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must not be negative");
        }
    }
}
