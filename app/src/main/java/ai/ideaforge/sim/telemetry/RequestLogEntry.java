package ai.ideaforge.sim.telemetry;

import ai.ideaforge.sim.scenario.TestScenario;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One recorded mock call. {@code latencyMs} is the simulated latency drawn for the call, zero when none was applied.
 */
public record RequestLogEntry(Instant timestamp,
                              String operation,
                              TestScenario scenario,
                              long latencyMs,
                              boolean success,
                              Optional<String> error) {

    public RequestLogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(scenario, "scenario");
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must not be negative");
        }
        error = error == null ? Optional.empty() : error;
    }
}
