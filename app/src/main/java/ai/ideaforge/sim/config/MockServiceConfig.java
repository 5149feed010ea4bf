package ai.ideaforge.sim.config;

import ai.ideaforge.sim.scenario.TestScenario;
import java.util.Objects;

/**
 * Behaviour switches of the mock services. Immutable; the mocks read it once at construction.
 */
public record MockServiceConfig(TestScenario defaultScenario,
                                boolean enableVariability,
                                boolean simulateLatency,
                                int minLatencyMs,
                                int maxLatencyMs,
                                boolean logRequests) {

    public static final int DEFAULT_MIN_LATENCY_MS = 500;
    public static final int DEFAULT_MAX_LATENCY_MS = 2000;

    public MockServiceConfig {
        Objects.requireNonNull(defaultScenario, "defaultScenario");
        if (minLatencyMs < 0) {
            throw new IllegalArgumentException("minLatencyMs must be zero or greater");
        }
        if (minLatencyMs > maxLatencyMs) {
            throw new IllegalArgumentException("minLatencyMs (" + minLatencyMs
                    + ") must not exceed maxLatencyMs (" + maxLatencyMs + ")");
        }
    }

    public static MockServiceConfig defaults() {
        return new MockServiceConfig(TestScenario.SUCCESS, false, false,
                DEFAULT_MIN_LATENCY_MS, DEFAULT_MAX_LATENCY_MS, true);
    }

    public MockServiceConfig withScenario(TestScenario scenario) {
        return new MockServiceConfig(scenario, enableVariability, simulateLatency, minLatencyMs, maxLatencyMs, logRequests);
    }

    public MockServiceConfig withVariability(boolean enabled) {
        return new MockServiceConfig(defaultScenario, enabled, simulateLatency, minLatencyMs, maxLatencyMs, logRequests);
    }

    public MockServiceConfig withLatency(int minMs, int maxMs) {
        return new MockServiceConfig(defaultScenario, enableVariability, true, minMs, maxMs, logRequests);
    }

    public MockServiceConfig withRequestLogging(boolean enabled) {
        return new MockServiceConfig(defaultScenario, enableVariability, simulateLatency, minLatencyMs, maxLatencyMs, enabled);
    }
}
