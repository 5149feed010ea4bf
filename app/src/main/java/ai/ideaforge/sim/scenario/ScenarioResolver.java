package ai.ideaforge.sim.scenario;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides which scenario governs a call: a per-call override when one is set, otherwise the configured default.
 */
public final class ScenarioResolver {

    private final TestScenario defaultScenario;

    public ScenarioResolver(TestScenario defaultScenario) {
        this.defaultScenario = Objects.requireNonNull(defaultScenario, "defaultScenario");
    }

    public TestScenario defaultScenario() {
        return defaultScenario;
    }

    public TestScenario resolve(Optional<TestScenario> override) {
        return override == null ? defaultScenario : override.orElse(defaultScenario);
    }

    /**
     * Builds the failure for the given scenario, or empty when the scenario lets the call through.
     */
    public Optional<MockServiceException> failureFor(TestScenario scenario, String operation) {
        return scenario.errorType().map(type -> new MockServiceException(type, scenario, operation));
    }
}
