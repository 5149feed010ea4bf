package ai.ideaforge.sim.scenario;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of behaviours a mock service call can be configured to produce.
 */
public enum TestScenario {
    SUCCESS("success", null),
    API_ERROR("api_error", MockErrorType.API_ERROR),
    TIMEOUT("timeout", MockErrorType.TIMEOUT),
    RATE_LIMIT("rate_limit", MockErrorType.RATE_LIMIT),
    INVALID_INPUT("invalid_input", MockErrorType.INVALID_INPUT),
    PARTIAL_RESPONSE("partial_response", null);

    private final String wireName;
    private final MockErrorType errorType;

    TestScenario(String wireName, MockErrorType errorType) {
        this.wireName = wireName;
        this.errorType = errorType;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * The simulated failure this scenario raises, empty for {@link #SUCCESS} and {@link #PARTIAL_RESPONSE}.
     */
    public Optional<MockErrorType> errorType() {
        return Optional.ofNullable(errorType);
    }

    public boolean isFailure() {
        return errorType != null;
    }

    public boolean isPartial() {
        return this == PARTIAL_RESPONSE;
    }

    public static TestScenario from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Scenario must be provided");
        }
        String normalized = raw.trim().replace('-', '_');
        for (TestScenario scenario : values()) {
            if (scenario.wireName.equalsIgnoreCase(normalized)) {
                return scenario;
            }
        }
        throw new IllegalArgumentException("Unsupported scenario: " + raw + " (expected one of "
                + Arrays.stream(values()).map(TestScenario::wireName).collect(Collectors.joining(", ")) + ")");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
