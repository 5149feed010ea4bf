package ai.ideaforge.sim.scenario;

/**
 * Simulated upstream failures, each with the HTTP status and message a real outage would surface.
 */
public enum MockErrorType {
    API_ERROR(500, "API error", "Simulated server error for testing error handling"),
    TIMEOUT(408, "timeout", "Simulated request timeout for testing timeout handling"),
    RATE_LIMIT(429, "rate limit", "Simulated rate limit exceeded for testing rate limiting"),
    INVALID_INPUT(400, "invalid input", "Simulated invalid input for testing validation");

    private final int httpStatus;
    private final String messageFragment;
    private final String detail;

    MockErrorType(int httpStatus, String messageFragment, String detail) {
        this.httpStatus = httpStatus;
        this.messageFragment = messageFragment;
        this.detail = detail;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String code() {
        return name();
    }

    public String messageFragment() {
        return messageFragment;
    }

    public String messageFor(String operation) {
        return "Mock " + messageFragment + " in " + operation + ": " + detail;
    }
}
