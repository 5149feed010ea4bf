package ai.ideaforge.sim.scenario;

import ai.ideaforge.sim.service.ServiceException;
import java.util.Objects;

/**
 * Failure produced by a mock service because its scenario says so. A new instance is created for every failing call.
 */
public class MockServiceException extends ServiceException {

    private final MockErrorType errorType;
    private final TestScenario scenario;
    private final String operation;

    public MockServiceException(MockErrorType errorType, TestScenario scenario, String operation) {
        super(Objects.requireNonNull(errorType, "errorType").messageFor(operation), errorType.code(), errorType.httpStatus());
        this.errorType = errorType;
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.operation = operation;
    }

    public MockErrorType errorType() {
        return errorType;
    }

    public TestScenario scenario() {
        return scenario;
    }

    public String operation() {
        return operation;
    }
}
