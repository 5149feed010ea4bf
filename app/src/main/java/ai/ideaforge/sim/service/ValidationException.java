package ai.ideaforge.sim.service;

/**
 * Raised when a caller violates an operation precondition. Never produced by a configured scenario.
 */
public class ValidationException extends ServiceException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(message, CODE, 400);
    }
}
