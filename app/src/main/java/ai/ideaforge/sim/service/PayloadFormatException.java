package ai.ideaforge.sim.service;

/**
 * Raised when a JSON payload does not have the shape a mapper expects.
 */
public class PayloadFormatException extends RuntimeException {

    public PayloadFormatException(String message) {
        super(message);
    }

    public PayloadFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
