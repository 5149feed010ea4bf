package ai.ideaforge.sim.fixture;

/**
 * Configuration error in the fixture store. Not meant to be recovered from at runtime.
 */
public class FixtureException extends RuntimeException {

    public FixtureException(String message) {
        super(message);
    }

    public FixtureException(String message, Throwable cause) {
        super(message, cause);
    }
}
