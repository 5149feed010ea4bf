package ai.ideaforge.sim.fixture;

import ai.ideaforge.sim.model.Language;
import java.util.List;

/**
 * Raised when a fixture cannot be parsed or lacks the keys its operation needs. Lists every problem found.
 */
public class MalformedFixtureException extends FixtureException {

    private final List<String> problems;

    public MalformedFixtureException(FixtureType type, Language language, List<String> problems) {
        this(type, language, problems, null);
    }

    public MalformedFixtureException(FixtureType type, Language language, List<String> problems, Throwable cause) {
        super("Malformed " + type + " fixture for language '" + language.code() + "': " + String.join("; ", problems), cause);
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
