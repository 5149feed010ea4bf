package ai.ideaforge.sim.fixture;

import ai.ideaforge.sim.model.Language;

public class FixtureNotFoundException extends FixtureException {

    private final FixtureType type;
    private final Language language;

    public FixtureNotFoundException(FixtureType type, Language language, String location) {
        super("No " + type + " fixture for language '" + language.code() + "' at " + location);
        this.type = type;
        this.language = language;
    }

    public FixtureType type() {
        return type;
    }

    public Language language() {
        return language;
    }
}
