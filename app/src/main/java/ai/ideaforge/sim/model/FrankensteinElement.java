package ai.ideaforge.sim.model;

import java.util.Optional;

/**
 * One ingredient of a Frankenstein mashup: a company, product or AWS service.
 */
public record FrankensteinElement(String name, Optional<String> description) {

    public FrankensteinElement {
        name = Scores.requireNonBlank(name, "name").trim();
        description = description == null ? Optional.empty() : description.filter(value -> !value.isBlank());
    }

    public static FrankensteinElement of(String name) {
        return new FrankensteinElement(name, Optional.empty());
    }

    public static FrankensteinElement of(String name, String description) {
        return new FrankensteinElement(name, Optional.ofNullable(description));
    }
}
