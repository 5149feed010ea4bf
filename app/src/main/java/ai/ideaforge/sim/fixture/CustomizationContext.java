package ai.ideaforge.sim.fixture;

import ai.ideaforge.sim.model.FrankensteinElement;
import ai.ideaforge.sim.model.FrankensteinMode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Caller input a fixture is customized against.
 *
 * @param inputText   idea text, project description, or the joined element names
 * @param variability whether scores are perturbed beyond text substitution
 */
public record CustomizationContext(String inputText,
                                   Optional<String> projectName,
                                   List<FrankensteinElement> elements,
                                   Optional<FrankensteinMode> mode,
                                   boolean variability) {

    public CustomizationContext {
        inputText = Objects.requireNonNullElse(inputText, "");
        projectName = projectName == null ? Optional.empty() : projectName;
        elements = List.copyOf(elements == null ? List.of() : elements);
        mode = mode == null ? Optional.empty() : mode;
    }

    public static CustomizationContext forText(String inputText, boolean variability) {
        return new CustomizationContext(inputText, Optional.empty(), List.of(), Optional.empty(), variability);
    }

    public static CustomizationContext forProject(String projectName, String description, boolean variability) {
        return new CustomizationContext(description, Optional.ofNullable(projectName).filter(name -> !name.isBlank()),
                List.of(), Optional.empty(), variability);
    }

    public static CustomizationContext forElements(List<FrankensteinElement> elements, FrankensteinMode mode,
                                                   boolean variability) {
        String joined = elements.stream().map(FrankensteinElement::name).collect(Collectors.joining(" + "));
        return new CustomizationContext(joined, Optional.empty(), elements, Optional.ofNullable(mode), variability);
    }

    /**
     * Seed for score jitter; a pure function of the input so equal inputs always jitter alike.
     */
    int seed() {
        return 31 * inputText.length() + inputText.hashCode();
    }
}
