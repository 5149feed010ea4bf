package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.FrankensteinElement;
import java.util.List;

/**
 * Input checks shared by every implementation of the service contracts.
 */
public final class Preconditions {

    private Preconditions() {
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
        return value;
    }

    public static int requireScore(int score, String field) {
        if (score < 0 || score > 100) {
            throw new ValidationException(field + " must be between 0 and 100 but was " + score);
        }
        return score;
    }

    public static List<FrankensteinElement> requireElements(List<FrankensteinElement> elements) {
        if (elements == null || elements.size() < FrankensteinService.MIN_ELEMENTS) {
            throw new ValidationException("At least two elements are required to generate a Frankenstein idea");
        }
        return List.copyOf(elements);
    }
}
