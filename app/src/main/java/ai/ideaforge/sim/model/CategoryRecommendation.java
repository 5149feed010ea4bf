package ai.ideaforge.sim.model;

import java.util.List;
import java.util.Objects;

/**
 * Best-fitting hackathon category for a project plus ranked alternatives.
 */
public record CategoryRecommendation(String recommendedCategory, int confidence, List<Alternative> alternatives) {

    public CategoryRecommendation {
        recommendedCategory = Scores.requireNonBlank(recommendedCategory, "recommendedCategory");
        Scores.requireScore(confidence, "confidence");
        alternatives = List.copyOf(Objects.requireNonNull(alternatives, "alternatives"));
    }

    public record Alternative(String category, int confidence, String reason) {

        public Alternative {
            category = Scores.requireNonBlank(category, "category");
            Scores.requireScore(confidence, "confidence");
            reason = Objects.requireNonNullElse(reason, "");
        }
    }
}
