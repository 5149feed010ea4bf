package ai.ideaforge.sim.model;

import java.util.List;
import java.util.Objects;

/**
 * Side-by-side verdict on two ideas.
 */
public record IdeaComparison(Winner winner, int scoreDifference, List<Factor> factors, String recommendation) {

    public IdeaComparison {
        Objects.requireNonNull(winner, "winner");
        if (scoreDifference < 0) {
            throw new IllegalArgumentException("scoreDifference must not be negative");
        }
        factors = List.copyOf(Objects.requireNonNull(factors, "factors"));
        recommendation = Objects.requireNonNullElse(recommendation, "");
    }

    public enum Winner {
        IDEA1,
        IDEA2,
        TIE;

        public static Winner of(int idea1Score, int idea2Score) {
            if (idea1Score == idea2Score) {
                return TIE;
            }
            return idea1Score > idea2Score ? IDEA1 : IDEA2;
        }
    }

    public record Factor(String factor, int idea1Score, int idea2Score, Winner winner) {

        public Factor {
            factor = Scores.requireNonBlank(factor, "factor");
            Objects.requireNonNull(winner, "winner");
        }
    }
}
