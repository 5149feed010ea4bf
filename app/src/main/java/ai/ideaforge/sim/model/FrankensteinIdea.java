package ai.ideaforge.sim.model;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Generated mashup idea. Enrichment sections are empty strings when the generator omitted them.
 */
public record FrankensteinIdea(String ideaTitle,
                               String ideaDescription,
                               String coreConcept,
                               String problemStatement,
                               String proposedSolution,
                               String uniqueValueProposition,
                               String targetAudience,
                               String businessModel,
                               String growthStrategy,
                               String techStackSuggestion,
                               String risksAndChallenges,
                               FrankensteinMetrics metrics,
                               String summary,
                               Language language) {

    public FrankensteinIdea {
        ideaTitle = Scores.requireNonBlank(ideaTitle, "ideaTitle");
        ideaDescription = Scores.requireNonBlank(ideaDescription, "ideaDescription");
        coreConcept = Objects.requireNonNullElse(coreConcept, "");
        problemStatement = Objects.requireNonNullElse(problemStatement, "");
        proposedSolution = Objects.requireNonNullElse(proposedSolution, "");
        uniqueValueProposition = Objects.requireNonNullElse(uniqueValueProposition, "");
        targetAudience = Objects.requireNonNullElse(targetAudience, "");
        businessModel = Objects.requireNonNullElse(businessModel, "");
        growthStrategy = Objects.requireNonNullElse(growthStrategy, "");
        techStackSuggestion = Objects.requireNonNullElse(techStackSuggestion, "");
        risksAndChallenges = Objects.requireNonNullElse(risksAndChallenges, "");
        Objects.requireNonNull(metrics, "metrics");
        summary = Scores.requireNonBlank(summary, "summary");
        Objects.requireNonNull(language, "language");
    }

    public boolean hasEnrichments() {
        return Stream.of(coreConcept, problemStatement, proposedSolution, uniqueValueProposition, targetAudience,
                        businessModel, growthStrategy, techStackSuggestion, risksAndChallenges)
                .noneMatch(String::isEmpty);
    }
}
