package ai.ideaforge.sim.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Scored critique of an idea or hackathon project.
 *
 * <p>The optional sections are the enrichments a partial response leaves out.
 */
public record AnalysisResult(String title,
                             int score,
                             String summary,
                             String scoreExplanation,
                             Swot swot,
                             List<CriterionScore> criteriaScores,
                             List<String> suggestions,
                             Optional<String> viabilitySummary,
                             Optional<MarketPotential> marketPotential,
                             Optional<TechnicalFeasibility> technicalFeasibility,
                             Optional<BusinessViability> businessViability) {

    public AnalysisResult {
        title = Scores.requireNonBlank(title, "title");
        Scores.requireScore(score, "score");
        summary = Scores.requireNonBlank(summary, "summary");
        scoreExplanation = Objects.requireNonNullElse(scoreExplanation, "");
        Objects.requireNonNull(swot, "swot");
        criteriaScores = List.copyOf(Objects.requireNonNull(criteriaScores, "criteriaScores"));
        suggestions = List.copyOf(suggestions == null ? List.of() : suggestions);
        viabilitySummary = viabilitySummary == null ? Optional.empty() : viabilitySummary;
        marketPotential = marketPotential == null ? Optional.empty() : marketPotential;
        technicalFeasibility = technicalFeasibility == null ? Optional.empty() : technicalFeasibility;
        businessViability = businessViability == null ? Optional.empty() : businessViability;
    }

    public boolean hasEnrichments() {
        return viabilitySummary.isPresent()
                && marketPotential.isPresent()
                && technicalFeasibility.isPresent()
                && businessViability.isPresent();
    }

    public record Swot(List<String> strengths,
                       List<String> weaknesses,
                       List<String> opportunities,
                       List<String> threats) {

        public Swot {
            strengths = List.copyOf(Objects.requireNonNull(strengths, "strengths"));
            weaknesses = List.copyOf(Objects.requireNonNull(weaknesses, "weaknesses"));
            opportunities = List.copyOf(Objects.requireNonNull(opportunities, "opportunities"));
            threats = List.copyOf(Objects.requireNonNull(threats, "threats"));
        }
    }

    public record CriterionScore(String name, int score, String justification) {

        public CriterionScore {
            name = Scores.requireNonBlank(name, "name");
            Scores.requireScore(score, "criterion score");
            justification = Objects.requireNonNullElse(justification, "");
        }
    }

    public record MarketPotential(int score, String analysis, String targetMarket, String marketSize) {

        public MarketPotential {
            Scores.requireScore(score, "market potential score");
            analysis = Objects.requireNonNullElse(analysis, "");
            targetMarket = Objects.requireNonNullElse(targetMarket, "");
            marketSize = Objects.requireNonNullElse(marketSize, "");
        }
    }

    public record TechnicalFeasibility(int score, String analysis, Complexity complexity, List<String> requiredSkills) {

        public TechnicalFeasibility {
            Scores.requireScore(score, "technical feasibility score");
            analysis = Objects.requireNonNullElse(analysis, "");
            complexity = Objects.requireNonNullElse(complexity, Complexity.MEDIUM);
            requiredSkills = List.copyOf(requiredSkills == null ? List.of() : requiredSkills);
        }
    }

    public record BusinessViability(int score, String analysis, List<String> revenueModel, String competitiveAdvantage) {

        public BusinessViability {
            Scores.requireScore(score, "business viability score");
            analysis = Objects.requireNonNullElse(analysis, "");
            revenueModel = List.copyOf(revenueModel == null ? List.of() : revenueModel);
            competitiveAdvantage = Objects.requireNonNullElse(competitiveAdvantage, "");
        }
    }

    public enum Complexity {
        LOW,
        MEDIUM,
        HIGH;

        public static Complexity from(String raw) {
            if (raw == null || raw.isBlank()) {
                return MEDIUM;
            }
            return Complexity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }
    }
}
