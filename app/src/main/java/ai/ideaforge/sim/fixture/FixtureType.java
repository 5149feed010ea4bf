package ai.ideaforge.sim.fixture;

import ai.ideaforge.sim.model.Language;
import java.util.List;
import java.util.Locale;

/**
 * Operations the fixture store holds example payloads for, together with the keys each payload must carry.
 */
public enum FixtureType {
    ANALYZER("analyzer",
            List.of("title", "detailedSummary", "finalScore", "finalScoreExplanation", "swotAnalysis",
                    "scoringRubric", "improvementSuggestions"),
            List.of("viabilitySummary", "marketPotential", "technicalFeasibility", "businessViability")),
    HACKATHON("hackathon",
            List.of("title", "detailedSummary", "finalScore", "finalScoreExplanation", "swotAnalysis",
                    "scoringRubric", "improvementSuggestions", "categoryAnalysis"),
            List.of("viabilitySummary", "marketPotential", "technicalFeasibility", "businessViability")),
    FRANKENSTEIN("frankenstein",
            List.of("idea_title", "idea_description", "metrics", "summary", "language"),
            List.of("core_concept", "problem_statement", "proposed_solution", "unique_value_proposition",
                    "target_audience", "business_model", "growth_strategy", "tech_stack_suggestion",
                    "risks_and_challenges"));

    private final String id;
    private final List<String> requiredKeys;
    private final List<String> optionalKeys;

    FixtureType(String id, List<String> requiredKeys, List<String> optionalKeys) {
        this.id = id;
        this.requiredKeys = requiredKeys;
        this.optionalKeys = optionalKeys;
    }

    public String id() {
        return id;
    }

    public List<String> requiredKeys() {
        return requiredKeys;
    }

    /**
     * Enrichment keys a partial response leaves out.
     */
    public List<String> optionalKeys() {
        return optionalKeys;
    }

    public String resourceName(Language language) {
        return "fixtures/" + id + "-" + language.code() + ".json";
    }

    public static FixtureType from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Fixture type must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (FixtureType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported fixture type: " + raw);
    }

    @Override
    public String toString() {
        return id;
    }
}
