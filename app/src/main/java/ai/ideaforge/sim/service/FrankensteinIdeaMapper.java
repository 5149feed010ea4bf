package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.FrankensteinIdea;
import ai.ideaforge.sim.model.FrankensteinMetrics;
import ai.ideaforge.sim.model.Language;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps the snake_case Frankenstein payload onto {@link FrankensteinIdea}.
 */
public class FrankensteinIdeaMapper {

    public FrankensteinIdea toIdea(JsonNode node, Language requestedLanguage) {
        JsonNode metrics = node.path("metrics");
        if (!metrics.isObject()) {
            throw new PayloadFormatException("Missing field 'metrics'");
        }
        try {
            Language language = node.hasNonNull("language")
                    ? Language.from(node.get("language").asText())
                    : requestedLanguage;
            return new FrankensteinIdea(
                    node.path("idea_title").asText(null),
                    node.path("idea_description").asText(null),
                    node.path("core_concept").asText(""),
                    node.path("problem_statement").asText(""),
                    node.path("proposed_solution").asText(""),
                    node.path("unique_value_proposition").asText(""),
                    node.path("target_audience").asText(""),
                    node.path("business_model").asText(""),
                    node.path("growth_strategy").asText(""),
                    node.path("tech_stack_suggestion").asText(""),
                    node.path("risks_and_challenges").asText(""),
                    new FrankensteinMetrics(
                            metric(metrics, "originality_score"),
                            metric(metrics, "feasibility_score"),
                            metric(metrics, "impact_score"),
                            metric(metrics, "scalability_score"),
                            metric(metrics, "wow_factor")),
                    node.path("summary").asText(null),
                    language);
        } catch (IllegalArgumentException ex) {
            throw new PayloadFormatException("Invalid Frankenstein payload: " + ex.getMessage(), ex);
        }
    }

    private static int metric(JsonNode metrics, String field) {
        JsonNode value = metrics.get(field);
        if (value == null || !value.isNumber()) {
            throw new PayloadFormatException("Metric '" + field + "' must be a number");
        }
        return (int) Math.round(value.asDouble());
    }
}
