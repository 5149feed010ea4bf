package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.AnalysisResult;
import ai.ideaforge.sim.model.AnalysisResult.BusinessViability;
import ai.ideaforge.sim.model.AnalysisResult.Complexity;
import ai.ideaforge.sim.model.AnalysisResult.CriterionScore;
import ai.ideaforge.sim.model.AnalysisResult.MarketPotential;
import ai.ideaforge.sim.model.AnalysisResult.Swot;
import ai.ideaforge.sim.model.AnalysisResult.TechnicalFeasibility;
import ai.ideaforge.sim.model.CategoryRecommendation;
import ai.ideaforge.sim.model.CategoryRecommendation.Alternative;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Maps analysis payloads (the analyzer and hackathon JSON shape) onto the domain records.
 */
public class AnalysisResultMapper {

    public AnalysisResult toAnalysisResult(JsonNode node) {
        try {
            return new AnalysisResult(
                    requiredText(node, "title"),
                    score(requiredNode(node, "finalScore")),
                    requiredText(node, "detailedSummary"),
                    node.path("finalScoreExplanation").asText(""),
                    toSwot(requiredNode(node, "swotAnalysis")),
                    stream(node.path("scoringRubric"))
                            .map(item -> new CriterionScore(item.path("name").asText(), score(item.path("score")),
                                    item.path("justification").asText("")))
                            .collect(Collectors.toList()),
                    toSuggestions(node),
                    optionalText(node, "viabilitySummary"),
                    optionalSection(node, "marketPotential").map(section -> new MarketPotential(
                            score(section.path("score")),
                            section.path("analysis").asText(""),
                            section.path("targetMarket").asText(""),
                            section.path("marketSize").asText(""))),
                    optionalSection(node, "technicalFeasibility").map(section -> new TechnicalFeasibility(
                            score(section.path("score")),
                            section.path("analysis").asText(""),
                            Complexity.from(section.path("complexity").asText(null)),
                            texts(section.path("requiredSkills")))),
                    optionalSection(node, "businessViability").map(section -> new BusinessViability(
                            score(section.path("score")),
                            section.path("analysis").asText(""),
                            texts(section.path("revenueModel")),
                            section.path("competitiveAdvantage").asText(""))));
        } catch (IllegalArgumentException ex) {
            throw new PayloadFormatException("Invalid analysis payload: " + ex.getMessage(), ex);
        }
    }

    /**
     * Suggestion titles of the payload, in payload order. Plain strings are accepted as well as objects.
     */
    public List<String> toSuggestions(JsonNode node) {
        return stream(node.path("improvementSuggestions"))
                .map(item -> item.isTextual() ? item.asText() : item.path("title").asText(""))
                .filter(text -> !text.isBlank())
                .collect(Collectors.toList());
    }

    /**
     * Ranks the category evaluations of a hackathon payload. Fit scores on the 0-10 scale become percentages.
     */
    public CategoryRecommendation toCategoryRecommendation(JsonNode node) {
        JsonNode analysis = node.has("categoryAnalysis") ? node.get("categoryAnalysis") : node;
        List<JsonNode> evaluations = new ArrayList<>();
        analysis.path("evaluations").forEach(evaluations::add);
        if (evaluations.isEmpty()) {
            throw new PayloadFormatException("Category analysis has no evaluations");
        }
        evaluations.sort(Comparator.comparingDouble((JsonNode evaluation) -> evaluation.path("fitScore").asDouble()).reversed());
        String bestMatch = analysis.path("bestMatch").asText(evaluations.get(0).path("category").asText());
        try {
            JsonNode best = evaluations.stream()
                    .filter(evaluation -> evaluation.path("category").asText().equals(bestMatch))
                    .findFirst()
                    .orElse(evaluations.get(0));
            List<Alternative> alternatives = evaluations.stream()
                    .filter(evaluation -> evaluation != best)
                    .map(evaluation -> new Alternative(
                            evaluation.path("category").asText(),
                            fitToConfidence(evaluation.path("fitScore")),
                            evaluation.path("explanation").asText("")))
                    .collect(Collectors.toList());
            return new CategoryRecommendation(best.path("category").asText(), fitToConfidence(best.path("fitScore")), alternatives);
        } catch (IllegalArgumentException ex) {
            throw new PayloadFormatException("Invalid category analysis: " + ex.getMessage(), ex);
        }
    }

    private Swot toSwot(JsonNode node) {
        return new Swot(texts(node.path("strengths")), texts(node.path("weaknesses")),
                texts(node.path("opportunities")), texts(node.path("threats")));
    }

    private static int fitToConfidence(JsonNode fitScore) {
        if (!fitScore.isNumber()) {
            throw new PayloadFormatException("fitScore must be a number");
        }
        return (int) Math.round(fitScore.asDouble() * 10);
    }

    private static int score(JsonNode node) {
        if (node == null || !node.isNumber()) {
            throw new PayloadFormatException("Expected a numeric score but found " + (node == null ? "nothing" : node.getNodeType()));
        }
        return (int) Math.round(node.asDouble());
    }

    private static JsonNode requiredNode(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new PayloadFormatException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String requiredText(JsonNode node, String field) {
        String value = requiredNode(node, field).asText("");
        if (value.isBlank()) {
            throw new PayloadFormatException("Field '" + field + "' must not be blank");
        }
        return value;
    }

    private static Optional<String> optionalText(JsonNode node, String field) {
        return Optional.ofNullable(node.get(field))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(value -> !value.isBlank());
    }

    private static Optional<JsonNode> optionalSection(JsonNode node, String field) {
        return Optional.ofNullable(node.get(field)).filter(JsonNode::isObject);
    }

    private static List<String> texts(JsonNode array) {
        return stream(array).map(JsonNode::asText).filter(value -> !value.isBlank()).collect(Collectors.toList());
    }

    private static Stream<JsonNode> stream(JsonNode array) {
        return StreamSupport.stream(array.spliterator(), false);
    }
}
