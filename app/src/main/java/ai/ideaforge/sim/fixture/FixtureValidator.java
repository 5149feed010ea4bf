package ai.ideaforge.sim.fixture;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a fixture tree has every key its operation needs and that all scores are in range.
 */
public class FixtureValidator {

    private static final List<String> SWOT_KEYS = List.of("strengths", "weaknesses", "opportunities", "threats");
    private static final List<String> ANALYSIS_SECTIONS = List.of("marketPotential", "technicalFeasibility", "businessViability");
    private static final List<String> METRIC_KEYS = List.of("originality_score", "feasibility_score", "impact_score",
            "scalability_score", "wow_factor");

    public List<String> validate(FixtureType type, JsonNode root) {
        List<String> problems = new ArrayList<>();
        if (root == null || !root.isObject()) {
            problems.add("fixture root must be a JSON object");
            return problems;
        }
        for (String key : type.requiredKeys()) {
            if (!root.hasNonNull(key)) {
                problems.add("missing required key '" + key + "'");
            }
        }
        switch (type) {
            case ANALYZER -> validateAnalysis(root, problems);
            case HACKATHON -> {
                validateAnalysis(root, problems);
                validateCategories(root.path("categoryAnalysis"), problems);
            }
            case FRANKENSTEIN -> validateFrankenstein(root, problems);
        }
        return problems;
    }

    private void validateAnalysis(JsonNode root, List<String> problems) {
        checkTextIfPresent(root, "title", problems);
        checkTextIfPresent(root, "detailedSummary", problems);
        if (root.has("finalScore")) {
            checkScore(root.get("finalScore"), "finalScore", 100, problems);
        }
        JsonNode swot = root.path("swotAnalysis");
        if (!swot.isMissingNode()) {
            for (String key : SWOT_KEYS) {
                if (!swot.path(key).isArray()) {
                    problems.add("'swotAnalysis." + key + "' must be an array");
                }
            }
        }
        JsonNode rubric = root.path("scoringRubric");
        if (!rubric.isMissingNode()) {
            if (!rubric.isArray() || rubric.isEmpty()) {
                problems.add("'scoringRubric' must be a non-empty array");
            } else {
                for (int i = 0; i < rubric.size(); i++) {
                    String path = "scoringRubric[" + i + "]";
                    checkText(rubric.get(i), "name", path + ".name", problems);
                    checkScore(rubric.get(i).get("score"), path + ".score", 100, problems);
                }
            }
        }
        JsonNode suggestions = root.path("improvementSuggestions");
        if (!suggestions.isMissingNode() && !suggestions.isArray()) {
            problems.add("'improvementSuggestions' must be an array");
        }
        for (String section : ANALYSIS_SECTIONS) {
            JsonNode node = root.path(section);
            if (!node.isMissingNode() && !node.isNull()) {
                checkScore(node.get("score"), section + ".score", 100, problems);
            }
        }
    }

    private void validateCategories(JsonNode categoryAnalysis, List<String> problems) {
        if (categoryAnalysis.isMissingNode() || categoryAnalysis.isNull()) {
            return;
        }
        JsonNode evaluations = categoryAnalysis.path("evaluations");
        if (!evaluations.isArray() || evaluations.isEmpty()) {
            problems.add("'categoryAnalysis.evaluations' must be a non-empty array");
        } else {
            for (int i = 0; i < evaluations.size(); i++) {
                String path = "categoryAnalysis.evaluations[" + i + "]";
                checkText(evaluations.get(i), "category", path + ".category", problems);
                checkScore(evaluations.get(i).get("fitScore"), path + ".fitScore", 10, problems);
            }
        }
        checkText(categoryAnalysis, "bestMatch", "categoryAnalysis.bestMatch", problems);
    }

    private void validateFrankenstein(JsonNode root, List<String> problems) {
        checkTextIfPresent(root, "idea_title", problems);
        checkTextIfPresent(root, "idea_description", problems);
        checkTextIfPresent(root, "summary", problems);
        JsonNode metrics = root.path("metrics");
        if (!metrics.isMissingNode() && !metrics.isNull()) {
            for (String key : METRIC_KEYS) {
                checkScore(metrics.get(key), "metrics." + key, 100, problems);
            }
        }
        String language = root.path("language").asText("");
        if (root.has("language") && !language.equals("en") && !language.equals("es")) {
            problems.add("'language' must be 'en' or 'es' but was '" + language + "'");
        }
    }

    private void checkTextIfPresent(JsonNode node, String key, List<String> problems) {
        if (node.hasNonNull(key)) {
            checkText(node, key, key, problems);
        }
    }

    private void checkText(JsonNode node, String key, String path, List<String> problems) {
        JsonNode value = node.path(key);
        if (!value.isTextual() || value.asText().isBlank()) {
            problems.add("'" + path + "' must be a non-blank string");
        }
    }

    private void checkScore(JsonNode value, String path, int max, List<String> problems) {
        if (value == null || value.isNull()) {
            problems.add("missing score '" + path + "'");
        } else if (!value.isNumber()) {
            problems.add("'" + path + "' must be a number");
        } else if (value.asDouble() < 0 || value.asDouble() > max) {
            problems.add("'" + path + "' must be between 0 and " + max + " but was " + value.asText());
        }
    }
}
