package ai.ideaforge.sim.service;

import ai.ideaforge.sim.model.FrankensteinElement;
import ai.ideaforge.sim.model.FrankensteinMode;
import ai.ideaforge.sim.model.Language;
import java.util.List;
import java.util.stream.Collectors;

final class Prompts {

    static final List<String> HACKATHON_CATEGORIES = List.of("resurrection", "frankenstein", "skeleton-crew", "costume-contest");

    static final String HEALTH_PING = "Reply with the single word OK.";

    private static final String ANALYSIS_SHAPE = """
{"title": string, "detailedSummary": string, "finalScore": 0-100, "finalScoreExplanation": string,
 "swotAnalysis": {"strengths": [string], "weaknesses": [string], "opportunities": [string], "threats": [string]},
 "scoringRubric": [{"name": string, "score": 0-100, "justification": string}],
 "improvementSuggestions": [{"title": string, "description": string}],
 "viabilitySummary": string,
 "marketPotential": {"score": 0-100, "analysis": string, "targetMarket": string, "marketSize": string},
 "technicalFeasibility": {"score": 0-100, "analysis": string, "complexity": "low"|"medium"|"high", "requiredSkills": [string]},
 "businessViability": {"score": 0-100, "analysis": string, "revenueModel": [string], "competitiveAdvantage": string}}""";

    private static final String CATEGORY_SHAPE = """
"categoryAnalysis": {"evaluations": [{"category": string, "fitScore": 0-10, "explanation": string}],
 "bestMatch": string, "bestMatchReason": string}""";

    private Prompts() {
    }

    static String analyzeIdea(String idea, Language language) {
        return """
You are a startup analyst. Evaluate the idea below and answer %s.
Respond with a single JSON object of this shape and nothing else:
%s

<idea>
%s
</idea>""".formatted(languageName(language), ANALYSIS_SHAPE, idea);
    }

    static String analyzeHackathonProject(String projectName, String description, String toolUsage, Language language) {
        return """
You are a hackathon judge. Evaluate the project below and answer %s.
Respond with a single JSON object of this shape and nothing else:
%s
Categories to evaluate: %s.

<project name="%s">
%s
</project>
<tool-usage>
%s
</tool-usage>""".formatted(languageName(language), withCategories(), String.join(", ", HACKATHON_CATEGORIES),
                projectName, description, toolUsage == null ? "" : toolUsage);
    }

    static String improvementSuggestions(String idea, int currentScore, Language language) {
        return """
The idea below currently scores %d out of 100. Suggest concrete improvements, answering %s.
Respond with a single JSON object {"improvementSuggestions": [{"title": string, "description": string}]} and nothing else.

<idea>
%s
</idea>""".formatted(currentScore, languageName(language), idea);
    }

    static String recommendCategory(String projectName, String description, String toolUsage) {
        return """
Rate how well the hackathon project below fits each category: %s.
Respond with a single JSON object {%s} and nothing else.

<project name="%s">
%s
</project>
<tool-usage>
%s
</tool-usage>""".formatted(String.join(", ", HACKATHON_CATEGORIES), CATEGORY_SHAPE, projectName, description,
                toolUsage == null ? "" : toolUsage);
    }

    static String frankenstein(List<FrankensteinElement> elements, FrankensteinMode mode, Language language) {
        String ingredients = elements.stream()
                .map(element -> "- " + element.name() + element.description().map(text -> ": " + text).orElse(""))
                .collect(Collectors.joining("\n"));
        String flavour = mode == FrankensteinMode.AWS
                ? "an architecture built entirely from these AWS services"
                : "a product that fuses these companies";
        return """
Invent %s. Answer %s.
Respond with a single JSON object and nothing else, using these keys:
idea_title, idea_description, core_concept, problem_statement, proposed_solution, unique_value_proposition,
target_audience, business_model, growth_strategy, tech_stack_suggestion, risks_and_challenges, summary, language ("%s"),
metrics {originality_score, feasibility_score, impact_score, scalability_score, wow_factor} each 0-100.

<elements>
%s
</elements>""".formatted(flavour, languageName(language), language.code(), ingredients);
    }

    private static String withCategories() {
        return ANALYSIS_SHAPE.substring(0, ANALYSIS_SHAPE.length() - 1) + ",\n " + CATEGORY_SHAPE + "}";
    }

    private static String languageName(Language language) {
        return language == Language.ES ? "in Spanish" : "in English";
    }
}
