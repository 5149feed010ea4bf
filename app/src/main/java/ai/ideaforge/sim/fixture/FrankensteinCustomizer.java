package ai.ideaforge.sim.fixture;

import ai.ideaforge.sim.model.FrankensteinElement;
import ai.ideaforge.sim.model.Language;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rules that turn the Frankenstein fixture into an idea shaped by the supplied elements and mode.
 */
final class FrankensteinCustomizer {

    /**
     * Generic stack phrases and the AWS services that replace them. No replacement contains any key.
     */
    static final Map<String, String> AWS_SUBSTITUTIONS = awsSubstitutions();
    static final Map<String, String> AWS_SUBSTITUTIONS_ES = awsSubstitutionsEs();

    private static final String AWS_PREFIX = "AWS-native architecture: ";
    private static final String AWS_PREFIX_ES = "Arquitectura nativa de AWS: ";

    private final Language language;

    FrankensteinCustomizer(Language language) {
        this.language = language;
    }

    ObjectNode customize(ObjectNode data, CustomizationContext context) {
        List<FrankensteinElement> elements = context.elements();
        List<String> names = elements.stream().map(FrankensteinElement::name).collect(Collectors.toList());
        if (!names.isEmpty()) {
            data.put("idea_title", String.join(" + ", names) + " " + titleSuffix(names.size()));
        }
        applyDescribedElements(data, elements);

        ObjectNode metrics = (ObjectNode) data.get("metrics");
        applyElementCountDeltas(metrics, names.size());

        context.mode().ifPresent(mode -> {
            switch (mode) {
                case AWS -> applyAwsMode(data, metrics);
                case COMPANIES -> applyCompaniesMode(data, metrics, names);
            }
        });

        if (context.variability()) {
            ScoreJitter jitter = new ScoreJitter(context.seed());
            metrics.fieldNames().forEachRemaining(field -> jitter.shift(metrics, field, ScoreJitter.SCORE_SPREAD, 100));
        }
        clampMetrics(metrics);
        data.put("language", language.code());
        return data;
    }

    private String titleSuffix(int count) {
        boolean spanish = language == Language.ES;
        if (count <= 2) {
            return spanish ? "Plataforma de Fusión" : "Fusion Platform";
        }
        if (count == 3) {
            return spanish ? "Hub de Integración" : "Integration Hub";
        }
        return spanish ? "Ecosistema" : "Ecosystem";
    }

    private void applyDescribedElements(ObjectNode data, List<FrankensteinElement> elements) {
        String described = elements.stream()
                .filter(element -> element.description().isPresent())
                .map(FrankensteinElement::name)
                .collect(Collectors.joining(", "));
        if (described.isEmpty()) {
            return;
        }
        String verb = language == Language.ES ? "combina" : "combines";
        String joiner = language == Language.ES ? "para crear" : "to create";
        Matcher matcher = Pattern.compile("\\b" + verb + "\\b", Pattern.CASE_INSENSITIVE)
                .matcher(data.path("idea_description").asText(""));
        data.put("idea_description",
                matcher.replaceFirst(Matcher.quoteReplacement(verb + " " + described + " " + joiner)));
    }

    private void applyElementCountDeltas(ObjectNode metrics, int count) {
        if (count == 2) {
            add(metrics, "originality_score", 5);
            add(metrics, "feasibility_score", 5);
        } else if (count == 3) {
            add(metrics, "originality_score", 10);
            add(metrics, "feasibility_score", -3);
        } else if (count > 3) {
            add(metrics, "originality_score", 15);
            add(metrics, "feasibility_score", -8);
            add(metrics, "wow_factor", 10);
        }
    }

    private void applyAwsMode(ObjectNode data, ObjectNode metrics) {
        if (data.hasNonNull("tech_stack_suggestion")) {
            String stack = data.get("tech_stack_suggestion").asText();
            for (Map.Entry<String, String> substitution : awsSubstitutionsFor(language).entrySet()) {
                stack = Pattern.compile(Pattern.quote(substitution.getKey()), Pattern.CASE_INSENSITIVE)
                        .matcher(stack)
                        .replaceAll(Matcher.quoteReplacement(substitution.getValue()));
            }
            if (!stack.contains("AWS")) {
                stack = (language == Language.ES ? AWS_PREFIX_ES : AWS_PREFIX) + stack;
            }
            data.put("tech_stack_suggestion", stack);
        }
        add(metrics, "scalability_score", 12);
        add(metrics, "feasibility_score", 5);
        if (data.hasNonNull("growth_strategy")) {
            String growth = data.get("growth_strategy").asText();
            if (!growth.contains("cloud") && !growth.contains("AWS")) {
                String prefix = language == Language.ES
                        ? "Aprovechar la infraestructura global de AWS para escalar rápidamente. "
                        : "Leverage AWS global infrastructure for rapid scaling. ";
                data.put("growth_strategy", prefix + growth);
            }
        }
    }

    private void applyCompaniesMode(ObjectNode data, ObjectNode metrics, List<String> names) {
        if (names.size() >= 2 && data.hasNonNull("unique_value_proposition")) {
            String proposition = data.get("unique_value_proposition").asText();
            String lead = language == Language.ES
                    ? "Combina lo mejor de " + names.get(0) + " y " + names.get(1) + ": "
                    : "Combines the best of " + names.get(0) + " and " + names.get(1) + ": ";
            data.put("unique_value_proposition", lead + proposition);
        }
        add(metrics, "impact_score", 8);
        add(metrics, "wow_factor", 5);
    }

    private static void add(ObjectNode metrics, String field, int delta) {
        JsonNode value = metrics.get(field);
        if (value != null && value.isNumber()) {
            metrics.put(field, value.asInt() + delta);
        }
    }

    private static void clampMetrics(ObjectNode metrics) {
        metrics.fieldNames().forEachRemaining(field -> {
            JsonNode value = metrics.get(field);
            if (value.isNumber()) {
                metrics.put(field, ScoreJitter.clamp(value.asInt(), 0, 100));
            }
        });
    }

    static Map<String, String> awsSubstitutionsFor(Language language) {
        return language == Language.ES ? AWS_SUBSTITUTIONS_ES : AWS_SUBSTITUTIONS;
    }

    private static Map<String, String> awsSubstitutions() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("Frontend built with React", "Frontend using AWS Amplify with React");
        table.put("Backend using Node.js", "Backend using AWS Lambda with Node.js");
        table.put("PostgreSQL database", "Amazon RDS for PostgreSQL");
        table.put("Redis cache", "Amazon ElastiCache");
        table.put("Docker containers", "Amazon ECS on Fargate");
        table.put("object storage", "Amazon S3");
        table.put("message queue", "Amazon SQS");
        return Collections.unmodifiableMap(table);
    }

    private static Map<String, String> awsSubstitutionsEs() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("Frontend construido con React", "Frontend con AWS Amplify sobre React");
        table.put("Backend con Node.js", "Backend sobre AWS Lambda y Node.js");
        table.put("Base de datos PostgreSQL", "Amazon RDS para PostgreSQL");
        table.put("caché Redis", "Amazon ElastiCache");
        table.put("contenedores Docker", "Amazon ECS sobre Fargate");
        table.put("almacenamiento de objetos", "Amazon S3");
        table.put("cola de mensajes", "Amazon SQS");
        return Collections.unmodifiableMap(table);
    }
}
