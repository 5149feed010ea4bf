package ai.ideaforge.sim.fixture;

import ai.ideaforge.sim.model.Language;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads example payloads from the fixture store and derives input-specific responses from them.
 *
 * <p>Each fixture is read and validated once per (type, language) and then served from memory.
 * Customization always works on a copy, so the cached fixtures are never modified.
 */
public class TestDataManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TestDataManager.class);

    static final int TITLE_MAX_LENGTH = 60;
    static final int SNIPPET_LENGTH = 50;

    private static final Pattern CONCEPT_PHRASE = Pattern.compile("This .*? concept");
    private static final Pattern PROJECT_PHRASE = Pattern.compile("This .*? project");
    private static final Pattern ES_CONCEPT_PHRASE = Pattern.compile("Este concepto( \\p{L}+)?");
    private static final Pattern ES_PROJECT_PHRASE = Pattern.compile("Este proyecto");
    private static final List<String> ANALYSIS_SECTIONS = List.of("marketPotential", "technicalFeasibility", "businessViability");

    private final ObjectMapper objectMapper;
    private final ClassLoader classLoader;
    private final FixtureValidator validator;
    private final Map<FixtureKey, Fixture> cache = new ConcurrentHashMap<>();
    private final Map<FixtureKey, Path> overrides = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public TestDataManager() {
        this(new ObjectMapper(), TestDataManager.class.getClassLoader(), new FixtureValidator());
    }

    TestDataManager(ObjectMapper objectMapper, ClassLoader classLoader, FixtureValidator validator) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Returns the validated fixture for the pair.
     *
     * @throws FixtureNotFoundException  when the store has no fixture for the pair
     * @throws MalformedFixtureException when the fixture cannot be parsed or misses required keys
     */
    public Fixture getFixture(FixtureType type, Language language) {
        FixtureKey key = new FixtureKey(Objects.requireNonNull(type, "type"), Objects.requireNonNull(language, "language"));
        Fixture cached = cache.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        return cache.computeIfAbsent(key, this::load);
    }

    /**
     * Replaces the bundled fixture for the pair with the given file. The file is validated right away.
     */
    public Fixture overrideFixture(FixtureType type, Language language, Path path) {
        Objects.requireNonNull(path, "path");
        FixtureKey key = new FixtureKey(type, language);
        Fixture fixture = parse(key, readFile(key, path));
        overrides.put(key, path);
        cache.put(key, fixture);
        LOGGER.info("Using custom {} fixture for language '{}' from {}", type, language.code(), path);
        return fixture;
    }

    /**
     * Lists every problem of the pair's fixture without throwing. Empty when the fixture is usable.
     */
    public List<String> validate(FixtureType type, Language language) {
        FixtureKey key = new FixtureKey(type, language);
        try {
            load(key);
            return List.of();
        } catch (FixtureNotFoundException ex) {
            return List.of(ex.getMessage());
        } catch (MalformedFixtureException ex) {
            return ex.problems();
        }
    }

    public CacheStats cacheStats() {
        return new CacheStats(hits.get(), misses.get(), cache.size());
    }

    public void clearCache() {
        cache.clear();
        hits.set(0);
        misses.set(0);
    }

    public Fixture customizeAnalysisResponse(Fixture fixture, CustomizationContext context) {
        requireType(fixture, FixtureType.ANALYZER);
        ObjectNode data = fixture.mutableCopy();
        String input = context.inputText();
        if (!input.isBlank()) {
            data.put("title", titleFrom(input));
            data.put("detailedSummary", withSnippet(data.path("detailedSummary").asText(), fixture.language(), false, input));
        }
        if (context.variability()) {
            jitterAnalysisScores(data, new ScoreJitter(context.seed()));
        }
        return new Fixture(fixture.type(), fixture.language(), data);
    }

    public Fixture customizeHackathonResponse(Fixture fixture, CustomizationContext context) {
        requireType(fixture, FixtureType.HACKATHON);
        ObjectNode data = fixture.mutableCopy();
        context.projectName().ifPresent(name -> data.put("title", titleFrom(name)));
        String description = context.inputText();
        if (!description.isBlank()) {
            data.put("detailedSummary", withSnippet(data.path("detailedSummary").asText(), fixture.language(), true, description));
        }
        if (context.variability()) {
            ScoreJitter jitter = new ScoreJitter(context.seed());
            jitterAnalysisScores(data, jitter);
            for (JsonNode evaluation : data.path("categoryAnalysis").path("evaluations")) {
                jitter.shift(evaluation, "fitScore", ScoreJitter.FIT_SPREAD, 10);
            }
        }
        return new Fixture(fixture.type(), fixture.language(), data);
    }

    public Fixture customizeFrankensteinResponse(Fixture fixture, CustomizationContext context) {
        requireType(fixture, FixtureType.FRANKENSTEIN);
        ObjectNode data = new FrankensteinCustomizer(fixture.language()).customize(fixture.mutableCopy(), context);
        return new Fixture(fixture.type(), fixture.language(), data);
    }

    /**
     * Drops the optional enrichment keys of the fixture's type, keeping everything a caller requires.
     */
    public Fixture toPartial(Fixture fixture) {
        ObjectNode data = fixture.mutableCopy();
        data.remove(fixture.type().optionalKeys());
        return new Fixture(fixture.type(), fixture.language(), data);
    }

    private Fixture load(FixtureKey key) {
        Path override = overrides.get(key);
        if (override != null) {
            return parse(key, readFile(key, override));
        }
        String resource = key.type().resourceName(key.language());
        try (InputStream stream = classLoader.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new FixtureNotFoundException(key.type(), key.language(), "classpath:" + resource);
            }
            Fixture fixture = parse(key, stream.readAllBytes());
            LOGGER.debug("Loaded {} fixture for language '{}' from classpath:{}", key.type(), key.language().code(), resource);
            return fixture;
        } catch (IOException ex) {
            throw new FixtureException("Failed to read fixture classpath:" + resource, ex);
        }
    }

    private byte[] readFile(FixtureKey key, Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException ex) {
            throw new FixtureNotFoundException(key.type(), key.language(), path.toString());
        } catch (IOException ex) {
            throw new FixtureException("Failed to read fixture " + path, ex);
        }
    }

    private Fixture parse(FixtureKey key, byte[] content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException ex) {
            throw new MalformedFixtureException(key.type(), key.language(),
                    List.of("unparsable JSON: " + ex.getOriginalMessage()), ex);
        } catch (IOException ex) {
            throw new FixtureException("Failed to parse " + key.type() + " fixture", ex);
        }
        List<String> problems = validator.validate(key.type(), root);
        if (!problems.isEmpty()) {
            throw new MalformedFixtureException(key.type(), key.language(), problems);
        }
        return new Fixture(key.type(), key.language(), (ObjectNode) root);
    }

    private static void jitterAnalysisScores(ObjectNode data, ScoreJitter jitter) {
        jitter.shift(data, "finalScore", ScoreJitter.SCORE_SPREAD, 100);
        for (JsonNode criterion : data.path("scoringRubric")) {
            jitter.shift(criterion, "score", ScoreJitter.SCORE_SPREAD, 100);
        }
        for (String section : ANALYSIS_SECTIONS) {
            jitter.shift(data.get(section), "score", ScoreJitter.SCORE_SPREAD, 100);
        }
    }

    static String titleFrom(String input) {
        String firstLine = input.strip().lines().findFirst().orElse("").strip();
        if (firstLine.length() <= TITLE_MAX_LENGTH) {
            return firstLine;
        }
        return firstLine.substring(0, TITLE_MAX_LENGTH).stripTrailing() + "...";
    }

    private static String withSnippet(String summary, Language language, boolean project, String input) {
        String flattened = input.strip().replaceAll("\\s+", " ");
        String snippet = flattened.substring(0, Math.min(SNIPPET_LENGTH, flattened.length()));
        Pattern phrase;
        String replacement;
        if (language == Language.ES) {
            phrase = project ? ES_PROJECT_PHRASE : ES_CONCEPT_PHRASE;
            replacement = (project ? "Este proyecto" : "Este concepto") + " \"" + snippet + "...\"";
        } else {
            phrase = project ? PROJECT_PHRASE : CONCEPT_PHRASE;
            replacement = "This \"" + snippet + "...\" " + (project ? "project" : "concept");
        }
        Matcher matcher = phrase.matcher(summary);
        if (matcher.find()) {
            return matcher.replaceFirst(Matcher.quoteReplacement(replacement));
        }
        return replacement + ". " + summary;
    }

    private static void requireType(Fixture fixture, FixtureType expected) {
        Objects.requireNonNull(fixture, "fixture");
        if (fixture.type() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " fixture but got " + fixture.type());
        }
    }

    private record FixtureKey(FixtureType type, Language language) {
    }
}
