package ai.ideaforge.sim.fixture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.ideaforge.sim.model.Language;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestDataManagerTest {

    private static final String IDEA = "A marketplace for vintage synthesizers";

    private final TestDataManager manager = new TestDataManager();

    @Test
    void loadsEveryBundledFixture() {
        for (FixtureType type : FixtureType.values()) {
            for (Language language : Language.values()) {
                assertThat(manager.validate(type, language)).as("%s/%s", type, language).isEmpty();
                Fixture fixture = manager.getFixture(type, language);
                assertThat(fixture.type()).isEqualTo(type);
                assertThat(fixture.language()).isEqualTo(language);
                type.requiredKeys().forEach(key -> assertThat(fixture.has(key)).as(key).isTrue());
            }
        }
    }

    @Test
    void servesRepeatedLookupsFromCache() {
        Fixture first = manager.getFixture(FixtureType.ANALYZER, Language.EN);
        Fixture second = manager.getFixture(FixtureType.ANALYZER, Language.EN);

        assertThat(second).isSameAs(first);
        CacheStats stats = manager.cacheStats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.size()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);

        manager.clearCache();
        assertThat(manager.cacheStats()).isEqualTo(new CacheStats(0, 0, 0));
    }

    @Test
    void reportsMissingFixtureWithoutThrowingFromValidate() {
        TestDataManager empty = new TestDataManager(new ObjectMapper(), new ClassLoader(null) {
        }, new FixtureValidator());

        assertThat(empty.validate(FixtureType.HACKATHON, Language.ES))
                .singleElement()
                .asString()
                .contains("No hackathon fixture for language 'es'");
        assertThatThrownBy(() -> empty.getFixture(FixtureType.HACKATHON, Language.ES))
                .isInstanceOf(FixtureNotFoundException.class);
    }

    @Test
    void rejectsUnparsableOverride(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"title\": ");

        assertThatThrownBy(() -> manager.overrideFixture(FixtureType.ANALYZER, Language.EN, file))
                .isInstanceOfSatisfying(MalformedFixtureException.class, ex ->
                        assertThat(ex.problems()).singleElement().asString().startsWith("unparsable JSON"));
    }

    @Test
    void rejectsOverrideMissingRequiredKeys(@TempDir Path tempDir) throws IOException {
        ObjectNode data = manager.getFixture(FixtureType.ANALYZER, Language.EN).mutableCopy();
        data.remove("title");
        data.put("finalScore", 140);
        Path file = tempDir.resolve("analyzer.json");
        Files.writeString(file, data.toString());

        assertThatThrownBy(() -> manager.overrideFixture(FixtureType.ANALYZER, Language.EN, file))
                .isInstanceOfSatisfying(MalformedFixtureException.class, ex -> assertThat(ex.problems())
                        .contains("missing required key 'title'", "'finalScore' must be between 0 and 100 but was 140"));
        assertThat(manager.getFixture(FixtureType.ANALYZER, Language.EN).text("title"))
                .isEqualTo("AI-Powered Personal Finance Coach");
    }

    @Test
    void usesValidOverride(@TempDir Path tempDir) throws IOException {
        ObjectNode data = manager.getFixture(FixtureType.ANALYZER, Language.EN).mutableCopy();
        data.put("title", "Custom fixture");
        Path file = tempDir.resolve("analyzer.json");
        Files.writeString(file, data.toString());

        manager.overrideFixture(FixtureType.ANALYZER, Language.EN, file);
        manager.clearCache();

        assertThat(manager.getFixture(FixtureType.ANALYZER, Language.EN).text("title")).isEqualTo("Custom fixture");
    }

    @Test
    void overrideOfMissingFileIsNotFound(@TempDir Path tempDir) {
        assertThatThrownBy(() -> manager.overrideFixture(FixtureType.FRANKENSTEIN, Language.EN, tempDir.resolve("none.json")))
                .isInstanceOf(FixtureNotFoundException.class);
    }

    @Test
    void customizesAnalysisTitleAndSummaryFromInput() {
        Fixture base = manager.getFixture(FixtureType.ANALYZER, Language.EN);

        Fixture customized = manager.customizeAnalysisResponse(base,
                CustomizationContext.forText(IDEA + "\nwith escrow and repair guides", false));

        assertThat(customized.text("title")).isEqualTo(IDEA);
        assertThat(customized.text("detailedSummary"))
                .startsWith("This \"A marketplace for vintage synthesizers with escrow...\" concept addresses");
        assertThat(customized.mutableCopy().get("finalScore").asInt()).isEqualTo(78);
    }

    @Test
    void truncatesLongTitles() {
        String longLine = "x".repeat(80);

        assertThat(TestDataManager.titleFrom(longLine)).isEqualTo("x".repeat(TestDataManager.TITLE_MAX_LENGTH) + "...");
        assertThat(TestDataManager.titleFrom("  short idea  ")).isEqualTo("short idea");
    }

    @Test
    void localizesSpanishSummary() {
        Fixture base = manager.getFixture(FixtureType.ANALYZER, Language.ES);

        Fixture customized = manager.customizeAnalysisResponse(base, CustomizationContext.forText("Un mercado de sintetizadores", false));

        assertThat(customized.text("detailedSummary")).startsWith("Este concepto \"Un mercado de sintetizadores...\" aborda");
    }

    @Test
    void customizationIsIdempotentWithoutVariability() {
        Fixture base = manager.getFixture(FixtureType.ANALYZER, Language.EN);

        Fixture first = manager.customizeAnalysisResponse(base, CustomizationContext.forText(IDEA, false));
        Fixture second = manager.customizeAnalysisResponse(base, CustomizationContext.forText(IDEA, false));

        assertThat(first.toJson()).isEqualTo(second.toJson());
    }

    @Test
    void customizationWithVariabilityIsDeterministicAndInputSpecific() {
        Fixture base = manager.getFixture(FixtureType.ANALYZER, Language.EN);

        Fixture first = manager.customizeAnalysisResponse(base, CustomizationContext.forText(IDEA, true));
        Fixture repeated = manager.customizeAnalysisResponse(base, CustomizationContext.forText(IDEA, true));
        Fixture other = manager.customizeAnalysisResponse(base, CustomizationContext.forText("A drone delivery network", true));

        assertThat(first).isEqualTo(repeated);
        assertThat(other.toJson()).isNotEqualTo(first.toJson());
        int score = first.mutableCopy().get("finalScore").asInt();
        assertThat(score).isBetween(78 - ScoreJitter.SCORE_SPREAD, 78 + ScoreJitter.SCORE_SPREAD);
        assertThat(new FixtureValidator().validate(FixtureType.ANALYZER, other.mutableCopy())).isEmpty();
    }

    @Test
    void customizationNeverMutatesTheCachedFixture() {
        Fixture base = manager.getFixture(FixtureType.HACKATHON, Language.EN);
        String before = base.toJson();

        Fixture customized = manager.customizeHackathonResponse(base,
                CustomizationContext.forProject("Ghost Writer", "Revives abandoned blogs", true));
        customized.mutableCopy().put("title", "changed");

        assertThat(base.toJson()).isEqualTo(before);
        assertThat(manager.getFixture(FixtureType.HACKATHON, Language.EN).toJson()).isEqualTo(before);
    }

    @Test
    void customizesHackathonProjectAndKeepsFitScoresInRange() {
        Fixture base = manager.getFixture(FixtureType.HACKATHON, Language.EN);

        Fixture customized = manager.customizeHackathonResponse(base,
                CustomizationContext.forProject("Ghost Writer", "Revives abandoned blogs with an agent", true));

        assertThat(customized.text("title")).isEqualTo("Ghost Writer");
        assertThat(customized.text("detailedSummary"))
                .startsWith("This \"Revives abandoned blogs with an agent...\" project");
        customized.mutableCopy().path("categoryAnalysis").path("evaluations")
                .forEach(evaluation -> assertThat(evaluation.get("fitScore").asInt()).isBetween(0, 10));
    }

    @Test
    void partialFixtureDropsOptionalKeysOnly() {
        Fixture base = manager.getFixture(FixtureType.ANALYZER, Language.EN);

        Fixture partial = manager.toPartial(base);

        FixtureType.ANALYZER.optionalKeys().forEach(key -> assertThat(partial.has(key)).as(key).isFalse());
        FixtureType.ANALYZER.requiredKeys().forEach(key -> assertThat(partial.has(key)).as(key).isTrue());
        assertThat(base.has("marketPotential")).isTrue();
    }

    @Test
    void rejectsFixtureOfWrongType() {
        Fixture frankenstein = manager.getFixture(FixtureType.FRANKENSTEIN, Language.EN);

        assertThatThrownBy(() -> manager.customizeAnalysisResponse(frankenstein, CustomizationContext.forText(IDEA, false)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected a analyzer fixture");
    }
}
