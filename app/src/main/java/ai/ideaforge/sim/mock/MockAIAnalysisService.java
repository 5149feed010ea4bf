package ai.ideaforge.sim.mock;

import ai.ideaforge.sim.config.MockServiceConfig;
import ai.ideaforge.sim.fixture.CustomizationContext;
import ai.ideaforge.sim.fixture.Fixture;
import ai.ideaforge.sim.fixture.FixtureType;
import ai.ideaforge.sim.fixture.TestDataManager;
import ai.ideaforge.sim.model.AnalysisResult;
import ai.ideaforge.sim.model.CategoryRecommendation;
import ai.ideaforge.sim.model.HealthReport;
import ai.ideaforge.sim.model.HealthStatus;
import ai.ideaforge.sim.model.IdeaComparison;
import ai.ideaforge.sim.model.Language;
import ai.ideaforge.sim.scenario.TestScenario;
import ai.ideaforge.sim.service.AIAnalysisService;
import ai.ideaforge.sim.service.AnalysisResultMapper;
import ai.ideaforge.sim.service.IdeaComparator;
import ai.ideaforge.sim.service.Preconditions;
import ai.ideaforge.sim.service.ServiceResult;
import ai.ideaforge.sim.service.ValidationException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Fixture-backed stand-in for the analysis service, driven by the configured {@link TestScenario}.
 */
public class MockAIAnalysisService extends AbstractMockService implements AIAnalysisService {

    static final List<String> DEFAULT_SUGGESTIONS = List.of(
            "Consider expanding your target market",
            "Strengthen your unique value proposition",
            "Develop a more detailed go-to-market strategy");
    static final List<String> DEFAULT_SUGGESTIONS_ES = List.of(
            "Considera ampliar tu mercado objetivo",
            "Refuerza tu propuesta de valor única",
            "Desarrolla una estrategia de salida al mercado más detallada");

    private final AnalysisResultMapper mapper = new AnalysisResultMapper();
    private final IdeaComparator comparator = new IdeaComparator();

    public MockAIAnalysisService(TestDataManager dataManager, MockServiceConfig config) {
        this(dataManager, new MockCallPipeline(config), Optional.empty());
    }

    MockAIAnalysisService(TestDataManager dataManager, MockCallPipeline pipeline, Optional<TestScenario> scenarioOverride) {
        super(dataManager, pipeline, scenarioOverride);
    }

    /**
     * View of this service whose calls run under {@code scenario}. Log and metrics are shared.
     */
    public MockAIAnalysisService withScenario(TestScenario scenario) {
        return new MockAIAnalysisService(dataManager, pipeline, Optional.of(scenario));
    }

    @Override
    public CompletableFuture<ServiceResult<AnalysisResult>> analyzeIdea(String idea, Language language) {
        TestScenario scenario = activeScenario();
        return guarded("analyzeIdea", scenario, () -> Preconditions.requireText(idea, "idea"), () ->
                pipeline.execute("analyzeIdea", scenario, () ->
                        respond(analysisFixture(idea, language, variability()), scenario, mapper::toAnalysisResult)));
    }

    @Override
    public CompletableFuture<ServiceResult<AnalysisResult>> analyzeHackathonProject(String projectName,
                                                                                    String description,
                                                                                    String toolUsage,
                                                                                    Language language) {
        TestScenario scenario = activeScenario();
        return guarded("analyzeHackathonProject", scenario, () -> {
            Preconditions.requireText(projectName, "projectName");
            Preconditions.requireText(description, "description");
        }, () -> pipeline.execute("analyzeHackathonProject", scenario, () ->
                respond(hackathonFixture(projectName, description, languageOrDefault(language)), scenario,
                        mapper::toAnalysisResult)));
    }

    @Override
    public CompletableFuture<ServiceResult<List<String>>> getImprovementSuggestions(String idea, int currentScore, Language language) {
        TestScenario scenario = activeScenario();
        return guarded("getImprovementSuggestions", scenario, () -> {
            Preconditions.requireScore(currentScore, "currentScore");
            Preconditions.requireText(idea, "idea");
        }, () -> pipeline.execute("getImprovementSuggestions", scenario, () -> {
            List<String> defaults = languageOrDefault(language) == Language.ES ? DEFAULT_SUGGESTIONS_ES : DEFAULT_SUGGESTIONS;
            if (scenario.isPartial()) {
                return ServiceResult.partial(defaults);
            }
            List<String> suggestions = mapper.toSuggestions(analysisFixture(idea, language, variability()).mutableCopy());
            return ServiceResult.ok(suggestions.isEmpty() ? defaults : suggestions);
        }));
    }

    /**
     * Both ideas are always scored with variability so that different ideas can produce a winner.
     */
    @Override
    public CompletableFuture<ServiceResult<IdeaComparison>> compareIdeas(String idea1, String idea2, Language language) {
        TestScenario scenario = activeScenario();
        return guarded("compareIdeas", scenario, () -> {
            Preconditions.requireText(idea1, "idea1");
            Preconditions.requireText(idea2, "idea2");
        }, () -> pipeline.execute("compareIdeas", scenario, () -> {
            AnalysisResult first = respond(analysisFixture(idea1, language, true), scenario, mapper::toAnalysisResult).orElseThrow();
            AnalysisResult second = respond(analysisFixture(idea2, language, true), scenario, mapper::toAnalysisResult).orElseThrow();
            IdeaComparison comparison = comparator.compare(first, second, languageOrDefault(language));
            return scenario.isPartial() ? ServiceResult.partial(comparison) : ServiceResult.ok(comparison);
        }));
    }

    @Override
    public CompletableFuture<ServiceResult<CategoryRecommendation>> recommendHackathonCategory(String projectName,
                                                                                               String description,
                                                                                               String toolUsage) {
        TestScenario scenario = activeScenario();
        return guarded("recommendHackathonCategory", scenario, () -> {
            Preconditions.requireText(projectName, "projectName");
            Preconditions.requireText(description, "description");
        }, () -> pipeline.execute("recommendHackathonCategory", scenario, () -> {
            CategoryRecommendation recommendation = mapper.toCategoryRecommendation(
                    hackathonFixture(projectName, description, Language.EN).mutableCopy());
            if (scenario.isPartial()) {
                return ServiceResult.partial(new CategoryRecommendation(recommendation.recommendedCategory(),
                        recommendation.confidence(), List.of()));
            }
            return ServiceResult.ok(recommendation);
        }));
    }

    @Override
    public CompletableFuture<ServiceResult<HealthReport>> healthCheck() {
        TestScenario scenario = activeScenario();
        return pipeline.observe("healthCheck", scenario, latency -> new HealthReport(healthFor(scenario), latency));
    }

    static HealthStatus healthFor(TestScenario scenario) {
        return switch (scenario) {
            case SUCCESS -> HealthStatus.HEALTHY;
            case TIMEOUT, RATE_LIMIT -> HealthStatus.DEGRADED;
            case API_ERROR, INVALID_INPUT, PARTIAL_RESPONSE -> HealthStatus.UNHEALTHY;
        };
    }

    private Fixture analysisFixture(String idea, Language language, boolean variability) {
        Fixture base = dataManager.getFixture(FixtureType.ANALYZER, languageOrDefault(language));
        return dataManager.customizeAnalysisResponse(base, CustomizationContext.forText(idea, variability));
    }

    private Fixture hackathonFixture(String projectName, String description, Language language) {
        Fixture base = dataManager.getFixture(FixtureType.HACKATHON, language);
        return dataManager.customizeHackathonResponse(base,
                CustomizationContext.forProject(projectName, description, variability()));
    }

    /**
     * Runs {@code call} once {@code check} passes. A rejected input is recorded and reported as a failed
     * result without any simulated latency.
     */
    private <T> CompletableFuture<ServiceResult<T>> guarded(String operation, TestScenario scenario, Runnable check,
                                                           Supplier<CompletableFuture<ServiceResult<T>>> call) {
        try {
            check.run();
        } catch (ValidationException ex) {
            pipeline.recordRejected(operation, scenario, ex);
            return CompletableFuture.completedFuture(ServiceResult.failure(ex));
        }
        return call.get();
    }
}
