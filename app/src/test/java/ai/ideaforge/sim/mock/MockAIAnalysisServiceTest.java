package ai.ideaforge.sim.mock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.ideaforge.sim.config.MockServiceConfig;
import ai.ideaforge.sim.fixture.TestDataManager;
import ai.ideaforge.sim.model.AnalysisResult;
import ai.ideaforge.sim.model.CategoryRecommendation;
import ai.ideaforge.sim.model.CategoryRecommendation.Alternative;
import ai.ideaforge.sim.model.HealthReport;
import ai.ideaforge.sim.model.HealthStatus;
import ai.ideaforge.sim.model.IdeaComparison;
import ai.ideaforge.sim.model.IdeaComparison.Factor;
import ai.ideaforge.sim.model.Language;
import ai.ideaforge.sim.scenario.TestScenario;
import ai.ideaforge.sim.service.ServiceException;
import ai.ideaforge.sim.service.ServiceResult;
import ai.ideaforge.sim.service.ValidationException;
import ai.ideaforge.sim.telemetry.OperationMetrics;
import ai.ideaforge.sim.telemetry.RequestLogEntry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MockAIAnalysisServiceTest {

    private static final String IDEA = "A subscription service for refurbished camera gear";
    private static final TestDataManager DATA = new TestDataManager();

    @Test
    void successReturnsCustomizedAnalysis() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());

        ServiceResult<AnalysisResult> result = service.analyzeIdea(IDEA, Language.EN).join();

        assertThat(result.success()).isTrue();
        assertThat(result.status()).isEqualTo(200);
        AnalysisResult analysis = result.orElseThrow();
        assertThat(analysis.title()).isEqualTo(IDEA);
        assertThat(analysis.score()).isEqualTo(78);
        assertThat(analysis.summary()).contains(IDEA);
        assertThat(analysis.hasEnrichments()).isTrue();
        assertThat(analysis.criteriaScores()).hasSize(4);
    }

    @Test
    void repeatedCallsWithSameInputAreIdentical() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());

        AnalysisResult first = service.analyzeIdea(IDEA, Language.EN).join().orElseThrow();
        AnalysisResult second = service.analyzeIdea(IDEA, Language.EN).join().orElseThrow();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void differentInputsDoNotCollideWhenVariabilityIsOn() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults().withVariability(true));

        AnalysisResult first = service.analyzeIdea(IDEA, Language.EN).join().orElseThrow();
        AnalysisResult second = service.analyzeIdea("Peer-to-peer tool library for apartment buildings", Language.EN)
                .join().orElseThrow();

        assertThat(second.title()).isNotEqualTo(first.title());
        assertThat(second).isNotEqualTo(first);
        assertThat(first.score()).isBetween(0, 100);
    }

    @ParameterizedTest
    @CsvSource({
            "api_error, 500, API_ERROR, Mock API error in analyzeIdea",
            "timeout, 408, TIMEOUT, Mock timeout in analyzeIdea",
            "rate_limit, 429, RATE_LIMIT, Mock rate limit in analyzeIdea",
            "invalid_input, 400, INVALID_INPUT, Mock invalid input in analyzeIdea"
    })
    void failureScenariosReturnStructuredErrors(String scenario, int status, String code, String messagePrefix) {
        MockAIAnalysisService service = service(MockServiceConfig.defaults().withScenario(TestScenario.from(scenario)));

        ServiceResult<AnalysisResult> result = service.analyzeIdea(IDEA, Language.EN).join();

        assertThat(result.success()).isFalse();
        assertThat(result.status()).isEqualTo(status);
        assertThat(result.data()).isEmpty();
        ServiceException error = result.error().orElseThrow();
        assertThat(error.code()).isEqualTo(code);
        assertThat(error.httpStatus()).isEqualTo(status);
        assertThat(error.getMessage()).startsWith(messagePrefix);
        assertThatThrownBy(result::orElseThrow).isSameAs(error);

        RequestLogEntry entry = service.getRequestLogs().get(0);
        assertThat(entry.success()).isFalse();
        assertThat(entry.scenario()).isEqualTo(TestScenario.from(scenario));
        assertThat(entry.error()).contains(error.getMessage());
        assertThat(service.getPerformanceMetrics("analyzeIdea").totalRequests()).isEqualTo(1);
    }

    @Test
    void partialResponseOmitsEnrichments() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults().withScenario(TestScenario.PARTIAL_RESPONSE));

        ServiceResult<AnalysisResult> result = service.analyzeHackathonProject("Ghost Writer",
                "Revives abandoned blogs with an agent", "Agent hooks", Language.EN).join();

        assertThat(result.success()).isTrue();
        assertThat(result.status()).isEqualTo(206);
        assertThat(result.isPartial()).isTrue();
        AnalysisResult analysis = result.orElseThrow();
        assertThat(analysis.title()).isEqualTo("Ghost Writer");
        assertThat(analysis.marketPotential()).isEmpty();
        assertThat(analysis.viabilitySummary()).isEmpty();
        assertThat(analysis.swot().strengths()).isNotEmpty();
    }

    @Test
    void suggestionsComeFromFixtureOrDefaultsWhenPartial() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());

        List<String> suggestions = service.getImprovementSuggestions(IDEA, 70, Language.EN).join().orElseThrow();
        ServiceResult<List<String>> partial = service.withScenario(TestScenario.PARTIAL_RESPONSE)
                .getImprovementSuggestions(IDEA, 70, Language.ES).join();

        assertThat(suggestions).containsExactly("Narrow the launch segment", "Partner with employers", "Publish a trust framework");
        assertThat(partial.status()).isEqualTo(206);
        assertThat(partial.orElseThrow()).isEqualTo(MockAIAnalysisService.DEFAULT_SUGGESTIONS_ES);
    }

    @Test
    void suggestionsRejectOutOfRangeScore() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());

        ServiceResult<List<String>> result = service.getImprovementSuggestions(IDEA, 101, Language.EN).join();

        assertThat(result.success()).isFalse();
        assertThat(result.status()).isEqualTo(400);
        assertThat(result.error()).get()
                .isInstanceOf(ValidationException.class)
                .extracting(Throwable::getMessage)
                .isEqualTo("currentScore must be between 0 and 100 but was 101");
    }

    @Test
    void comparesTwoIdeasOnThreeFactors() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());

        IdeaComparison comparison = service.compareIdeas(IDEA, "Drone-based roof inspections", Language.EN).join().orElseThrow();

        assertThat(comparison.factors()).extracting(Factor::factor)
                .containsExactly("Market Potential", "Technical Feasibility", "Business Viability");
        assertThat(comparison.scoreDifference()).isBetween(0, 12);
        assertThat(comparison.recommendation()).isNotBlank();
        comparison.factors().forEach(factor -> assertThat(factor.winner())
                .isEqualTo(IdeaComparison.Winner.of(factor.idea1Score(), factor.idea2Score())));
    }

    @Test
    void recommendsBestMatchingCategory() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());

        CategoryRecommendation recommendation = service.recommendHackathonCategory("Ghost Writer",
                "Revives abandoned blogs", "Specs").join().orElseThrow();
        CategoryRecommendation partial = service.withScenario(TestScenario.PARTIAL_RESPONSE)
                .recommendHackathonCategory("Ghost Writer", "Revives abandoned blogs", "Specs").join().orElseThrow();

        assertThat(recommendation.recommendedCategory()).isEqualTo("resurrection");
        assertThat(recommendation.confidence()).isEqualTo(90);
        assertThat(recommendation.alternatives()).extracting(Alternative::category)
                .containsExactly("frankenstein", "skeleton-crew", "costume-contest");
        assertThat(partial.recommendedCategory()).isEqualTo("resurrection");
        assertThat(partial.alternatives()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "success, HEALTHY",
            "timeout, DEGRADED",
            "rate_limit, DEGRADED",
            "api_error, UNHEALTHY",
            "invalid_input, UNHEALTHY",
            "partial_response, UNHEALTHY"
    })
    void healthCheckAlwaysSucceedsAndReflectsScenario(String scenario, HealthStatus expected) {
        MockAIAnalysisService service = service(MockServiceConfig.defaults().withScenario(TestScenario.from(scenario)));

        ServiceResult<HealthReport> result = service.healthCheck().join();

        assertThat(result.success()).isTrue();
        assertThat(result.orElseThrow().status()).isEqualTo(expected);
        assertThat(result.orElseThrow().latencyMs()).isZero();
    }

    @Test
    void blankInputIsReportedAsFailedResultAndRecorded() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults().withLatency(1_500, 1_500));

        long started = System.nanoTime();
        CompletableFuture<ServiceResult<AnalysisResult>> future = service.analyzeIdea("  ", Language.EN);

        assertThat(future).isDone();
        assertThat((System.nanoTime() - started) / 1_000_000).isLessThan(1_000);
        ServiceResult<AnalysisResult> result = future.join();
        assertThat(result.success()).isFalse();
        assertThat(result.status()).isEqualTo(400);
        assertThat(result.error()).get().extracting(Throwable::getMessage).isEqualTo("idea must not be blank");

        assertThat(service.getRequestLogs()).singleElement().satisfies(entry -> {
            assertThat(entry.success()).isFalse();
            assertThat(entry.latencyMs()).isZero();
        });
        assertThat(service.getPerformanceMetrics("analyzeIdea").totalRequests()).isEqualTo(1);
    }

    @Test
    void everyOperationReportsInvalidInputWithoutThrowing() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());

        List<ServiceResult<?>> results = List.of(
                service.analyzeHackathonProject("", IDEA, null, Language.EN).join(),
                service.getImprovementSuggestions(" ", 50, Language.EN).join(),
                service.compareIdeas(IDEA, "", Language.EN).join(),
                service.recommendHackathonCategory("Name", null, null).join());

        assertThat(results).allSatisfy(result -> {
            assertThat(result.success()).isFalse();
            assertThat(result.status()).isEqualTo(400);
        });
        assertThat(service.getRequestLogs()).hasSize(4).noneMatch(RequestLogEntry::success);
    }

    @Test
    void simulatesLatencyWithinConfiguredBounds() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        MockCallPipeline pipeline = new MockCallPipeline(MockServiceConfig.defaults().withLatency(50, 100),
                new LatencySimulator(new Random(3)), clock);
        MockAIAnalysisService service = new MockAIAnalysisService(DATA, pipeline, Optional.empty());
        service(MockServiceConfig.defaults()).analyzeIdea(IDEA, Language.EN).join();

        long started = System.nanoTime();
        CompletableFuture<ServiceResult<AnalysisResult>> future = service.analyzeIdea(IDEA, Language.EN);
        ServiceResult<AnalysisResult> result = future.join();
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(result.success()).isTrue();
        assertThat(service.getLastSimulatedLatency()).isBetween(50L, 100L);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(service.getLastSimulatedLatency())
                .as("upper latency bound plus scheduling allowance")
                .isLessThanOrEqualTo(250);
        RequestLogEntry entry = service.getRequestLogs().get(0);
        assertThat(entry.latencyMs()).isEqualTo(service.getLastSimulatedLatency());
        assertThat(entry.timestamp()).isEqualTo(clock.instant());
        assertThat(service.getPerformanceMetrics("analyzeIdea").minDurationMs()).isGreaterThanOrEqualTo(50);
    }

    @Test
    void callsCompleteQuicklyWhenLatencySimulationIsOff() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());
        service.analyzeIdea(IDEA, Language.EN).join();

        long started = System.nanoTime();
        ServiceResult<AnalysisResult> result = service.analyzeIdea(IDEA, Language.EN).join();

        assertThat(result.success()).isTrue();
        assertThat((System.nanoTime() - started) / 1_000_000).isLessThan(100);
        assertThat(service.getLastSimulatedLatency()).isZero();
    }

    @Test
    void timeoutScenarioFailsWithoutWaiting() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults()
                .withScenario(TestScenario.TIMEOUT)
                .withLatency(2_000, 2_000));

        long started = System.nanoTime();
        ServiceResult<AnalysisResult> result = service.analyzeIdea(IDEA, Language.EN).join();

        assertThat((System.nanoTime() - started) / 1_000_000).isLessThan(1_000);
        assertThat(result.status()).isEqualTo(408);
        assertThat(service.getRequestLogs().get(0).latencyMs()).isZero();
    }

    @Test
    void scenarioViewSharesLogButNotScenario() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());
        MockAIAnalysisService failing = service.withScenario(TestScenario.API_ERROR);

        failing.analyzeIdea(IDEA, Language.EN).join();
        service.analyzeIdea(IDEA, Language.EN).join();

        assertThat(service.activeScenario()).isEqualTo(TestScenario.SUCCESS);
        assertThat(failing.activeScenario()).isEqualTo(TestScenario.API_ERROR);
        assertThat(service.getRequestLogs()).extracting(RequestLogEntry::success).containsExactly(false, true);
        assertThat(failing.getPerformanceMetrics("analyzeIdea").totalRequests()).isEqualTo(2);
    }

    @Test
    void requestLogKeepsTheMostRecentHundredCalls() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults());

        for (int i = 0; i < 105; i++) {
            service.healthCheck().join();
        }

        assertThat(service.getRequestLogs()).hasSize(100);
        assertThat(service.getPerformanceMetrics("healthCheck").totalRequests()).isEqualTo(105);

        service.clearRequestLogs();
        service.clearPerformanceMetrics();
        assertThat(service.getRequestLogs()).isEmpty();
        assertThat(service.getPerformanceMetrics()).isEmpty();
        assertThat(service.getPerformanceMetrics("healthCheck")).isEqualTo(OperationMetrics.EMPTY);
    }

    @Test
    void metricsAreRecordedWhenRequestLoggingIsOff() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults().withRequestLogging(false));

        service.analyzeIdea(IDEA, Language.EN).join();

        assertThat(service.getRequestLogs()).isEmpty();
        assertThat(service.getPerformanceMetrics().keySet()).containsExactly("analyzeIdea");
    }

    @Test
    void concurrentCallsAreAllAccountedFor() {
        MockAIAnalysisService service = service(MockServiceConfig.defaults().withLatency(1, 5));

        List<CompletableFuture<ServiceResult<AnalysisResult>>> calls = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            calls.add(service.analyzeIdea(IDEA + " #" + i, Language.EN));
        }
        List<ServiceResult<AnalysisResult>> results = calls.stream().map(CompletableFuture::join).toList();

        assertThat(results).allSatisfy(result -> assertThat(result.success()).isTrue());
        assertThat(service.getRequestLogs()).hasSize(20);
        assertThat(service.getPerformanceMetrics("analyzeIdea").totalRequests()).isEqualTo(20);
    }

    private static MockAIAnalysisService service(MockServiceConfig config) {
        return new MockAIAnalysisService(DATA, config);
    }
}
