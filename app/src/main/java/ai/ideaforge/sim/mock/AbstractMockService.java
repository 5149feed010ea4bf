package ai.ideaforge.sim.mock;

import ai.ideaforge.sim.config.MockServiceConfig;
import ai.ideaforge.sim.fixture.Fixture;
import ai.ideaforge.sim.fixture.TestDataManager;
import ai.ideaforge.sim.model.Language;
import ai.ideaforge.sim.scenario.TestScenario;
import ai.ideaforge.sim.service.ServiceResult;
import ai.ideaforge.sim.telemetry.OperationMetrics;
import ai.ideaforge.sim.telemetry.RequestLogEntry;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.function.Function;

/**
 * State and inspection API shared by the mock services. Views created through a scenario override
 * share the pipeline, and with it the request log and metrics, of the service they came from.
 */
public abstract class AbstractMockService {

    protected final TestDataManager dataManager;
    protected final MockCallPipeline pipeline;
    private final Optional<TestScenario> scenarioOverride;

    protected AbstractMockService(TestDataManager dataManager, MockCallPipeline pipeline, Optional<TestScenario> scenarioOverride) {
        this.dataManager = Objects.requireNonNull(dataManager, "dataManager");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.scenarioOverride = scenarioOverride == null ? Optional.empty() : scenarioOverride;
    }

    public MockServiceConfig config() {
        return pipeline.config();
    }

    public TestScenario activeScenario() {
        return pipeline.resolveScenario(scenarioOverride);
    }

    public List<RequestLogEntry> getRequestLogs() {
        return pipeline.requestLog().entries();
    }

    public void clearRequestLogs() {
        pipeline.requestLog().clear();
    }

    public OperationMetrics getPerformanceMetrics(String operation) {
        return pipeline.performance().metrics(operation);
    }

    public SortedMap<String, OperationMetrics> getPerformanceMetrics() {
        return pipeline.performance().snapshot();
    }

    public void clearPerformanceMetrics() {
        pipeline.performance().clear();
    }

    public long getLastSimulatedLatency() {
        return pipeline.lastSimulatedLatency();
    }

    protected boolean variability() {
        return pipeline.config().enableVariability();
    }

    protected static Language languageOrDefault(Language language) {
        return language == null ? Language.EN : language;
    }

    /**
     * Maps the customized fixture into a result; a partial scenario first strips the optional enrichments.
     */
    protected <T> ServiceResult<T> respond(Fixture fixture, TestScenario scenario, Function<JsonNode, T> mapping) {
        if (scenario.isPartial()) {
            return ServiceResult.partial(mapping.apply(dataManager.toPartial(fixture).mutableCopy()));
        }
        return ServiceResult.ok(mapping.apply(fixture.mutableCopy()));
    }
}
