package ai.ideaforge.sim.mock;

import ai.ideaforge.sim.config.MockServiceConfig;
import ai.ideaforge.sim.model.HealthReport;
import ai.ideaforge.sim.scenario.MockServiceException;
import ai.ideaforge.sim.scenario.ScenarioResolver;
import ai.ideaforge.sim.scenario.TestScenario;
import ai.ideaforge.sim.service.ServiceException;
import ai.ideaforge.sim.service.ServiceResult;
import ai.ideaforge.sim.telemetry.PerformanceAggregator;
import ai.ideaforge.sim.telemetry.RequestLog;
import ai.ideaforge.sim.telemetry.RequestLogEntry;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongFunction;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Steps every mock call goes through: scenario, latency, payload or failure, request log, metrics.
 *
 * <p>The log entry and the metrics update of a call are written before its future completes.
 */
public class MockCallPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(MockCallPipeline.class);

    private final MockServiceConfig config;
    private final ScenarioResolver scenarioResolver;
    private final LatencySimulator latencySimulator;
    private final RequestLog requestLog;
    private final PerformanceAggregator performance;
    private final Clock clock;

    public MockCallPipeline(MockServiceConfig config) {
        this(config, new LatencySimulator(), Clock.systemUTC());
    }

    MockCallPipeline(MockServiceConfig config, LatencySimulator latencySimulator, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.scenarioResolver = new ScenarioResolver(config.defaultScenario());
        this.latencySimulator = Objects.requireNonNull(latencySimulator, "latencySimulator");
        this.requestLog = new RequestLog(config.logRequests());
        this.performance = new PerformanceAggregator();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MockServiceConfig config() {
        return config;
    }

    public TestScenario resolveScenario(Optional<TestScenario> override) {
        return scenarioResolver.resolve(override);
    }

    /**
     * Runs a payload-producing call. Failure scenarios never invoke {@code payload}; the timeout scenario
     * skips the simulated delay so it fails fast whatever the latency bounds.
     * Exceptions thrown by {@code payload} are logged as failed calls and complete the future exceptionally.
     */
    public <T> CompletableFuture<ServiceResult<T>> execute(String operation, TestScenario scenario,
                                                          Supplier<ServiceResult<T>> payload) {
        long started = System.nanoTime();
        Optional<MockServiceException> failure = scenarioResolver.failureFor(scenario, operation);
        long latency = config.simulateLatency() && scenario != TestScenario.TIMEOUT ? drawLatency() : 0;
        return CompletableFuture.supplyAsync(() -> {
            ServiceResult<T> result;
            try {
                result = failure.isPresent() ? ServiceResult.failure(failure.get()) : payload.get();
            } catch (RuntimeException ex) {
                LOGGER.error("Mock {} failed unexpectedly under scenario {}", operation, scenario, ex);
                record(operation, scenario, latency, started, false,
                        Optional.of(ex.getMessage() == null ? ex.toString() : ex.getMessage()));
                throw ex;
            }
            record(operation, scenario, latency, started, result.success(), result.error().map(Throwable::getMessage));
            return result;
        }, latencySimulator.executorFor(latency));
    }

    /**
     * Runs a health probe: it always succeeds and reports the simulated latency, whatever the scenario.
     */
    public CompletableFuture<ServiceResult<HealthReport>> observe(String operation, TestScenario scenario,
                                                                  LongFunction<HealthReport> report) {
        long started = System.nanoTime();
        long latency = config.simulateLatency() ? drawLatency() : 0;
        return CompletableFuture.supplyAsync(() -> {
            ServiceResult<HealthReport> result = ServiceResult.ok(report.apply(latency));
            record(operation, scenario, latency, started, true, Optional.empty());
            return result;
        }, latencySimulator.executorFor(latency));
    }

    /**
     * Records a call rejected by a precondition before any latency was simulated.
     */
    public void recordRejected(String operation, TestScenario scenario, ServiceException error) {
        record(operation, scenario, 0, System.nanoTime(), false, Optional.ofNullable(error.getMessage()));
    }

    public RequestLog requestLog() {
        return requestLog;
    }

    public PerformanceAggregator performance() {
        return performance;
    }

    public long lastSimulatedLatency() {
        return latencySimulator.lastDrawn();
    }

    private long drawLatency() {
        return latencySimulator.draw(config.minLatencyMs(), config.maxLatencyMs());
    }

    private void record(String operation, TestScenario scenario, long latency, long startedNanos, boolean success,
                        Optional<String> error) {
        long durationMs = Math.max(0, (System.nanoTime() - startedNanos) / 1_000_000);
        requestLog.append(new RequestLogEntry(clock.instant(), operation, scenario, latency, success, error));
        performance.record(operation, durationMs);
    }
}
