package ai.ideaforge.sim.telemetry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-operation call statistics kept as a running mean so memory stays constant however long a suite runs.
 */
public class PerformanceAggregator {

    private final Map<String, OperationMetrics> metrics = new HashMap<>();

    public synchronized void record(String operation, long durationMs) {
        Objects.requireNonNull(operation, "operation");
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative");
        }
        metrics.merge(operation, OperationMetrics.EMPTY.record(durationMs), (current, ignored) -> current.record(durationMs));
    }

    public synchronized OperationMetrics metrics(String operation) {
        return metrics.getOrDefault(operation, OperationMetrics.EMPTY);
    }

    public synchronized SortedMap<String, OperationMetrics> snapshot() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(metrics));
    }

    public synchronized void clear() {
        metrics.clear();
    }
}
