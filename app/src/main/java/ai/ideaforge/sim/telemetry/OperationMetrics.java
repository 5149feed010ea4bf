package ai.ideaforge.sim.telemetry;

/**
 * Running statistics of one operation's call durations.
 */
public record OperationMetrics(long totalRequests, double averageDurationMs, long minDurationMs, long maxDurationMs) {

    public static final OperationMetrics EMPTY = new OperationMetrics(0, 0.0, 0, 0);

    public OperationMetrics {
        if (totalRequests < 0) {
            throw new IllegalArgumentException("totalRequests must not be negative");
        }
    }

    OperationMetrics record(long durationMs) {
        long count = totalRequests + 1;
        double average = averageDurationMs + (durationMs - averageDurationMs) / count;
        long min = totalRequests == 0 ? durationMs : Math.min(minDurationMs, durationMs);
        long max = totalRequests == 0 ? durationMs : Math.max(maxDurationMs, durationMs);
        return new OperationMetrics(count, average, min, max);
    }
}
