package ai.ideaforge.sim.mock;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Draws artificial call latencies and provides executors that run work after them without blocking a thread.
 */
public class LatencySimulator {

    private static final Executor DIRECT = Runnable::run;

    private final Random random;
    private volatile long lastDrawn;

    public LatencySimulator() {
        this(new Random());
    }

    LatencySimulator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Draws a latency uniformly from {@code [minMs, maxMs]} and remembers it.
     */
    public long draw(int minMs, int maxMs) {
        if (minMs < 0 || minMs > maxMs) {
            throw new IllegalArgumentException("Invalid latency bounds [" + minMs + ", " + maxMs + "]");
        }
        long latency = minMs + (minMs == maxMs ? 0 : random.nextInt(maxMs - minMs + 1));
        lastDrawn = latency;
        return latency;
    }

    public long lastDrawn() {
        return lastDrawn;
    }

    /**
     * Executor that starts submitted work after {@code latencyMs}; zero runs it on the calling thread.
     */
    public Executor executorFor(long latencyMs) {
        if (latencyMs <= 0) {
            return DIRECT;
        }
        return CompletableFuture.delayedExecutor(latencyMs, TimeUnit.MILLISECONDS);
    }
}
