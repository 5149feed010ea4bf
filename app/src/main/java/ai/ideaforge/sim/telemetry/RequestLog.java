package ai.ideaforge.sim.telemetry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Bounded record of recent mock calls. Once full, the oldest entry is evicted for every new one.
 */
public class RequestLog {

    public static final int DEFAULT_CAPACITY = 100;

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestLog.class);

    private final boolean enabled;
    private final int capacity;
    private final Deque<RequestLogEntry> entries;

    public RequestLog(boolean enabled) {
        this(enabled, DEFAULT_CAPACITY);
    }

    public RequestLog(boolean enabled, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.enabled = enabled;
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void append(RequestLogEntry entry) {
        if (!enabled) {
            return;
        }
        synchronized (entries) {
            while (entries.size() >= capacity) {
                entries.removeFirst();
            }
            entries.addLast(entry);
        }
        write(entry);
    }

    /**
     * Snapshot of the retained entries, oldest first.
     */
    public List<RequestLogEntry> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    private void write(RequestLogEntry entry) {
        try (MDC.MDCCloseable ignoredOperation = MDC.putCloseable("operation", entry.operation());
             MDC.MDCCloseable ignoredScenario = MDC.putCloseable("scenario", entry.scenario().wireName())) {
            if (entry.success()) {
                LOGGER.info("Mock request {} completed (scenario={}, latency={}ms)",
                        entry.operation(), entry.scenario(), entry.latencyMs());
            } else {
                LOGGER.info("Mock request {} failed (scenario={}, latency={}ms): {}",
                        entry.operation(), entry.scenario(), entry.latencyMs(), entry.error().orElse("unknown error"));
            }
        }
    }
}
