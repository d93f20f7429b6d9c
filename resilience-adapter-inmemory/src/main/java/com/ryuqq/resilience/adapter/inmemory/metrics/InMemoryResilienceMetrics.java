package com.ryuqq.resilience.adapter.inmemory.metrics;

import com.ryuqq.resilience.core.error.ErrorKind;
import com.ryuqq.resilience.core.model.SystemEvent;
import com.ryuqq.resilience.core.spi.ResilienceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory implementation of {@link ResilienceMetrics} for testing and local runs.
 *
 * <p>Keeps per-dependency success and failure counters, accumulated success durations and
 * every recorded {@link SystemEvent} in arrival order. All operations are thread-safe.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Unbounded event list</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryResilienceMetrics implements ResilienceMetrics {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResilienceMetrics.class);

    private final Map<String, LongAdder> successes = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> successDurations = new ConcurrentHashMap<>();
    private final Map<String, Map<ErrorKind, LongAdder>> failures = new ConcurrentHashMap<>();
    private final List<SystemEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void recordOperationSuccess(String dependency, long durationMs) {
        successes.computeIfAbsent(dependency, key -> new LongAdder()).increment();
        successDurations.computeIfAbsent(dependency, key -> new LongAdder()).add(durationMs);
    }

    @Override
    public void recordOperationFailure(String dependency, ErrorKind kind) {
        failures.computeIfAbsent(dependency, key -> new ConcurrentHashMap<>())
            .computeIfAbsent(kind, key -> new LongAdder())
            .increment();
    }

    @Override
    public void recordSystemEvent(SystemEvent event) {
        events.add(event);
        log.debug("System event recorded: {} {}", event.type(), event.attributes());
    }

    public long getSuccessCount(String dependency) {
        LongAdder counter = successes.get(dependency);
        return counter == null ? 0 : counter.sum();
    }

    /**
     * Total failures for a dependency across all kinds.
     *
     * @param dependency dependency name
     * @return failure count
     */
    public long getFailureCount(String dependency) {
        Map<ErrorKind, LongAdder> byKind = failures.get(dependency);
        if (byKind == null) {
            return 0;
        }
        long total = 0;
        for (LongAdder counter : byKind.values()) {
            total += counter.sum();
        }
        return total;
    }

    public long getFailureCount(String dependency, ErrorKind kind) {
        Map<ErrorKind, LongAdder> byKind = failures.get(dependency);
        if (byKind == null) {
            return 0;
        }
        LongAdder counter = byKind.get(kind);
        return counter == null ? 0 : counter.sum();
    }

    /**
     * Failure counts for a dependency grouped by kind.
     *
     * @param dependency dependency name
     * @return counts per kind (empty if none)
     */
    public Map<ErrorKind, Long> getFailureCountsByKind(String dependency) {
        Map<ErrorKind, Long> counts = new EnumMap<>(ErrorKind.class);
        Map<ErrorKind, LongAdder> byKind = failures.get(dependency);
        if (byKind != null) {
            byKind.forEach((kind, counter) -> counts.put(kind, counter.sum()));
        }
        return counts;
    }

    /**
     * Mean duration of successful operations.
     *
     * @param dependency dependency name
     * @return mean duration in milliseconds, or 0 if there were no successes
     */
    public double getAverageDurationMs(String dependency) {
        long count = getSuccessCount(dependency);
        if (count == 0) {
            return 0.0;
        }
        return (double) successDurations.get(dependency).sum() / count;
    }

    public List<SystemEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<SystemEvent> getEvents(String type) {
        List<SystemEvent> matching = new ArrayList<>();
        for (SystemEvent event : events) {
            if (event.type().equals(type)) {
                matching.add(event);
            }
        }
        return matching;
    }

    /**
     * Clears all counters and events.
     */
    public void reset() {
        successes.clear();
        successDurations.clear();
        failures.clear();
        events.clear();
    }
}
