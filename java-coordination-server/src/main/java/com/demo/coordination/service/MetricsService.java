package com.demo.coordination.service;

import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Log-based metrics for locks and runs.
 *
 * Counters and gauges are also kept in memory so they can be inspected in tests.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only mode)");
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        String key = name + render(tags);
        long count = counters.computeIfAbsent(key, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", key, count);
    }

    public long getCounter(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    // ===== Timer Metrics =====

    public void recordTimer(String name, Duration duration, Tags tags) {
        log.debug("[METRIC] Timer: {}{} = {}ms", name, render(tags), duration.toMillis());
    }

    // ===== Gauge Metrics =====

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public int getGauge(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    // ===== Business Metrics =====

    public void recordLockGranted(String operation, String kind) {
        incrementCounter("locks.granted");
        incrementCounter("locks.granted", Tags.of("operation", operation, "kind", kind));
    }

    public void recordLockConflict(String operation, String heldKind) {
        incrementCounter("locks.conflicts");
        incrementCounter("locks.conflicts", Tags.of("operation", operation, "held", heldKind));
        log.info("Lock conflict: operation={}, held={}", operation, heldKind);
    }

    public void recordLockReleased() {
        incrementCounter("locks.released");
    }

    public void recordLockLost() {
        incrementCounter("locks.lost");
        log.warn("Lock lost while streaming");
    }

    public void recordRunStarted(String runId) {
        incrementCounter("runs.started");
        incrementGauge("runs.active");
        log.info("Run started: runId={}", runId);
    }

    public void recordRunCompleted(String runId, Duration duration, int increments) {
        incrementCounter("runs.completed");
        decrementGauge("runs.active");
        recordTimer("runs.duration", duration, Tags.of("outcome", "complete"));
        log.info("Run completed: runId={}, increments={}, duration={}ms", runId, increments, duration.toMillis());
    }

    public void recordRunFailed(String runId, String errorType) {
        incrementCounter("runs.failed");
        incrementCounter("runs.failed", Tags.of("type", errorType));
        decrementGauge("runs.active");
        log.warn("Run failed: runId={}, type={}", runId, errorType);
    }

    public void recordRunChained(String moderatorRunId, String chainedRunId) {
        incrementCounter("runs.chained");
        log.info("Run chained: from={}, to={}", moderatorRunId, chainedRunId);
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors", Tags.of("type", errorType, "component", component));
        log.error("Error recorded: type={}, component={}", errorType, component);
    }

    private static String render(Tags tags) {
        String rendered = StreamSupport.stream(tags.spliterator(), false)
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .collect(Collectors.joining(","));
        return rendered.isEmpty() ? "" : "[" + rendered + "]";
    }
}
