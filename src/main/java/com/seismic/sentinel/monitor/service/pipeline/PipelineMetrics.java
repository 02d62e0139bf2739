package com.seismic.sentinel.monitor.service.pipeline;

import com.seismic.sentinel.monitor.enums.FetchErrorKind;
import com.seismic.sentinel.monitor.model.CycleReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters for the refresh cycle plus the last error and last cycle report.
 */
@Slf4j
@Component
public class PipelineMetrics {

    public static final String CYCLES_STARTED = "cycles.started";
    public static final String CYCLES_PUBLISHED = "cycles.published";
    public static final String EVENTS_FETCHED = "events.fetched";
    public static final String RECORDS_SKIPPED = "records.skipped";
    public static final String EVENTS_ADDED = "events.added";
    public static final String EVENTS_REVISED = "events.revised";
    public static final String EVENTS_UNCHANGED = "events.unchanged";
    public static final String EVENTS_EVICTED = "events.evicted";
    public static final String RECOMMENDATIONS_EMITTED = "recommendations.emitted";
    public static final String ERRORS_FETCH_TRANSIENT = "errors.fetch.transient";
    public static final String ERRORS_FETCH_PERMANENT = "errors.fetch.permanent";
    public static final String ERRORS_PROCESSING = "errors.processing";

    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final PercentileWindow cycleDurations;

    private volatile String lastError;
    private volatile Instant lastErrorAt;
    private volatile CycleReport lastCycle;

    public PipelineMetrics(@Qualifier("cycleDurationWindow") PercentileWindow cycleDurations) {
        this.cycleDurations = cycleDurations;
    }

    public void cycleStarted() {
        increment(CYCLES_STARTED, 1);
    }

    public void recordFetchFailure(FetchErrorKind kind, String message, Instant at) {
        increment(kind == FetchErrorKind.TRANSIENT ? ERRORS_FETCH_TRANSIENT : ERRORS_FETCH_PERMANENT, 1);
        noteError(message, at);
    }

    public void recordProcessingFailure(String message, Instant at) {
        increment(ERRORS_PROCESSING, 1);
        noteError(message, at);
    }

    /**
     * Folds a finished cycle into the counters. Failed cycles only contribute what they got through.
     */
    public void recordCycle(CycleReport report) {
        increment(EVENTS_FETCHED, report.fetched());
        increment(RECORDS_SKIPPED, report.skippedRecords());
        increment(EVENTS_ADDED, report.added());
        increment(EVENTS_REVISED, report.revised());
        increment(EVENTS_UNCHANGED, report.unchanged());
        increment(EVENTS_EVICTED, report.evicted());
        increment(RECOMMENDATIONS_EMITTED, report.recommendations());
        if (report.error() == null) increment(CYCLES_PUBLISHED, 1);

        cycleDurations.record(report.durationMs());
        lastCycle = report;
        log.debug("Recorded cycle #{} {} in {}ms", report.cycleNumber(), report.outcome(), report.durationMs());
    }

    public long get(String counter) {
        LongAdder a = counters.get(counter);
        return a == null ? 0L : a.sum();
    }

    public long getErrorCount() {
        return get(ERRORS_FETCH_TRANSIENT) + get(ERRORS_FETCH_PERMANENT) + get(ERRORS_PROCESSING);
    }

    public Map<String, Long> counters() {
        Map<String, Long> out = new TreeMap<>();
        counters.forEach((k, v) -> out.put(k, v.sum()));
        return out;
    }

    public long cycleDurationP95Ms() {
        return cycleDurations.percentile(95);
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getLastErrorAt() {
        return lastErrorAt;
    }

    public CycleReport getLastCycle() {
        return lastCycle;
    }

    private void noteError(String message, Instant at) {
        lastError = message;
        lastErrorAt = at;
    }

    private void increment(String key, long by) {
        if (by <= 0) {
            counters.computeIfAbsent(key, k -> new LongAdder());
            return;
        }
        counters.computeIfAbsent(key, k -> new LongAdder()).add(by);
    }
}
