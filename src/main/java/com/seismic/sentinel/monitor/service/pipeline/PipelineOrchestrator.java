package com.seismic.sentinel.monitor.service.pipeline;

import com.seismic.sentinel.monitor.common.Result;
import com.seismic.sentinel.monitor.common.exception.FeedFetchException;
import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.core.EventStore;
import com.seismic.sentinel.monitor.enums.CycleOutcome;
import com.seismic.sentinel.monitor.enums.CycleState;
import com.seismic.sentinel.monitor.enums.FetchErrorKind;
import com.seismic.sentinel.monitor.model.CycleReport;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.EventRecord;
import com.seismic.sentinel.monitor.model.FeedBatch;
import com.seismic.sentinel.monitor.model.IngestStats;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.model.Snapshot;
import com.seismic.sentinel.monitor.service.analysis.AnalysisService;
import com.seismic.sentinel.monitor.service.feed.FeedClient;
import com.seismic.sentinel.monitor.service.streaming.StreamGateway;
import com.seismic.sentinel.monitor.service.transform.FeatureDerivationService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the refresh cycle: fetch, ingest, evict, derive, analyze, publish.
 * <p>
 * Cycles never overlap; the store is only mutated while {@link #cycleLock} is held. The published
 * {@link Snapshot} is swapped by reference, so readers never block and never see a partial cycle.
 * A failed fetch or processing step leaves the previous snapshot in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    public static final String TOPIC_SNAPSHOT = "snapshot.published";
    public static final String TOPIC_STATE = "pipeline.state";

    private final FeedClient feedClient;
    private final EventStore store;
    private final FeatureDerivationService transform;
    private final AnalysisService analysis;
    private final PipelineMetrics metrics;
    private final StreamGateway stream;
    private final MonitorProperties props;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final AtomicReference<CycleState> state = new AtomicReference<>(CycleState.IDLE);
    private final AtomicLong cycles = new AtomicLong(0);
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * Runs one cycle unless another is in flight or the service is stopping.
     */
    public Result<CycleReport> triggerCycle() {
        if (shuttingDown.get()) return Result.fail("SHUTTING_DOWN", "Pipeline is shutting down");
        if (!cycleLock.tryLock()) return Result.fail("CYCLE_IN_PROGRESS", "A refresh cycle is already running");
        try {
            return Result.ok(runCycle());
        } finally {
            cycleLock.unlock();
        }
    }

    public Optional<Snapshot> currentSnapshot() {
        return Optional.ofNullable(current.get());
    }

    public Result<Snapshot> getSnapshot() {
        Snapshot s = current.get();
        return s == null
                ? Result.fail("SNAPSHOT_UNAVAILABLE", "No cycle has been published yet")
                : Result.ok(s);
    }

    public CycleState getState() {
        return state.get();
    }

    public Result<PipelineState> getPipelineState() {
        Snapshot s = current.get();
        return Result.ok(new PipelineState(
                state.get(),
                props.isEnabled(),
                s == null ? 0L : s.getCycleSequenceNumber(),
                s == null ? null : s.getCycleTimestamp(),
                store.size(),
                stream.subscriberCount(),
                metrics.getLastCycle(),
                metrics.counters(),
                metrics.getLastError(),
                metrics.getLastErrorAt(),
                metrics.cycleDurationP95Ms(),
                clock.instant()));
    }

    /**
     * Empties the ingestion store, waiting for an in-flight cycle first. The published snapshot is kept
     * until the next cycle replaces it.
     */
    public Result<Integer> clearStore() {
        cycleLock.lock();
        try {
            int removed = store.size();
            store.clear();
            log.info("Ingestion store cleared ({} events)", removed);
            return Result.ok(removed);
        } finally {
            cycleLock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown.set(true);
        // let an in-flight cycle finish its current step instead of interrupting a store mutation
        long waitSeconds = props.getFetchTimeoutSeconds() * 2L + 5L;
        try {
            if (cycleLock.tryLock(waitSeconds, TimeUnit.SECONDS)) {
                cycleLock.unlock();
            } else {
                log.warn("Refresh cycle still running after {}s; shutting down anyway", waitSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the refresh cycle to finish");
        }
    }

    // ---------------- cycle ----------------

    private CycleReport runCycle() {
        long cycleNumber = cycles.incrementAndGet();
        Instant startedAt = clock.instant();
        long t0 = System.nanoTime();
        metrics.cycleStarted();

        transition(CycleState.FETCHING);
        FeedBatch batch;
        try {
            batch = feedClient.fetch();
        } catch (FeedFetchException e) {
            return fetchFailed(cycleNumber, startedAt, t0, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected feed client failure", e);
            return fetchFailed(cycleNumber, startedAt, t0, FetchErrorKind.TRANSIENT, String.valueOf(e.getMessage()));
        }

        transition(CycleState.PROCESSING);
        IngestStats stats = IngestStats.EMPTY;
        int evicted = 0;
        try {
            Instant now = clock.instant();
            stats = store.upsert(batch.getEvents(), now);
            evicted = store.evict(now.minus(props.getRetentionWindow()));

            List<EventRecord> view = store.snapshotView();
            DerivedFeatureSet derived = transform.derive(view, now);
            List<Recommendation> recommendations = analysis.analyze(derived);

            Snapshot snapshot = Snapshot.builder()
                    .events(view)
                    .derivedFeatures(derived)
                    .recommendations(recommendations)
                    .cycleTimestamp(now)
                    .cycleSequenceNumber(sequence.incrementAndGet())
                    .build();
            current.set(snapshot);
            transition(CycleState.PUBLISHED);

            CycleReport report = new CycleReport(cycleNumber, CycleOutcome.PUBLISHED, startedAt, elapsedMs(t0),
                    batch.fetched(), batch.getSkipped(), stats.added(), stats.revised(), stats.unchanged(),
                    evicted, recommendations.size(), null);
            metrics.recordCycle(report);
            log.info("Cycle #{} published snapshot {}: fetched={} skipped={} added={} revised={} evicted={} events={} recommendations={}",
                    cycleNumber, snapshot.getCycleSequenceNumber(), batch.fetched(), batch.getSkipped(),
                    stats.added(), stats.revised(), evicted, view.size(), recommendations.size());

            broadcast(TOPIC_SNAPSHOT, new SnapshotPublished(snapshot.getCycleSequenceNumber(), now,
                    view.size(), recommendations));
            return report;
        } catch (RuntimeException e) {
            Instant at = clock.instant();
            metrics.recordProcessingFailure(e.getMessage(), at);
            log.warn("Cycle #{} abandoned during processing; keeping snapshot {}", cycleNumber, sequence.get(), e);
            CycleReport report = new CycleReport(cycleNumber, CycleOutcome.PROCESSING_FAILED, startedAt, elapsedMs(t0),
                    batch.fetched(), batch.getSkipped(), stats.added(), stats.revised(), stats.unchanged(),
                    evicted, 0, String.valueOf(e.getMessage()));
            metrics.recordCycle(report);
            return report;
        } finally {
            transition(CycleState.IDLE);
            broadcast(TOPIC_STATE, getPipelineState().get());
        }
    }

    private CycleReport fetchFailed(long cycleNumber, Instant startedAt, long t0, FetchErrorKind kind, String message) {
        metrics.recordFetchFailure(kind, message, clock.instant());
        if (kind == FetchErrorKind.TRANSIENT) {
            log.warn("Cycle #{} fetch failed (transient, retry next tick): {}", cycleNumber, message);
        } else {
            log.warn("Cycle #{} fetch failed (permanent): {}", cycleNumber, message);
        }
        CycleReport report = new CycleReport(cycleNumber, CycleOutcome.FETCH_FAILED, startedAt, elapsedMs(t0),
                0, 0, 0, 0, 0, 0, 0, message);
        metrics.recordCycle(report);
        transition(CycleState.IDLE);
        broadcast(TOPIC_STATE, getPipelineState().get());
        return report;
    }

    private void transition(CycleState next) {
        CycleState prev = state.getAndSet(next);
        log.debug("Pipeline {} -> {}", prev, next);
    }

    private void broadcast(String topic, Object payload) {
        try {
            stream.send(topic, payload);
        } catch (RuntimeException e) {
            log.info("Stream send failed: {} ({})", topic, e.getMessage());
        }
    }

    private static long elapsedMs(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }

    public record PipelineState(CycleState state, boolean enabled, long publishedSequence, Instant lastPublishedAt,
                                int storeSize, int streamSubscribers, CycleReport lastCycle, Map<String, Long> counters,
                                String lastError, Instant lastErrorAt, long cycleP95Ms, Instant asOf) {
    }

    public record SnapshotPublished(long cycleSequenceNumber, Instant cycleTimestamp, int eventCount,
                                    List<Recommendation> recommendations) {
    }
}
