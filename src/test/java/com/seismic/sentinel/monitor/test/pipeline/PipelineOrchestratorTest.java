package com.seismic.sentinel.monitor.test.pipeline;

import com.seismic.sentinel.monitor.common.Result;
import com.seismic.sentinel.monitor.common.exception.FeedFetchException;
import com.seismic.sentinel.monitor.config.MonitorProperties;
import com.seismic.sentinel.monitor.core.InMemoryEventStore;
import com.seismic.sentinel.monitor.enums.CycleOutcome;
import com.seismic.sentinel.monitor.enums.CycleState;
import com.seismic.sentinel.monitor.enums.FetchErrorKind;
import com.seismic.sentinel.monitor.model.CycleReport;
import com.seismic.sentinel.monitor.model.DerivedFeatureSet;
import com.seismic.sentinel.monitor.model.FeedBatch;
import com.seismic.sentinel.monitor.model.GeoLocation;
import com.seismic.sentinel.monitor.model.RawEvent;
import com.seismic.sentinel.monitor.model.Recommendation;
import com.seismic.sentinel.monitor.model.Snapshot;
import com.seismic.sentinel.monitor.service.analysis.AnalysisRule;
import com.seismic.sentinel.monitor.service.analysis.AnalysisService;
import com.seismic.sentinel.monitor.service.analysis.rules.ElevatedRiskClusterRule;
import com.seismic.sentinel.monitor.service.feed.FeedClient;
import com.seismic.sentinel.monitor.service.pipeline.PercentileWindow;
import com.seismic.sentinel.monitor.service.pipeline.PipelineMetrics;
import com.seismic.sentinel.monitor.service.pipeline.PipelineOrchestrator;
import com.seismic.sentinel.monitor.service.streaming.StreamGateway;
import com.seismic.sentinel.monitor.service.transform.FeatureDerivationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    FeedClient feed;
    @Mock
    StreamGateway stream;

    private final AtomicBoolean ruleFails = new AtomicBoolean(false);

    private InMemoryEventStore store;
    private PipelineMetrics metrics;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        MonitorProperties props = new MonitorProperties();
        props.setFeedUrl("http://feed.test");

        AnalysisRule failSwitch = new AnalysisRule() {
            @Override
            public String name() {
                return "fail-switch";
            }

            @Override
            public Optional<Recommendation> evaluate(DerivedFeatureSet features) {
                if (ruleFails.get()) throw new IllegalStateException("rule exploded");
                return Optional.empty();
            }
        };

        store = new InMemoryEventStore();
        metrics = new PipelineMetrics(new PercentileWindow(16));
        orchestrator = new PipelineOrchestrator(feed, store, new FeatureDerivationService(props),
                new AnalysisService(List.of(new ElevatedRiskClusterRule(props), failSwitch)),
                metrics, stream, props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void snapshotIsUnavailableBeforeFirstPublish() {
        assertThat(orchestrator.currentSnapshot()).isEmpty();
        Result<Snapshot> r = orchestrator.getSnapshot();
        assertThat(r.isOk()).isFalse();
        assertThat(r.getErrorCode()).isEqualTo("SNAPSHOT_UNAVAILABLE");
        assertThat(orchestrator.getState()).isEqualTo(CycleState.IDLE);
    }

    @Test
    void successfulCyclePublishesSnapshotAndIncrementsSequence() {
        when(feed.fetch()).thenReturn(batch(
                raw("A", 6.0, 10, 35.000, -117.0),
                raw("B", 3.0, 40, 35.045, -117.0)));

        Result<CycleReport> r = orchestrator.triggerCycle();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().outcome()).isEqualTo(CycleOutcome.PUBLISHED);
        assertThat(r.get().added()).isEqualTo(2);

        Snapshot s = orchestrator.currentSnapshot().orElseThrow();
        assertThat(s.getCycleSequenceNumber()).isEqualTo(1L);
        assertThat(s.getCycleTimestamp()).isEqualTo(NOW);
        assertThat(s.getEvents()).hasSize(2);
        assertThat(s.getRecommendations()).hasSize(1);
        assertThat(s.getRecommendations().get(0).getRuleName()).isEqualTo(ElevatedRiskClusterRule.NAME);
        assertThat(orchestrator.getState()).isEqualTo(CycleState.IDLE);
        assertThat(metrics.get(PipelineMetrics.CYCLES_PUBLISHED)).isEqualTo(1L);
        verify(stream).send(eq(PipelineOrchestrator.TOPIC_SNAPSHOT), any());

        orchestrator.triggerCycle();
        Snapshot next = orchestrator.currentSnapshot().orElseThrow();
        assertThat(next.getCycleSequenceNumber()).isEqualTo(2L);
        assertThat(next.getEvents()).isEqualTo(s.getEvents());
    }

    @Test
    void unreachableFeedKeepsPriorSnapshotAndCountsTheError() {
        when(feed.fetch())
                .thenReturn(batch(raw("A", 2.0, 10, 1.0, 1.0)))
                .thenThrow(new FeedFetchException(FetchErrorKind.TRANSIENT, "Feed unreachable: Connection refused"));

        orchestrator.triggerCycle();
        Snapshot before = orchestrator.currentSnapshot().orElseThrow();
        long errorsBefore = metrics.getErrorCount();

        Result<CycleReport> r = orchestrator.triggerCycle();

        assertThat(r.isOk()).isTrue();
        assertThat(r.get().outcome()).isEqualTo(CycleOutcome.FETCH_FAILED);
        assertThat(orchestrator.currentSnapshot()).containsSame(before);
        assertThat(orchestrator.currentSnapshot().get().getCycleSequenceNumber()).isEqualTo(1L);
        assertThat(metrics.getErrorCount()).isEqualTo(errorsBefore + 1);
        assertThat(metrics.get(PipelineMetrics.ERRORS_FETCH_TRANSIENT)).isEqualTo(1L);
        assertThat(metrics.getLastError()).contains("Connection refused");
        assertThat(orchestrator.getState()).isEqualTo(CycleState.IDLE);
        verify(stream, atLeastOnce()).send(eq(PipelineOrchestrator.TOPIC_STATE), any());
    }

    @Test
    void fetchFailureBeforeAnyPublishLeavesSnapshotUnavailable() {
        when(feed.fetch()).thenThrow(new FeedFetchException(FetchErrorKind.PERMANENT, "Feed returned 404 NOT_FOUND"));

        Result<CycleReport> r = orchestrator.triggerCycle();

        assertThat(r.get().outcome()).isEqualTo(CycleOutcome.FETCH_FAILED);
        assertThat(orchestrator.currentSnapshot()).isEmpty();
        assertThat(metrics.get(PipelineMetrics.ERRORS_FETCH_PERMANENT)).isEqualTo(1L);
    }

    @Test
    void processingFaultKeepsPriorSnapshot() {
        when(feed.fetch()).thenReturn(batch(raw("A", 2.0, 10, 1.0, 1.0)));
        orchestrator.triggerCycle();
        Snapshot before = orchestrator.currentSnapshot().orElseThrow();

        ruleFails.set(true);
        Result<CycleReport> r = orchestrator.triggerCycle();

        assertThat(r.get().outcome()).isEqualTo(CycleOutcome.PROCESSING_FAILED);
        assertThat(r.get().error()).contains("rule exploded");
        assertThat(orchestrator.currentSnapshot()).containsSame(before);
        assertThat(metrics.get(PipelineMetrics.ERRORS_PROCESSING)).isEqualTo(1L);
        assertThat(orchestrator.getState()).isEqualTo(CycleState.IDLE);

        ruleFails.set(false);
        orchestrator.triggerCycle();
        assertThat(orchestrator.currentSnapshot().orElseThrow().getCycleSequenceNumber()).isEqualTo(2L);
    }

    @Test
    void retentionWindowEvictsOldEventsBeforePublishing() {
        when(feed.fetch()).thenReturn(batch(
                raw("fresh", 2.0, 30, 1.0, 1.0),
                raw("stale", 2.0, 60 * 25, 1.0, 1.0)));

        CycleReport report = orchestrator.triggerCycle().get();

        assertThat(report.evicted()).isEqualTo(1);
        assertThat(orchestrator.currentSnapshot().orElseThrow().getEvents())
                .allMatch(e -> !e.getObservedAt().isBefore(NOW.minus(Duration.ofHours(24))));
    }

    @Test
    void overlappingTriggerIsRejected() throws Exception {
        CountDownLatch inFetch = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(feed.fetch()).thenAnswer(inv -> {
            inFetch.countDown();
            release.await(5, TimeUnit.SECONDS);
            return batch(raw("A", 2.0, 10, 1.0, 1.0));
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Result<CycleReport>> running = pool.submit(orchestrator::triggerCycle);
            assertThat(inFetch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(orchestrator.getState()).isEqualTo(CycleState.FETCHING);

            Result<CycleReport> second = orchestrator.triggerCycle();
            assertThat(second.isOk()).isFalse();
            assertThat(second.getErrorCode()).isEqualTo("CYCLE_IN_PROGRESS");

            release.countDown();
            assertThat(running.get(5, TimeUnit.SECONDS).isOk()).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shutdownRejectsNewCycles() {
        orchestrator.shutdown();

        Result<CycleReport> r = orchestrator.triggerCycle();

        assertThat(r.getErrorCode()).isEqualTo("SHUTTING_DOWN");
    }

    @Test
    void clearStoreEmptiesTheStoreButKeepsTheSnapshot() {
        when(feed.fetch()).thenReturn(batch(raw("A", 2.0, 10, 1.0, 1.0)));
        orchestrator.triggerCycle();

        Result<Integer> r = orchestrator.clearStore();

        assertThat(r.get()).isEqualTo(1);
        assertThat(store.size()).isZero();
        assertThat(orchestrator.currentSnapshot()).isPresent();
        assertThat(orchestrator.getPipelineState().get().storeSize()).isZero();
    }

    @Test
    void pipelineStateReportsLiveStreamSubscribers() {
        when(stream.subscriberCount()).thenReturn(3);

        assertThat(orchestrator.getPipelineState().get().streamSubscribers()).isEqualTo(3);
    }

    private static FeedBatch batch(RawEvent... events) {
        return new FeedBatch(List.of(events), 0, NOW);
    }

    private static RawEvent raw(String id, double mag, long minutesAgo, double lat, double lon) {
        Instant t = NOW.minus(Duration.ofMinutes(minutesAgo));
        return RawEvent.builder()
                .id(id)
                .observedAt(t)
                .sourceUpdatedAt(t)
                .magnitude(mag)
                .location(new GeoLocation(lat, lon, 10.0))
                .build();
    }
}
