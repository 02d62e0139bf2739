package com.seismic.sentinel.monitor.test.core;

import com.seismic.sentinel.monitor.common.exception.ValidationException;
import com.seismic.sentinel.monitor.core.InMemoryEventStore;
import com.seismic.sentinel.monitor.model.EventRecord;
import com.seismic.sentinel.monitor.model.GeoLocation;
import com.seismic.sentinel.monitor.model.IngestStats;
import com.seismic.sentinel.monitor.model.RawEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
    }

    @Test
    void replayingTheSameBatchIsIdempotent() {
        List<RawEvent> batch = List.of(raw("a", 10, 0, 3.1), raw("b", 20, 0, 4.2));

        IngestStats first = store.upsert(batch, NOW);
        List<EventRecord> afterFirst = store.snapshotView();
        IngestStats second = store.upsert(batch, NOW);

        assertThat(first).isEqualTo(new IngestStats(2, 0, 0));
        assertThat(second).isEqualTo(new IngestStats(0, 0, 2));
        assertThat(store.snapshotView()).isEqualTo(afterFirst);
    }

    @Test
    void replayRefreshesLastSeenOnly() {
        store.upsert(List.of(raw("a", 10, 0, 3.1)), NOW);
        Instant later = NOW.plusSeconds(60);

        store.upsert(List.of(raw("a", 10, 0, 3.1)), later);

        EventRecord r = store.snapshotView().get(0);
        assertThat(r.getLastSeenAt()).isEqualTo(later);
        assertThat(r.getMagnitude()).isEqualTo(3.1);
    }

    @Test
    void newerRevisionReplacesMutableFieldsButKeepsObservedAt() {
        store.upsert(List.of(raw("a", 10, 5, 3.1)), NOW);

        RawEvent revision = RawEvent.builder()
                .id("a")
                .observedAt(NOW.minus(Duration.ofMinutes(5)))
                .sourceUpdatedAt(NOW.minus(Duration.ofMinutes(2)))
                .magnitude(3.6)
                .location(new GeoLocation(1.0, 2.0, 8.0))
                .place("revised")
                .build();
        IngestStats stats = store.upsert(List.of(revision), NOW);

        EventRecord r = store.snapshotView().get(0);
        assertThat(stats.revised()).isEqualTo(1);
        assertThat(r.getMagnitude()).isEqualTo(3.6);
        assertThat(r.getPlace()).isEqualTo("revised");
        assertThat(r.getObservedAt()).isEqualTo(NOW.minus(Duration.ofMinutes(10)));
    }

    @Test
    void olderRevisionNeverRegressesTheRecord() {
        store.upsert(List.of(raw("a", 10, 1, 4.0)), NOW);

        IngestStats stats = store.upsert(List.of(raw("a", 10, 5, 2.0)), NOW);

        assertThat(stats).isEqualTo(new IngestStats(0, 0, 1));
        EventRecord r = store.snapshotView().get(0);
        assertThat(r.getMagnitude()).isEqualTo(4.0);
        assertThat(r.getSourceUpdatedAt()).isEqualTo(NOW.minus(Duration.ofMinutes(1)));
    }

    @Test
    void upsertOrderDoesNotChangeTheOutcome() {
        RawEvent v1 = raw("a", 10, 8, 3.0);
        RawEvent v2 = raw("a", 10, 4, 3.5);

        InMemoryEventStore other = new InMemoryEventStore();
        store.upsert(List.of(v1, v2), NOW);
        other.upsert(List.of(v2, v1), NOW);

        assertThat(store.snapshotView()).isEqualTo(other.snapshotView());
        assertThat(store.snapshotView().get(0).getMagnitude()).isEqualTo(3.5);
    }

    @Test
    void evictRemovesOnlyRecordsObservedBeforeTheCutoff() {
        store.upsert(List.of(raw("old", 60 * 25, 0, 2.0), raw("edge", 60 * 24, 0, 2.0), raw("new", 5, 0, 2.0)), NOW);

        int removed = store.evict(NOW.minus(Duration.ofHours(24)));

        assertThat(removed).isEqualTo(1);
        assertThat(store.snapshotView()).extracting(EventRecord::getId).containsExactly("new", "edge");
        assertThat(store.snapshotView())
                .allMatch(r -> !r.getObservedAt().isBefore(NOW.minus(Duration.ofHours(24))));
    }

    @Test
    void viewIsNewestFirstWithIdTieBreakAndReadOnly() {
        store.upsert(Arrays.asList(raw("c", 30, 0, 1.0), raw("b", 10, 0, 1.0), raw("a", 10, 0, 1.0)), NOW);

        List<EventRecord> view = store.snapshotView();

        assertThat(view).extracting(EventRecord::getId).containsExactly("a", "b", "c");
        assertThatThrownBy(view::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void invalidRecordRejectsTheWholeBatch() {
        RawEvent broken = RawEvent.builder().id("x").magnitude(1.0).build();

        assertThatThrownBy(() -> store.upsert(List.of(raw("a", 1, 0, 1.0), broken), NOW))
                .isInstanceOf(ValidationException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void clearEmptiesTheStore() {
        store.upsert(List.of(raw("a", 1, 0, 1.0)), NOW);
        store.clear();
        assertThat(store.size()).isZero();
        assertThat(store.snapshotView()).isEmpty();
    }

    private static RawEvent raw(String id, long observedMinutesAgo, long updatedMinutesAgo, double mag) {
        return RawEvent.builder()
                .id(id)
                .observedAt(NOW.minus(Duration.ofMinutes(observedMinutesAgo)))
                .sourceUpdatedAt(NOW.minus(Duration.ofMinutes(updatedMinutesAgo)))
                .magnitude(mag)
                .location(new GeoLocation(35.0, -117.0, 5.0))
                .place("somewhere")
                .build();
    }
}
