package com.seismic.sentinel.monitor.core;

import com.seismic.sentinel.monitor.common.exception.ValidationException;
import com.seismic.sentinel.monitor.model.EventRecord;
import com.seismic.sentinel.monitor.model.IngestStats;
import com.seismic.sentinel.monitor.model.RawEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Heap-backed EventStore. State lives for the lifetime of the process only.
 */
@Slf4j
public final class InMemoryEventStore implements EventStore {

    public static final Comparator<EventRecord> NEWEST_FIRST =
            Comparator.comparing(EventRecord::getObservedAt).reversed()
                    .thenComparing(EventRecord::getId);

    private final ConcurrentMap<String, EventRecord> byId = new ConcurrentHashMap<>();

    @Override
    public IngestStats upsert(Collection<RawEvent> events, Instant now) {
        if (events == null || events.isEmpty()) return IngestStats.EMPTY;

        // reject the whole batch before touching state
        for (RawEvent raw : events) {
            if (raw == null || raw.getId() == null || raw.getObservedAt() == null || raw.getSourceUpdatedAt() == null) {
                throw new ValidationException("RawEvent without id or timestamps cannot be ingested");
            }
        }

        int added = 0;
        int revised = 0;
        int unchanged = 0;
        for (RawEvent raw : events) {
            EventRecord current = byId.get(raw.getId());
            if (current == null) {
                byId.put(raw.getId(), EventRecord.fromRaw(raw, now));
                added++;
                continue;
            }
            int cmp = raw.getSourceUpdatedAt().compareTo(current.getSourceUpdatedAt());
            if (cmp > 0) {
                byId.put(raw.getId(), current.revisedBy(raw, now));
                revised++;
            } else if (cmp == 0) {
                byId.put(raw.getId(), current.withLastSeenAt(now));
                unchanged++;
            } else {
                // stale revision
                log.debug("Ignoring stale revision of {} ({} < {})", raw.getId(),
                        raw.getSourceUpdatedAt(), current.getSourceUpdatedAt());
                unchanged++;
            }
        }
        return new IngestStats(added, revised, unchanged);
    }

    @Override
    public int evict(Instant olderThan) {
        int before = byId.size();
        byId.values().removeIf(r -> r.getObservedAt().isBefore(olderThan));
        return before - byId.size();
    }

    @Override
    public List<EventRecord> snapshotView() {
        List<EventRecord> copy = new ArrayList<>(byId.values());
        copy.sort(NEWEST_FIRST);
        return List.copyOf(copy);
    }

    @Override
    public int size() {
        return byId.size();
    }

    @Override
    public void clear() {
        byId.clear();
    }
}
