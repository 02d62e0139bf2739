package com.seismic.sentinel.monitor.core;

import com.seismic.sentinel.monitor.model.EventRecord;
import com.seismic.sentinel.monitor.model.IngestStats;
import com.seismic.sentinel.monitor.model.RawEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Deduplicated, time-windowed set of known events.
 *
 * Contracts:
 *  - At most one record per id.
 *  - upsert(...) is idempotent and never regresses a record to an older source revision.
 *  - Only one writer at a time is expected; snapshotView() may be called concurrently.
 */
public interface EventStore {

    /**
     * Inserts new ids, applies newer source revisions and refreshes lastSeenAt on re-observation.
     */
    IngestStats upsert(Collection<RawEvent> events, Instant now);

    /**
     * Removes records observed strictly before {@code olderThan}.
     *
     * @return number of removed records
     */
    int evict(Instant olderThan);

    /**
     * Read-only copy ordered by observedAt descending, then id.
     */
    List<EventRecord> snapshotView();

    int size();

    void clear();
}
