package com.seismic.sentinel.monitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * An event held by the ingestion store. {@code id} and {@code observedAt} never change once ingested;
 * a newer source revision replaces the remaining fields.
 */
@Value
@Builder(toBuilder = true)
public class EventRecord {
    String id;
    Instant observedAt;
    GeoLocation location;
    double magnitude;
    Instant sourceUpdatedAt;
    @With
    Instant lastSeenAt;

    String place;
    String url;
    String status;
    boolean tsunami;
    String eventType;

    public static EventRecord fromRaw(RawEvent raw, Instant seenAt) {
        return EventRecord.builder()
                .id(raw.getId())
                .observedAt(raw.getObservedAt())
                .location(raw.getLocation())
                .magnitude(raw.getMagnitude())
                .sourceUpdatedAt(raw.getSourceUpdatedAt())
                .lastSeenAt(seenAt)
                .place(raw.getPlace())
                .url(raw.getUrl())
                .status(raw.getStatus())
                .tsunami(raw.isTsunami())
                .eventType(raw.getEventType())
                .build();
    }

    /**
     * Applies a source revision. Identity and event time are kept from this record.
     */
    public EventRecord revisedBy(RawEvent raw, Instant seenAt) {
        return toBuilder()
                .location(raw.getLocation())
                .magnitude(raw.getMagnitude())
                .sourceUpdatedAt(raw.getSourceUpdatedAt())
                .lastSeenAt(seenAt)
                .place(raw.getPlace())
                .url(raw.getUrl())
                .status(raw.getStatus())
                .tsunami(raw.isTsunami())
                .eventType(raw.getEventType())
                .build();
    }

    public boolean hasLocation() {
        return location != null;
    }
}
