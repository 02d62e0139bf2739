package com.seismic.sentinel.monitor.service.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seismic.sentinel.monitor.common.exception.FeedFetchException;
import com.seismic.sentinel.monitor.enums.FetchErrorKind;
import com.seismic.sentinel.monitor.model.FeedBatch;
import com.seismic.sentinel.monitor.model.GeoLocation;
import com.seismic.sentinel.monitor.model.RawEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.seismic.sentinel.monitor.common.constants.FeedConstants.*;

/**
 * Maps a GeoJSON FeatureCollection onto {@link RawEvent}s by explicit field extraction.
 * A malformed feature is skipped and counted; only a payload that is not a FeatureCollection fails the fetch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeoJsonEventParser {

    private final ObjectMapper mapper;

    public FeedBatch parse(String body, Instant fetchedAt) {
        if (body == null || body.trim().isEmpty()) {
            throw new FeedFetchException(FetchErrorKind.PERMANENT, "Feed returned an empty body");
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FeedFetchException(FetchErrorKind.PERMANENT, "Feed payload is not valid JSON", e);
        }
        JsonNode features = root == null ? null : root.get(F_FEATURES);
        if (features == null || !features.isArray()) {
            throw new FeedFetchException(FetchErrorKind.PERMANENT, "Feed payload has no features array");
        }

        List<RawEvent> events = new ArrayList<>(features.size());
        int skipped = 0;
        for (JsonNode f : features) {
            Optional<RawEvent> ev = parseFeature(f);
            if (ev.isPresent()) {
                events.add(ev.get());
            } else {
                skipped++;
            }
        }
        return new FeedBatch(List.copyOf(events), skipped, fetchedAt);
    }

    Optional<RawEvent> parseFeature(JsonNode f) {
        if (f == null || !f.isObject()) return reject(null, "not an object");

        String id = text(f.get(F_ID));
        if (id == null) return reject(null, "missing id");

        JsonNode props = f.get(F_PROPERTIES);
        if (props == null || !props.isObject()) return reject(id, "missing properties");

        Instant observedAt = epochMillis(props.get(P_TIME));
        if (observedAt == null) return reject(id, "missing or non-numeric time");
        Instant updatedAt = epochMillis(props.get(P_UPDATED));

        JsonNode magNode = props.get(P_MAG);
        if (magNode == null || !magNode.isNumber()) return reject(id, "missing or non-numeric mag");
        double mag = magNode.asDouble();
        if (!Double.isFinite(mag) || mag < MIN_MAGNITUDE || mag > MAX_MAGNITUDE) {
            return reject(id, "magnitude out of range: " + mag);
        }

        return Optional.of(RawEvent.builder()
                .id(id)
                .observedAt(observedAt)
                .sourceUpdatedAt(updatedAt == null ? observedAt : updatedAt)
                .magnitude(mag)
                .location(location(f.get(F_GEOMETRY)))
                .place(text(props.get(P_PLACE)))
                .url(text(props.get(P_URL)))
                .status(text(props.get(P_STATUS)))
                .tsunami(flag(props.get(P_TSUNAMI)))
                .eventType(text(props.get(P_TYPE)))
                .build());
    }

    /**
     * Coordinates are [longitude, latitude, depth]. Missing or out-of-range lon/lat yields an unknown location.
     */
    private static GeoLocation location(JsonNode geometry) {
        if (geometry == null || !geometry.isObject()) return null;
        JsonNode coords = geometry.get(F_COORDINATES);
        if (coords == null || !coords.isArray() || coords.size() < 2) return null;

        JsonNode lon = coords.get(0);
        JsonNode lat = coords.get(1);
        if (!lon.isNumber() || !lat.isNumber()) return null;
        double lo = lon.asDouble();
        double la = lat.asDouble();
        if (la < -90.0 || la > 90.0 || lo < -180.0 || lo > 180.0) return null;

        Double depth = null;
        if (coords.size() > 2 && coords.get(2).isNumber() && Double.isFinite(coords.get(2).asDouble())) {
            depth = coords.get(2).asDouble();
        }
        return new GeoLocation(la, lo, depth);
    }

    private static Instant epochMillis(JsonNode n) {
        if (n == null || !n.isIntegralNumber()) return null;
        return Instant.ofEpochMilli(n.asLong());
    }

    private static String text(JsonNode n) {
        if (n == null || n.isNull()) return null;
        String s = n.isTextual() ? n.asText() : null;
        return (s == null || s.trim().isEmpty()) ? null : s.trim();
    }

    private static boolean flag(JsonNode n) {
        if (n == null || n.isNull()) return false;
        if (n.isBoolean()) return n.asBoolean();
        return n.isNumber() && n.asInt() == 1;
    }

    private static Optional<RawEvent> reject(String id, String why) {
        log.debug("Skipping feature {}: {}", id == null ? "<no id>" : id, why);
        return Optional.empty();
    }
}
