package com.seismic.sentinel.monitor.service.export;

import com.seismic.sentinel.monitor.model.EventRecord;
import com.seismic.sentinel.monitor.model.GeoLocation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Renders event records as RFC 4180 CSV, one row per event in the given order.
 */
@Component
public class EventCsvExporter {

    static final String HEADER = "id,observed_at,source_updated_at,last_seen_at,magnitude,latitude,longitude,depth_km,place,status,tsunami,event_type,url";

    public String toCsv(List<EventRecord> events) {
        StringBuilder sb = new StringBuilder(HEADER).append("\r\n");
        if (events == null) return sb.toString();
        for (EventRecord e : events) {
            GeoLocation loc = e.getLocation();
            sb.append(escape(e.getId())).append(',')
                    .append(ts(e.getObservedAt())).append(',')
                    .append(ts(e.getSourceUpdatedAt())).append(',')
                    .append(ts(e.getLastSeenAt())).append(',')
                    .append(e.getMagnitude()).append(',')
                    .append(loc == null ? "" : String.valueOf(loc.latitude())).append(',')
                    .append(loc == null ? "" : String.valueOf(loc.longitude())).append(',')
                    .append(loc == null || loc.depthKm() == null ? "" : String.valueOf(loc.depthKm())).append(',')
                    .append(escape(e.getPlace())).append(',')
                    .append(escape(e.getStatus())).append(',')
                    .append(e.isTsunami()).append(',')
                    .append(escape(e.getEventType())).append(',')
                    .append(escape(e.getUrl()))
                    .append("\r\n");
        }
        return sb.toString();
    }

    private static String ts(Instant t) {
        return t == null ? "" : t.toString();
    }

    static String escape(String v) {
        if (v == null) return "";
        boolean quote = v.indexOf(',') >= 0 || v.indexOf('"') >= 0 || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0;
        if (!quote) return v;
        return '"' + v.replace("\"", "\"\"") + '"';
    }
}
