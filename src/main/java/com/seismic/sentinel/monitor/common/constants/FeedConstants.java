package com.seismic.sentinel.monitor.common.constants;

/**
 * GeoJSON field names of the USGS summary feeds.
 */
public final class FeedConstants {

    public static final String USER_AGENT = "seismic-sentinel/0.1 (+https://earthquake.usgs.gov)";

    // GeoJSON
    public static final String F_FEATURES = "features";
    public static final String F_ID = "id";
    public static final String F_PROPERTIES = "properties";
    public static final String F_GEOMETRY = "geometry";
    public static final String F_COORDINATES = "coordinates";
    public static final String P_TIME = "time";
    public static final String P_UPDATED = "updated";
    public static final String P_MAG = "mag";
    public static final String P_PLACE = "place";
    public static final String P_URL = "url";
    public static final String P_STATUS = "status";
    public static final String P_TSUNAMI = "tsunami";
    public static final String P_TYPE = "type";

    // Plausible magnitude range; anything outside is treated as a malformed record
    public static final double MIN_MAGNITUDE = -2.0;
    public static final double MAX_MAGNITUDE = 10.0;

    private FeedConstants() {
    }
}
