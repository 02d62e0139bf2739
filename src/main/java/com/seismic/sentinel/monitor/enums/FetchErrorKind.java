package com.seismic.sentinel.monitor.enums;

public enum FetchErrorKind {
    TRANSIENT,  // timeout, connection refused, 5xx
    PERMANENT   // 4xx, unparsable payload
}
