package com.seismic.sentinel.monitor.common.exception;

import com.seismic.sentinel.monitor.enums.FetchErrorKind;
import lombok.Getter;

/**
 * Raised by the feed client when a fetch cannot produce a batch of events.
 * Transient failures are retried on the next scheduled tick; permanent ones are logged and skipped.
 */
@Getter
public class FeedFetchException extends BaseMonitorException {
    private static final String DEFAULT_ERROR_CODE = "ERR-FEED-001";

    private final FetchErrorKind kind;

    public FeedFetchException(FetchErrorKind kind, String message) {
        super(codeFor(kind), message, null);
        this.kind = kind;
    }

    public FeedFetchException(FetchErrorKind kind, String message, Throwable cause) {
        super(codeFor(kind), message, cause);
        this.kind = kind;
    }

    public boolean isTransient() {
        return kind == FetchErrorKind.TRANSIENT;
    }

    private static String codeFor(FetchErrorKind kind) {
        return kind == FetchErrorKind.TRANSIENT ? "ERR-FEED-TRANSIENT" : "ERR-FEED-PERMANENT";
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
