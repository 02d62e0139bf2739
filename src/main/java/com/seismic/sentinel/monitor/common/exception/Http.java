package com.seismic.sentinel.monitor.common.exception;

import com.seismic.sentinel.monitor.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

public final class Http {
    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        }
        String errorCode = r.getErrorCode();
        if (errorCode == null) {
            return ResponseEntity.badRequest().body(r.getError());
        }

        HttpStatus status = switch (errorCode) {
            case "SNAPSHOT_UNAVAILABLE", "SHUTTING_DOWN" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "CYCLE_IN_PROGRESS" -> HttpStatus.CONFLICT;
            case "ERR-FEED-TRANSIENT", "ERR-FEED-PERMANENT" -> HttpStatus.BAD_GATEWAY;
            case "ERR-PROC-001", "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            case "ERR-VAL-001" -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.BAD_REQUEST;
        };

        return ResponseEntity.status(status).body(new ErrorResponse(errorCode, r.getError(), r.getTimestamp()));
    }

    /**
     * Error body returned to clients.
     */
    private record ErrorResponse(String code, String message, java.time.Instant timestamp) {}
}
