package com.seismic.sentinel.monitor.common.exception;

import lombok.Getter;

/**
 * Base exception for the monitoring pipeline. Carries an error code that the web layer maps to a status.
 */
@Getter
public abstract class BaseMonitorException extends RuntimeException {

    private final String errorCode;

    protected BaseMonitorException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseMonitorException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseMonitorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
