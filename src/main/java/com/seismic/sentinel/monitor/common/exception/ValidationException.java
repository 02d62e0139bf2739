package com.seismic.sentinel.monitor.common.exception;

/**
 * Exception for invalid input handed to the pipeline.
 */
public class ValidationException extends BaseMonitorException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
