package com.seismic.sentinel.monitor.common.exception;

/**
 * A fault while ingesting, deriving features or analysing. The cycle is abandoned and the
 * previously published snapshot stays in place.
 */
public class ProcessingException extends BaseMonitorException {
    private static final String DEFAULT_ERROR_CODE = "ERR-PROC-001";

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
