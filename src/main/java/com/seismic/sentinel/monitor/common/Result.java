package com.seismic.sentinel.monitor.common;

import com.seismic.sentinel.monitor.common.exception.BaseMonitorException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a service call handed to the web layer: either a payload or an error code with a message.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    public static <T> Result<T> fail(BaseMonitorException e) {
        return new Result<>(false, null, e.getMessage(), e.getErrorCode());
    }

    public boolean isOk() {
        return success;
    }

    /**
     * Alias for the payload (same as getData()).
     */
    public T get() {
        return data;
    }

    /**
     * Maps the payload when OK; propagates failure otherwise.
     */
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (!success) return Result.fail(errorCode, error);
        return Result.ok(mapper.apply(data));
    }
}
