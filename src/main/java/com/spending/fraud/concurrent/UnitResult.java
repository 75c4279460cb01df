package com.spending.fraud.concurrent;

import java.time.Duration;

/**
 * Outcome of one unit submitted to a {@link WorkerPool}.
 *
 * @param index    position of the unit in the submitted list
 * @param status   how the unit ended
 * @param value    the worker's return value when succeeded, else null
 * @param error    the captured failure when failed, else null
 * @param duration wall time spent in the worker (zero when cancelled)
 */
public record UnitResult<R>(int index, Status status, R value, Throwable error, Duration duration) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    public static <R> UnitResult<R> succeeded(int index, R value, Duration duration) {
        return new UnitResult<>(index, Status.SUCCEEDED, value, null, duration);
    }

    public static <R> UnitResult<R> failed(int index, Throwable error, Duration duration) {
        return new UnitResult<>(index, Status.FAILED, null, error, duration);
    }

    public static <R> UnitResult<R> cancelled(int index) {
        return new UnitResult<>(index, Status.CANCELLED, null, null, Duration.ZERO);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
