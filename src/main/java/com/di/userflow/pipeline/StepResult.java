package com.di.userflow.pipeline;

import java.util.Objects;

/**
 * Result-or-failure value returned by every step. The runner inspects it and drives retry
 * and state transitions; steps never decide whether the run continues.
 *
 * @param <T> value produced on success
 */
public final class StepResult<T> {

    private final T           value;
    private final StepFailure failure;

    private StepResult(T value, StepFailure failure) {
        this.value   = value;
        this.failure = failure;
    }

    public static <T> StepResult<T> ok(T value) {
        return new StepResult<>(value, null);
    }

    public static <T> StepResult<T> failed(StepFailure failure) {
        return new StepResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public static <T> StepResult<T> failed(FailureKind kind, String message) {
        return failed(StepFailure.of(kind, message));
    }

    public static <T> StepResult<T> failed(FailureKind kind, String message, Throwable cause) {
        return failed(StepFailure.of(kind, message, cause));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @throws IllegalStateException when called on a failed result
     */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value on failed result: " + failure);
        }
        return value;
    }

    /** Null on success. */
    public StepFailure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OK(" + value + ")" : "FAILED(" + failure + ")";
    }
}
