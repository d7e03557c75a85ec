package com.di.userflow.pipeline;

/**
 * Run lifecycle.
 *
 * <pre>
 *   PENDING → GATING → EXTRACTING → STAGING → LOADING → VALIDATING → SUCCEEDED
 *   (any non-terminal) → FAILED | CANCELLED
 * </pre>
 */
public enum RunState {
    PENDING,
    GATING,
    EXTRACTING,
    STAGING,
    LOADING,
    VALIDATING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
