package com.di.userflow.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * User-visible result of one run: {@code SUCCEEDED}, or {@code FAILED}/{@code CANCELLED}
 * with the failing step and cause.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunOutcome {

    /** Audit row id of this execution. */
    private String id;

    /** Schedule-slot identifier, shared by re-runs of the same slot. */
    private String runId;

    private Instant scheduleTimestamp;

    /** Terminal state: SUCCEEDED, FAILED or CANCELLED. */
    private RunState status;

    /** Step that failed; null on success. */
    private String failedStep;

    /** Failure kind of the last attempt of {@link #failedStep}. */
    private FailureKind failureKind;

    private String errorCategory;

    /** Human-readable summary or error detail. */
    private String message;

    /** Destination key written by the load step, when it ran. */
    private String loadedKey;

    /** Attempts per step, in execution order. */
    private Map<String, Integer> attempts;

    /** Whether the staging file for this run was confirmed absent after finalization. */
    private boolean stagingRemoved;

    private Instant startedAt;
    private Instant finishedAt;

    /** State transitions and failed attempts, in order. */
    private List<String> trace;

    public boolean isSucceeded() {
        return status == RunState.SUCCEEDED;
    }
}
