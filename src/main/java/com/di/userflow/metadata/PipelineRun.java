package com.di.userflow.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for the {@code pipeline_runs} audit table.
 *
 * <p>One row per execution. Re-running the same schedule slot produces a second row with the
 * same {@code runId} and a new {@code id}.
 *
 * <pre>Status flow:
 *   PENDING → GATING → EXTRACTING → STAGING → LOADING → VALIDATING → SUCCEEDED
 *   (any stage) → FAILED | CANCELLED
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRun {

    private String  id;
    private String  runId;
    private Instant scheduleTimestamp;

    // ---- lifecycle ---------------------------------------------------------
    private String  status;
    private String  failedStep;
    private String  failureKind;
    private String  errorCategory;
    private String  errorMessage;

    // ---- outcome -----------------------------------------------------------
    private String  loadedKey;
    private Boolean stagingRemoved;

    /** JSON map of step name → attempts. */
    private String  attemptsJson;

    // ---- timestamps --------------------------------------------------------
    private Instant startedAt;
    private Instant finishedAt;
}
