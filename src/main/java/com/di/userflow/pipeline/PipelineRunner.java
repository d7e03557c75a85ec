package com.di.userflow.pipeline;

import com.di.userflow.load.LoadResult;
import com.di.userflow.metadata.PipelineRun;
import com.di.userflow.metadata.PipelineRunRepository;
import com.di.userflow.staging.StagingWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one run through the fixed step chain.
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────────┐
 * │  PENDING                                                         │
 * │   → GATING      availability sensor, no retry (window is fixed)  │
 * │   → EXTRACTING  fetch + normalize one record                     │
 * │   → STAGING     user_&lt;runId&gt;.csv                               │
 * │   → LOADING     idempotent upsert by username                    │
 * │   → VALIDATING  re-query + compare with staged record            │
 * │   → SUCCEEDED                                                    │
 * │  any step, retries exhausted → FAILED(step, cause)               │
 * │  cancel requested            → CANCELLED(step)                   │
 * ├──────────────────────────────────────────────────────────────────┤
 * │  FINALLY  delete staging file for runId, then record outcome     │
 * └──────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Retries happen per step: a failed attempt is repeated after the step's fixed delay,
 * up to {@code maxRetries} more times, and the chain never restarts from the top. A step
 * may only start after its predecessor succeeded. Steps run sequentially on the calling
 * thread; at most one run at a time is expected (see {@link PipelineTrigger}).
 *
 * <p>The run audit and metrics are best-effort: a failure to write them is logged and never
 * changes the outcome.
 */
@Slf4j
public class PipelineRunner {

    private final List<PipelineStep>    steps;
    private final StagingWriter         staging;
    private final PipelineRunRepository runRepo;
    private final PipelineMetrics       metrics;
    private final Sleeper               sleeper;
    private final Clock                 clock;
    private final ObjectMapper          om;

    private final AtomicReference<RunContext> activeRun = new AtomicReference<>();

    public PipelineRunner(List<PipelineStep>    steps,
                          StagingWriter         staging,
                          PipelineRunRepository runRepo,
                          PipelineMetrics       metrics,
                          Sleeper               sleeper,
                          Clock                 clock,
                          ObjectMapper          om) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("At least one pipeline step is required");
        }
        this.steps   = List.copyOf(steps);
        this.staging = Objects.requireNonNull(staging, "staging");
        this.runRepo = runRepo;
        this.metrics = metrics;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock   = Objects.requireNonNull(clock, "clock");
        this.om      = om;
    }

    /* ==================================================================== */
    /* Entry point                                                           */
    /* ==================================================================== */

    /**
     * Executes the whole chain for one logical schedule slot and returns its terminal
     * outcome. The staging file of the slot is gone when this method returns, whatever the
     * outcome.
     */
    public RunOutcome runPipeline(Instant scheduleTimestamp) {
        RunContext ctx = new RunContext(scheduleTimestamp, clock.instant());
        String     id  = UUID.randomUUID().toString();

        activeRun.set(ctx);
        MDC.put("runId", ctx.getRunId());
        try {
            log.info("[RUNNER] runId={} id={} scheduleTimestamp={} steps={}",
                     ctx.getRunId(), id, scheduleTimestamp, stepNames());
            audit("insert", () -> runRepo.insert(PipelineRun.builder()
                    .id(id)
                    .runId(ctx.getRunId())
                    .scheduleTimestamp(scheduleTimestamp)
                    .status(RunState.PENDING.name())
                    .startedAt(ctx.getStartedAt())
                    .build()));

            RunOutcome outcome = null;
            try {
                outcome = executeSteps(ctx, id);
            } finally {
                boolean removed = releaseStaging(ctx);
                if (outcome != null) {
                    outcome.setStagingRemoved(removed);
                }
                activeRun.compareAndSet(ctx, null);
            }

            outcome.setFinishedAt(clock.instant());
            outcome.setTrace(ctx.getTrace());
            finish(outcome);
            return outcome;
        } finally {
            MDC.remove("runId");
        }
    }

    /**
     * Requests cancellation of the active run. Honoured before the next step, before the next
     * retry and between gate polls; a step already inside a blocking call finishes first.
     *
     * @return false when no run with that id is active
     */
    public boolean cancel(String runId) {
        RunContext ctx = activeRun.get();
        if (ctx == null || !ctx.getRunId().equals(runId)) {
            return false;
        }
        log.info("[RUNNER] runId={} cancellation requested in state {}", runId, ctx.getState());
        ctx.cancel();
        return true;
    }

    public Optional<RunContext> currentRun() {
        return Optional.ofNullable(activeRun.get());
    }

    public List<String> stepNames() {
        return steps.stream().map(PipelineStep::name).toList();
    }

    /* ==================================================================== */
    /* Step chain                                                            */
    /* ==================================================================== */

    private RunOutcome executeSteps(RunContext ctx, String id) {
        for (PipelineStep step : steps) {
            if (ctx.isCancelled()) {
                return terminal(ctx, id, RunState.CANCELLED, step, StepFailure.cancelled(step.name()));
            }
            ctx.transitionTo(step.state());
            audit("status", () -> runRepo.updateStatus(id, step.state().name()));

            StepResult<?> result = attempt(step, ctx);
            if (!result.isSuccess()) {
                StepFailure failure = result.getFailure();
                RunState end = failure.getKind() == FailureKind.CANCELLED ? RunState.CANCELLED : RunState.FAILED;
                return terminal(ctx, id, end, step, failure);
            }
        }

        ctx.transitionTo(RunState.SUCCEEDED);
        LoadResult loaded = ctx.getLoadResult();
        return base(ctx, id)
                .status(RunState.SUCCEEDED)
                .message(loaded == null
                        ? "Run completed"
                        : "Loaded key " + loaded.key() + " (" + loaded.action() + ")")
                .build();
    }

    /**
     * Runs one step under its retry policy.
     */
    private StepResult<?> attempt(PipelineStep step, RunContext ctx) {
        RetryPolicy policy      = step.retryPolicy();
        int         maxAttempts = policy.maxAttempts();
        StepResult<?> result    = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                log.info("[RUNNER] step={} retry {}/{} in {}",
                         step.name(), attempt - 1, policy.getMaxRetries(), policy.getDelay());
                if (!pause(policy.getDelay(), ctx) || ctx.isCancelled()) {
                    return StepResult.failed(StepFailure.cancelled(step.name()));
                }
            }

            int n = ctx.recordAttempt(step.name());
            result = invoke(step, ctx);
            if (metrics != null) {
                metrics.recordAttempt(step.name(), result);
            }

            if (result.isSuccess()) {
                if (n > 1) {
                    log.info("[RUNNER] step={} succeeded on attempt {}", step.name(), n);
                }
                return result;
            }

            StepFailure failure = result.getFailure();
            ctx.note(step.name() + " attempt " + n + "/" + maxAttempts + " failed: " + failure);
            log.warn("[RUNNER] step={} attempt {}/{} failed kind={} category={}: {}",
                     step.name(), n, maxAttempts, failure.getKind(), failure.getCategory(), failure.getMessage());
            if (!failure.isRetryable()) {
                return result;
            }
        }
        return result;
    }

    private StepResult<?> invoke(PipelineStep step, RunContext ctx) {
        try {
            StepResult<?> result = step.run(ctx);
            return result != null
                    ? result
                    : StepResult.failed(FailureKind.UNEXPECTED, "Step '" + step.name() + "' returned no result");
        } catch (RuntimeException e) {
            log.error("[RUNNER] step={} threw {}", step.name(), e.toString(), e);
            return StepResult.failed(FailureKind.UNEXPECTED,
                    "Step '" + step.name() + "' threw " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return false when interrupted; the run is then marked cancelled and the interrupt
     *         flag restored
     */
    private boolean pause(Duration delay, RunContext ctx) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.cancel();
            return false;
        }
    }

    private RunOutcome terminal(RunContext ctx, String id, RunState end, PipelineStep step, StepFailure failure) {
        ctx.transitionTo(end);
        if (end == RunState.CANCELLED) {
            log.warn("[RUNNER] runId={} CANCELLED at step={}", ctx.getRunId(), step.name());
        } else if (failure.getCause() != null) {
            log.error("[RUNNER] runId={} FAILED at step={} after {} attempt(s): {}",
                      ctx.getRunId(), step.name(), ctx.attemptsFor(step.name()), failure, failure.getCause());
        } else {
            log.error("[RUNNER] runId={} FAILED at step={} after {} attempt(s): {}",
                      ctx.getRunId(), step.name(), ctx.attemptsFor(step.name()), failure);
        }
        return base(ctx, id)
                .status(end)
                .failedStep(step.name())
                .failureKind(failure.getKind())
                .errorCategory(failure.getCategory().name())
                .message(failure.getMessage())
                .build();
    }

    private RunOutcome.RunOutcomeBuilder base(RunContext ctx, String id) {
        LoadResult loaded = ctx.getLoadResult();
        return RunOutcome.builder()
                .id(id)
                .runId(ctx.getRunId())
                .scheduleTimestamp(ctx.getScheduleTimestamp())
                .loadedKey(loaded == null ? null : loaded.key())
                .attempts(ctx.getAttempts())
                .startedAt(ctx.getStartedAt());
    }

    /* ==================================================================== */
    /* Finalization                                                          */
    /* ==================================================================== */

    private boolean releaseStaging(RunContext ctx) {
        boolean removed;
        try {
            removed = staging.delete(ctx.getRunId()) && !staging.exists(ctx.getRunId());
        } catch (RuntimeException e) {
            log.error("[RUNNER] runId={} staging cleanup failed: {}", ctx.getRunId(), e.getMessage(), e);
            removed = false;
        }
        if (removed) {
            log.debug("[RUNNER] runId={} staging released", ctx.getRunId());
        } else {
            log.error("[RUNNER] runId={} staging file {} could not be removed",
                      ctx.getRunId(), staging.resolve(ctx.getRunId()));
            if (metrics != null) {
                metrics.recordCleanupFailure();
            }
        }
        return removed;
    }

    private void finish(RunOutcome outcome) {
        Duration elapsed = Duration.between(outcome.getStartedAt(), outcome.getFinishedAt());
        log.info("[RUNNER] runId={} finished {} in {} ms attempts={} stagingRemoved={}",
                 outcome.getRunId(), outcome.getStatus(), elapsed.toMillis(),
                 outcome.getAttempts(), outcome.isStagingRemoved());

        if (metrics != null) {
            metrics.recordRun(outcome.getStatus(), elapsed);
        }
        audit("finish", () -> runRepo.markFinished(PipelineRun.builder()
                .id(outcome.getId())
                .status(outcome.getStatus().name())
                .failedStep(outcome.getFailedStep())
                .failureKind(outcome.getFailureKind() == null ? null : outcome.getFailureKind().name())
                .errorCategory(outcome.getErrorCategory())
                .errorMessage(outcome.isSucceeded() ? null : outcome.getMessage())
                .loadedKey(outcome.getLoadedKey())
                .stagingRemoved(outcome.isStagingRemoved())
                .attemptsJson(toJson(outcome))
                .finishedAt(outcome.getFinishedAt())
                .build()));
    }

    private String toJson(RunOutcome outcome) {
        if (om == null) {
            return null;
        }
        try {
            return om.writeValueAsString(outcome.getAttempts());
        } catch (JsonProcessingException e) {
            log.warn("[RUNNER] could not serialise attempts {}: {}", outcome.getAttempts(), e.getMessage());
            return null;
        }
    }

    private void audit(String operation, Runnable action) {
        if (runRepo == null) {
            return;
        }
        try {
            action.run();
        } catch (DataAccessException e) {
            log.warn("[RUNNER] run audit {} failed: {}", operation, e.getMostSpecificCause().getMessage());
        }
    }
}
