package com.di.userflow.pipeline;

import com.di.userflow.load.LoadResult;
import com.di.userflow.model.CanonicalRecord;
import com.di.userflow.staging.StagingArtifact;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run state threaded through every step. Created fresh by the runner for each run and
 * dropped when the run ends; never shared between runs.
 *
 * <p>Step outputs ({@link #record}, {@link #artifact}, {@link #loadResult}) are set by the
 * runner's steps in chain order. Only {@link #cancel()} may be called from another thread.
 */
@Getter
public class RunContext {

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final Instant scheduleTimestamp;
    private final String  runId;
    private final Instant startedAt;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Integer> attempts = new LinkedHashMap<>();

    @Getter(lombok.AccessLevel.NONE)
    private final List<String> trace = new ArrayList<>();

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private volatile RunState state = RunState.PENDING;

    @Setter private CanonicalRecord record;
    @Setter private StagingArtifact artifact;
    @Setter private LoadResult      loadResult;

    public RunContext(Instant scheduleTimestamp, Instant startedAt) {
        this.scheduleTimestamp = Objects.requireNonNull(scheduleTimestamp, "scheduleTimestamp");
        this.startedAt         = Objects.requireNonNull(startedAt, "startedAt");
        this.runId             = deriveRunId(scheduleTimestamp);
    }

    /**
     * Run identifier for a logical schedule slot: {@code run_yyyyMMddTHHmmssZ} in UTC.
     * The same slot always yields the same id.
     */
    public static String deriveRunId(Instant scheduleTimestamp) {
        return "run_" + RUN_ID_FORMAT.format(scheduleTimestamp);
    }

    // ------------------------------------------------------------------
    // State / attempts
    // ------------------------------------------------------------------

    void transitionTo(RunState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already ended in " + state);
        }
        note(state + " -> " + next);
        this.state = next;
    }

    int recordAttempt(String stepName) {
        return attempts.merge(stepName, 1, Integer::sum);
    }

    public int attemptsFor(String stepName) {
        return attempts.getOrDefault(stepName, 0);
    }

    /** Attempts per step, in execution order. */
    public Map<String, Integer> getAttempts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attempts));
    }

    // ------------------------------------------------------------------
    // Trace
    // ------------------------------------------------------------------

    public synchronized void note(String event) {
        trace.add(event);
    }

    public synchronized List<String> getTrace() {
        return List.copyOf(trace);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /** Requests an abort; honoured between steps, between retries and between gate polls. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            note("cancel requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
