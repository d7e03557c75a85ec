package com.di.userflow.pipeline;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.exception.PipelineBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for starting runs, from the REST API or the built-in daily schedule.
 *
 * <p>At most one run is active at a time. A second request while a run holds the lock is
 * rejected with {@link PipelineBusyException}; it is not queued. Missed schedule slots are
 * not caught up.
 */
@Component
@Slf4j
public class PipelineTrigger {

    private final PipelineRunner     runner;
    private final PipelineProperties props;
    private final Clock              clock;
    private final ReentrantLock      lock = new ReentrantLock();

    public PipelineTrigger(PipelineRunner runner, PipelineProperties props, Clock clock) {
        this.runner = runner;
        this.props  = props;
        this.clock  = clock;
    }

    /**
     * Runs the pipeline for a schedule slot on the calling thread.
     *
     * @param scheduleTimestamp logical slot; null means now, truncated to the second
     * @throws PipelineBusyException when another run is active
     */
    public RunOutcome trigger(Instant scheduleTimestamp) {
        Instant slot = scheduleTimestamp != null
                ? scheduleTimestamp
                : clock.instant().truncatedTo(ChronoUnit.SECONDS);

        if (!lock.tryLock()) {
            String active = runner.currentRun().map(RunContext::getRunId).orElse("unknown");
            log.warn("[TRIGGER] rejected run for {}: {} still active", slot, active);
            throw new PipelineBusyException(active);
        }
        try {
            return runner.runPipeline(slot);
        } finally {
            lock.unlock();
        }
    }

    /** Daily slot at midnight UTC. */
    @Scheduled(cron = "${userflow.pipeline.schedule.cron:0 0 0 * * *}", zone = "UTC")
    public void scheduledRun() {
        if (!props.getSchedule().isEnabled()) {
            return;
        }
        Instant slot = clock.instant().truncatedTo(ChronoUnit.DAYS);
        try {
            RunOutcome outcome = trigger(slot);
            log.info("[TRIGGER] scheduled run {} ended {}", outcome.getRunId(), outcome.getStatus());
        } catch (PipelineBusyException e) {
            log.warn("[TRIGGER] skipped scheduled slot {}: {}", slot, e.getMessage());
        }
    }

    public boolean cancel(String runId) {
        return runner.cancel(runId);
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
