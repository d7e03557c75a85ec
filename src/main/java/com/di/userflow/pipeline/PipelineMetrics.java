package com.di.userflow.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for pipeline runs and step attempts.
 *
 * <ul>
 *   <li>{@code userflow.run.total{status}} – finished runs by terminal state</li>
 *   <li>{@code userflow.run.duration{status}} – wall time of a run</li>
 *   <li>{@code userflow.step.attempts{step,result,kind}} – every step attempt</li>
 *   <li>{@code userflow.staging.cleanup.failures} – staging files that could not be deleted</li>
 * </ul>
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter       cleanupFailureCounter;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.cleanupFailureCounter = Counter.builder("userflow.staging.cleanup.failures")
                .description("Staging files left behind after a run")
                .register(meterRegistry);
    }

    public void recordRun(RunState status, Duration elapsed) {
        Counter.builder("userflow.run.total")
                .description("Finished pipeline runs")
                .tag("status", status.name())
                .register(meterRegistry)
                .increment();
        Timer.builder("userflow.run.duration")
                .description("Wall time of a pipeline run")
                .tag("status", status.name())
                .register(meterRegistry)
                .record(elapsed);
    }

    public void recordAttempt(String step, StepResult<?> result) {
        Counter.builder("userflow.step.attempts")
                .description("Step attempts by outcome")
                .tag("step", step)
                .tag("result", result.isSuccess() ? "success" : "failure")
                .tag("kind", result.isSuccess() ? "none" : result.getFailure().getKind().name())
                .register(meterRegistry)
                .increment();
    }

    public void recordCleanupFailure() {
        cleanupFailureCounter.increment();
    }
}
