package com.di.userflow.pipeline;

/**
 * One link of the fixed step chain. Implementations read their inputs from and write their
 * outputs to the {@link RunContext}, and report failure through the returned
 * {@link StepResult} instead of throwing.
 */
public interface PipelineStep {

    /** Stable name used in logs, metrics, the run audit and failure reports. */
    String name();

    /** State the run is in while this step executes. */
    RunState state();

    RetryPolicy retryPolicy();

    StepResult<?> run(RunContext ctx);
}
