package com.di.userflow.source;

import com.di.userflow.config.PipelineProperties;
import com.di.userflow.pipeline.FailureKind;
import com.di.userflow.pipeline.PipelineStep;
import com.di.userflow.pipeline.RetryPolicy;
import com.di.userflow.pipeline.RunContext;
import com.di.userflow.pipeline.RunState;
import com.di.userflow.pipeline.Sleeper;
import com.di.userflow.pipeline.StepFailure;
import com.di.userflow.pipeline.StepResult;
import com.di.userflow.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Sensor guarding extraction: polls the source's availability endpoint until one request
 * succeeds or the window elapses.
 *
 * <p>A failed poll is logged and is not a failure. Only exhausting the window is, and the
 * runner does not retry it: a second window of the same length is not expected to end
 * differently. The loop sleeps between polls and checks for cancellation every iteration.
 */
@Component
@Slf4j
public class AvailabilityGate implements PipelineStep {

    public static final String STEP_NAME = "gate";

    private final RestClient         restClient;
    private final PipelineProperties props;
    private final Clock              clock;
    private final Sleeper            sleeper;

    public AvailabilityGate(RestClient sourceRestClient,
                            PipelineProperties props,
                            Clock clock,
                            Sleeper sleeper) {
        this.restClient = sourceRestClient;
        this.props      = props;
        this.clock      = clock;
        this.sleeper    = sleeper;
    }

    @Override
    public String name() {
        return STEP_NAME;
    }

    @Override
    public RunState state() {
        return RunState.GATING;
    }

    @Override
    public RetryPolicy retryPolicy() {
        return RetryPolicy.none();
    }

    @Override
    public StepResult<GateStatus> run(RunContext ctx) {
        Duration timeout = props.getGate().getTimeout();
        GateStatus status = await(timeout, props.getGate().getPollInterval(), ctx::isCancelled);
        switch (status) {
            case READY:
                return StepResult.ok(status);
            case CANCELLED:
                return StepResult.failed(StepFailure.cancelled(STEP_NAME));
            default:
                return StepResult.failed(FailureKind.TIMED_OUT,
                        "Source " + props.getSource().effectiveHealthUrl()
                        + " not ready within " + timeout);
        }
    }

    public GateStatus await(Duration timeout, Duration pollInterval) {
        return await(timeout, pollInterval, () -> false);
    }

    /**
     * Polls until ready, timed out or cancelled.
     *
     * @param cancelRequested checked before every poll; interruption while sleeping also cancels
     */
    public GateStatus await(Duration timeout, Duration pollInterval, BooleanSupplier cancelRequested) {
        InputValidator.validatePositive(timeout, "Gate timeout");
        InputValidator.validatePositive(pollInterval, "Gate poll interval");

        String  url      = props.getSource().effectiveHealthUrl();
        Instant deadline = clock.instant().plus(timeout);
        int     polls    = 0;

        log.info("[GATE] waiting for {} (timeout={} pollInterval={})", url, timeout, pollInterval);

        while (true) {
            if (cancelRequested.getAsBoolean()) {
                log.info("[GATE] cancelled after {} poll(s)", polls);
                return GateStatus.CANCELLED;
            }
            polls++;
            if (probe(url, polls)) {
                log.info("[GATE] source ready after {} poll(s)", polls);
                return GateStatus.READY;
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                log.warn("[GATE] source not ready after {} poll(s) within {}", polls, timeout);
                return GateStatus.TIMED_OUT;
            }
            Duration remaining = Duration.between(now, deadline);
            try {
                sleeper.sleep(remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[GATE] interrupted while waiting; treating as cancellation");
                return GateStatus.CANCELLED;
            }
        }
    }

    private boolean probe(String url, int poll) {
        try {
            ResponseEntity<Void> response = restClient.get()
                    .uri(url)
                    .retrieve()
                    .toBodilessEntity();
            if (response.getStatusCode().is2xxSuccessful()) {
                return true;
            }
            log.warn("[GATE] poll {} got status {}", poll, response.getStatusCode().value());
            return false;
        } catch (RestClientException e) {
            log.warn("[GATE] poll {} failed: {}", poll, e.getMessage());
            return false;
        }
    }
}
