package com.di.userflow.pipeline;

import com.di.userflow.util.InputValidator;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Fixed-delay retry policy applied by the runner to a single step.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryPolicy {

    private static final int MAX_RETRIES = 100;

    private static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO);

    /** Additional attempts after the first. */
    private final int      maxRetries;
    private final Duration delay;

    private RetryPolicy(int maxRetries, Duration delay) {
        this.maxRetries = InputValidator.validateRetries(maxRetries, MAX_RETRIES);
        this.delay      = InputValidator.validateNonNegative(delay, "Retry delay");
    }

    public static RetryPolicy none() {
        return NONE;
    }

    public static RetryPolicy fixed(int maxRetries, Duration delay) {
        return maxRetries == 0 ? NONE : new RetryPolicy(maxRetries, delay);
    }

    /** Upper bound on attempts: {@code maxRetries + 1}. */
    public int maxAttempts() {
        return maxRetries + 1;
    }
}
