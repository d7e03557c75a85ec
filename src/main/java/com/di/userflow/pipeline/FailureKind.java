package com.di.userflow.pipeline;

/**
 * Failure taxonomy of the step chain. The prefix names the step that reports it.
 */
public enum FailureKind {

    TIMED_OUT("gate", "Source did not become ready within the gate window", false),

    EXTRACTION_TRANSPORT("extract", "Network or transport error while fetching the record", true),
    EXTRACTION_STATUS("extract", "Source answered with a non-success status", true),
    EXTRACTION_MALFORMED("extract", "Payload is missing a required field or has the wrong shape", true),
    EXTRACTION_DECODE("extract", "Payload could not be decoded", true),

    STAGING_IO("stage", "Staging file could not be written", true),

    LOAD_CONNECTION("load", "Destination could not be reached or rejected the statement", true),
    LOAD_CONSTRAINT("load", "Destination constraint violated outside the upsert key", true),
    LOAD_MALFORMED("load", "Staging artifact is missing or does not hold one valid row", true),

    VALIDATION_MISSING("validate", "No destination row for the loaded key", true),
    VALIDATION_DUPLICATE("validate", "More than one destination row for the loaded key", true),
    VALIDATION_MISMATCH("validate", "Destination row differs from the loaded record", true),
    VALIDATION_QUERY("validate", "Destination could not be queried", true),

    UNEXPECTED("any", "Step raised an unexpected exception", true),
    CANCELLED("any", "Run was cancelled", false);

    private final String step;
    private final String description;
    private final boolean retryable;

    FailureKind(String step, String description, boolean retryable) {
        this.step = step;
        this.description = description;
        this.retryable = retryable;
    }

    public String getStep() {
        return step;
    }

    public String getDescription() {
        return description;
    }

    /**
     * False for outcomes a second attempt cannot change: a gate timeout repeats with the same
     * window, and a cancellation must stop the chain.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
