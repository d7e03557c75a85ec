package com.di.userflow.pipeline;

import com.di.userflow.error.ErrorCategory;
import lombok.Getter;

/**
 * Why a single step attempt failed. Carried inside {@link StepResult}; never thrown.
 */
@Getter
public final class StepFailure {

    private final FailureKind   kind;
    private final String        message;
    private final Throwable     cause;
    private final ErrorCategory category;

    private StepFailure(FailureKind kind, String message, Throwable cause, ErrorCategory category) {
        this.kind     = kind;
        this.message  = message;
        this.cause    = cause;
        this.category = category;
    }

    public static StepFailure of(FailureKind kind, String message) {
        return new StepFailure(kind, message, null, defaultCategory(kind));
    }

    public static StepFailure of(FailureKind kind, String message, Throwable cause) {
        ErrorCategory category = cause == null ? defaultCategory(kind) : ErrorCategory.categorize(cause);
        return new StepFailure(kind, message, cause, category);
    }

    public static StepFailure cancelled(String stepName) {
        return of(FailureKind.CANCELLED, "Run cancelled before or during step '" + stepName + "'");
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    private static ErrorCategory defaultCategory(FailureKind kind) {
        switch (kind) {
            case TIMED_OUT:
                return ErrorCategory.TIMEOUT_ERROR;
            case EXTRACTION_STATUS:
                return ErrorCategory.HTTP_STATUS_ERROR;
            case EXTRACTION_DECODE:
                return ErrorCategory.DECODE_ERROR;
            case EXTRACTION_TRANSPORT:
                return ErrorCategory.NETWORK_ERROR;
            case STAGING_IO:
                return ErrorCategory.STORAGE_ERROR;
            case LOAD_CONNECTION:
            case VALIDATION_QUERY:
                return ErrorCategory.CONNECTION_ERROR;
            case LOAD_CONSTRAINT:
                return ErrorCategory.CONSTRAINT_VIOLATION;
            case CANCELLED:
                return ErrorCategory.CANCELLED;
            case UNEXPECTED:
                return ErrorCategory.APPLICATION_ERROR;
            default:
                return ErrorCategory.DATA_ERROR;
        }
    }

    @Override
    public String toString() {
        return kind + "(" + category + "): " + message;
    }
}
