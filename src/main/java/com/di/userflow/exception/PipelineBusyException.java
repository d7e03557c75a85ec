package com.di.userflow.exception;

import lombok.Getter;

/**
 * Thrown when a run is requested while another run is still active.
 */
@Getter
public class PipelineBusyException extends RuntimeException {

    private final String activeRunId;

    public PipelineBusyException(String activeRunId) {
        super("A pipeline run is already active: " + activeRunId);
        this.activeRunId = activeRunId;
    }
}
