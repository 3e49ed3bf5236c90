package com.vaultoracle.common;

import lombok.Getter;

/**
 * Classified pipeline error. The worker reports it to the orchestrator as {@code CATEGORY: message}.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final PipelineFailure failure;

    public PipelineException(PipelineFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public PipelineException(PipelineFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    /** Message prefixed with the failure category, as carried by the worker error reply. */
    public String describe() {
        return failure.name() + ": " + getMessage();
    }
}
