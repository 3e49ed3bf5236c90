package com.vaultoracle.worker;

import lombok.Getter;

@Getter
public class WorkerExitedException extends FatalWorkerException {

    /** -1 when the worker was already gone before the request was sent. */
    private final int exitCode;

    public WorkerExitedException(int exitCode, String message) {
        super(message);
        this.exitCode = exitCode;
    }
}
