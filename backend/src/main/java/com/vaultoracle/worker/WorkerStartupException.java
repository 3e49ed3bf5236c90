package com.vaultoracle.worker;

/**
 * The worker failed to initialize, exited, or did not report initialization in time.
 */
public class WorkerStartupException extends RuntimeException {

    public WorkerStartupException(String message) {
        super(message);
    }

    public WorkerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
