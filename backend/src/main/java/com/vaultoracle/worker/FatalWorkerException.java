package com.vaultoracle.worker;

/**
 * The worker can no longer be trusted (no reply in time, or it exited with a request outstanding). The only recovery
 * is to kill it and exit the process.
 */
public class FatalWorkerException extends RuntimeException {

    public FatalWorkerException(String message) {
        super(message);
    }

    public FatalWorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
