package com.vaultoracle.proof;

/**
 * Thrown when the prover sidecar fails or returns an unusable response.
 */
public class ProverException extends RuntimeException {

    public ProverException(String message) {
        super(message);
    }

    public ProverException(String message, Throwable cause) {
        super(message, cause);
    }
}
