package com.vaultoracle.oracle;

/**
 * Thrown when the signing sidecar fails or returns no signature.
 */
public class SignerException extends RuntimeException {

    public SignerException(String message) {
        super(message);
    }

    public SignerException(String message, Throwable cause) {
        super(message, cause);
    }
}
