package com.vaultoracle.proof;

import lombok.Getter;

/**
 * Thrown by ProofQueryService. The API maps NO_PROOF_FOUND and PROOF_NOT_FOUND to 404, VALIDATION_ERROR to 400.
 */
@Getter
public class ProofLookupException extends RuntimeException {

    public static final String NO_PROOF_FOUND = "NO_PROOF_FOUND";
    public static final String PROOF_NOT_FOUND = "PROOF_NOT_FOUND";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private final String errorCode;

    public ProofLookupException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
