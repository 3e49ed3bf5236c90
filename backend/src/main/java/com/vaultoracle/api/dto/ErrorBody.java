package com.vaultoracle.api.dto;

import java.time.Instant;

/**
 * Error response: status is always "error"; error carries the code (NO_PROOF_FOUND, PROOF_NOT_FOUND,
 * VALIDATION_ERROR, INTERNAL_ERROR for store failures).
 */
public record ErrorBody(String status, String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody("error", error, message, Instant.now());
    }
}
