package com.vaultoracle.api.controller;

import com.vaultoracle.api.dto.ErrorBody;
import com.vaultoracle.proof.ProofLookupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps proof lookup failures to 404 / 400 and store failures to 500, all with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(ProofLookupException.class)
    public ResponseEntity<ErrorBody> handleProofLookup(ProofLookupException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case ProofLookupException.VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case ProofLookupException.NO_PROOF_FOUND, ProofLookupException.PROOF_NOT_FOUND -> HttpStatus.NOT_FOUND;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorBody> handleStore(DataAccessException ex) {
        log.error("Store access failed while serving request: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBody.of(INTERNAL_ERROR, "Store unavailable"));
    }
}
