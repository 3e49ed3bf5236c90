package com.vaultoracle.ingestion.adapter;

/**
 * Thrown when a chain query fails (HTTP, GraphQL error, or unparseable response).
 */
public class ChainReadException extends RuntimeException {

    public ChainReadException(String message) {
        super(message);
    }

    public ChainReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
