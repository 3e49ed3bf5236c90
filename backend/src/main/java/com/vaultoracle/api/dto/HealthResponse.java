package com.vaultoracle.api.dto;

/**
 * GET /api/v1/health response. lastProcessedBlock is null until the worker has created the checkpoint.
 */
public record HealthResponse(
        String status,
        Long lastProcessedBlock,
        Boolean inProgress,
        String lastError
) {
}
