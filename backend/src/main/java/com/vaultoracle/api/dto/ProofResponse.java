package com.vaultoracle.api.dto;

import java.time.Instant;
import java.util.Map;

/**
 * GET /api/v1/proofs/latest and /api/v1/proofs/{id} response. Price is a decimal string in nanoUSD.
 */
public record ProofResponse(
        String id,
        long blockHeight,
        Instant timestamp,
        Map<String, Object> proof,
        String price
) {
}
