package com.vaultoracle.proof;

import java.math.BigInteger;

/**
 * Output of one proof computation.
 *
 * @param proofJson opaque proof serialized as a JSON object
 * @param price     aggregated price in nanoUSD
 */
public record ProofResult(String proofJson, BigInteger price) {
}
