package com.vaultoracle.oracle;

import java.math.BigInteger;

/**
 * One oracle's signed price for a block. Dummy submissions fill unused whitelist slots and carry an empty signature.
 *
 * @param price price in nanoUSD
 */
public record PriceSubmission(
        String publicKey,
        BigInteger price,
        String signature,
        long blockHeight,
        boolean dummy
) {

    public static PriceSubmission dummy(String dummyPublicKey, BigInteger price, long blockHeight) {
        return new PriceSubmission(dummyPublicKey, price, "", blockHeight, true);
    }
}
