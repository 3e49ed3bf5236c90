package com.vaultoracle.oracle;

import java.math.BigInteger;
import java.util.List;

/**
 * Oracle signing capability.
 */
public interface OracleSigner {

    /**
     * Sign field elements with the given private key.
     *
     * @return base58 signature
     * @throws SignerException if signing fails
     */
    String sign(List<BigInteger> fields, String privateKey);
}
