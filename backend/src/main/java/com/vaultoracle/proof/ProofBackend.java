package com.vaultoracle.proof;

import com.vaultoracle.oracle.OraclePriceSubmissions;
import com.vaultoracle.oracle.OracleWhitelist;

/**
 * Proof-compute capability. Calls block until the backend answers; there is no partial result and no cancellation.
 */
public interface ProofBackend {

    /** One-time expensive setup (program compilation). Safe to call again. */
    void init();

    /** Commitment (hash) of the whitelist, a public input of every proof. */
    String commitWhitelist(OracleWhitelist whitelist);

    /**
     * @throws ProverException if the computation fails
     */
    ProofResult compute(long blockHeight, OraclePriceSubmissions submissions, OracleWhitelist whitelist,
                        String whitelistCommitment);
}
