package com.vaultoracle.proof;

import com.vaultoracle.common.PipelineException;
import com.vaultoracle.common.PipelineFailure;
import com.vaultoracle.domain.ProofRecord;
import com.vaultoracle.domain.ProofRecordRepository;
import com.vaultoracle.oracle.OraclePriceSubmissions;
import com.vaultoracle.oracle.OracleWhitelist;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Wraps the proof backend: one-time init, then one proof per block persisted as a ProofRecord.
 * Compute failures and persistence failures are reported as distinct categories.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProofComputeService {

    private final ProofBackend proofBackend;
    private final OracleWhitelist whitelist;
    private final ProofRecordRepository proofRecordRepository;

    private volatile String whitelistCommitment;

    /**
     * Compile the program and commit the whitelist. Runs once; later calls return immediately.
     */
    public synchronized void init() {
        if (whitelistCommitment != null) {
            return;
        }
        long started = System.currentTimeMillis();
        proofBackend.init();
        whitelistCommitment = proofBackend.commitWhitelist(whitelist);
        log.info("Proof backend initialized in {} ms (whitelist commitment {})",
                System.currentTimeMillis() - started, whitelistCommitment);
    }

    /**
     * @throws PipelineException PROOF_GENERATION_FAILED if not initialized or compute fails (nothing persisted);
     *                           PROOF_PERSISTENCE_FAILED if the computed proof cannot be stored
     */
    public ProofRecord generateProof(long blockHeight, OraclePriceSubmissions submissions) {
        String commitment = whitelistCommitment;
        if (commitment == null) {
            throw new PipelineException(PipelineFailure.PROOF_GENERATION_FAILED,
                    "Proof backend not initialized for block " + blockHeight);
        }
        ProofRecord record;
        long started = System.currentTimeMillis();
        try {
            ProofResult result = proofBackend.compute(blockHeight, submissions, whitelist, commitment);
            record = new ProofRecord();
            record.setId(UUID.randomUUID().toString());
            record.setBlockHeight(blockHeight);
            record.setTimestamp(Instant.now());
            record.setProof(org.bson.Document.parse(result.proofJson()));
            record.setPrice(new BigDecimal(result.price()));
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineFailure.PROOF_GENERATION_FAILED,
                    "Proof generation failed for block " + blockHeight + ": " + e.getMessage(), e);
        }
        log.info("Proof for block {} computed in {} ms, price {}", blockHeight,
                System.currentTimeMillis() - started, record.getPrice());
        try {
            return proofRecordRepository.save(record);
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineFailure.PROOF_PERSISTENCE_FAILED,
                    "Computed proof " + record.getId() + " for block " + blockHeight + " could not be stored: "
                            + e.getMessage(), e);
        }
    }
}
