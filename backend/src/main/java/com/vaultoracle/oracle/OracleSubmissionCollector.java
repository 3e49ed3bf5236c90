package com.vaultoracle.oracle;

import com.vaultoracle.common.PipelineException;
import com.vaultoracle.common.PipelineFailure;
import com.vaultoracle.oracle.config.OracleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the per-block submission set: each configured oracle signs [price, blockHeight]; remaining slots are filled
 * with dummy submissions so the set always has max-participants entries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OracleSubmissionCollector {

    private final OracleProperties oracleProperties;
    private final OracleWhitelist whitelist;
    private final OracleSigner signer;

    /**
     * @throws PipelineException COLLECTION_FAILED on any failure; no partial result is returned
     */
    public OraclePriceSubmissions collectSubmissions(long blockHeight) {
        try {
            BigInteger price = oracleProperties.getPrice();
            List<PriceSubmission> submissions = new ArrayList<>(oracleProperties.getMaxParticipants());
            for (OracleProperties.Participant participant : oracleProperties.getParticipants()) {
                String signature = signer.sign(List.of(price, BigInteger.valueOf(blockHeight)), participant.getPrivateKey());
                PriceSubmission submission = new PriceSubmission(participant.getPublicKey(), price, signature, blockHeight, false);
                if (!validateSubmission(submission, blockHeight)) {
                    throw new IllegalStateException("Invalid submission from oracle " + participant.getPublicKey());
                }
                submissions.add(submission);
            }
            while (submissions.size() < oracleProperties.getMaxParticipants()) {
                submissions.add(PriceSubmission.dummy(oracleProperties.getDummyPublicKey(), price, blockHeight));
            }
            OraclePriceSubmissions result = new OraclePriceSubmissions(submissions);
            log.info("Collected {} oracle submissions ({} dummy) for block {}",
                    submissions.size(), submissions.size() - result.realCount(), blockHeight);
            return result;
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineFailure.COLLECTION_FAILED,
                    "Failed to collect oracle submissions for block " + blockHeight + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks whitelist membership, height binding, a non-empty signature and price bounds. Signature cryptography is
     * verified by the proof program, not here.
     */
    public boolean validateSubmission(PriceSubmission submission, long expectedBlockHeight) {
        if (submission.dummy()) {
            return true;
        }
        if (!whitelist.contains(submission.publicKey())) {
            log.warn("Submission from non-whitelisted oracle {}", submission.publicKey());
            return false;
        }
        if (submission.blockHeight() != expectedBlockHeight) {
            log.warn("Submission from {} is for block {}, expected {}",
                    submission.publicKey(), submission.blockHeight(), expectedBlockHeight);
            return false;
        }
        if (submission.signature() == null || submission.signature().isBlank()) {
            log.warn("Submission from {} has no signature", submission.publicKey());
            return false;
        }
        BigInteger price = submission.price();
        if (price == null || price.compareTo(oracleProperties.getMinPrice()) < 0
                || price.compareTo(oracleProperties.getMaxPrice()) > 0) {
            log.warn("Submission from {} has out-of-bounds price {}", submission.publicKey(), price);
            return false;
        }
        return true;
    }
}
