package com.vaultoracle.worker;

import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.domain.ProofRecord;
import com.vaultoracle.ingestion.reconcile.EventReconciler;
import com.vaultoracle.oracle.OraclePriceSubmissions;
import com.vaultoracle.oracle.OracleSubmissionCollector;
import com.vaultoracle.proof.ProofComputeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One block cycle on the worker thread: collect submissions, prove, reconcile events.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlockProcessor {

    private final OracleSubmissionCollector submissionCollector;
    private final ProofComputeService proofComputeService;
    private final EventReconciler eventReconciler;

    /**
     * @return events that changed a vault
     * @throws com.vaultoracle.common.PipelineException on any classified failure
     */
    public List<ChainEvent> handleBlock(long blockHeight) {
        log.info("Processing block {}", blockHeight);
        OraclePriceSubmissions submissions = submissionCollector.collectSubmissions(blockHeight);
        ProofRecord proof = proofComputeService.generateProof(blockHeight, submissions);
        log.info("Proof {} stored for block {}", proof.getId(), blockHeight);
        List<ChainEvent> updated = eventReconciler.processEvents(blockHeight);
        if (updated.isEmpty()) {
            log.info("Block {} done, no vault updates", blockHeight);
        } else {
            for (ChainEvent event : updated) {
                log.info("Vault update: {} tx={} payload={}", event.type().wireName(), event.transactionHash(),
                        event.payload());
            }
            log.info("Block {} done, {} vault updates", blockHeight, updated.size());
        }
        return updated;
    }
}
