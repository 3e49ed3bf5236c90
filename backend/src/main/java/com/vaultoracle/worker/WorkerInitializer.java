package com.vaultoracle.worker;

import com.vaultoracle.common.RetryPolicy;
import com.vaultoracle.domain.Checkpoint;
import com.vaultoracle.ingestion.config.ReconcilerProperties;
import com.vaultoracle.ingestion.store.CheckpointStore;
import com.vaultoracle.proof.ProofComputeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * Worker startup: store connectivity (with retry), checkpoint creation, proof backend init.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerInitializer {

    private final MongoTemplate mongoTemplate;
    @Qualifier("storeRetryPolicy")
    private final RetryPolicy storeRetryPolicy;
    private final CheckpointStore checkpointStore;
    private final ReconcilerProperties reconcilerProperties;
    private final ProofComputeService proofComputeService;

    /**
     * @return the checkpoint's lastProcessedBlock, used to seed the orchestrator watermark
     */
    public long initialize() {
        log.info("Initializing block worker");
        storeRetryPolicy.execute("Store connection", () -> mongoTemplate.executeCommand("{ ping: 1 }"));
        log.info("Store connection established");
        Checkpoint checkpoint = checkpointStore.initialize(reconcilerProperties.getStartBlock());
        log.info("Compiling proof program");
        proofComputeService.init();
        log.info("Block worker initialization complete");
        return checkpoint.getLastProcessedBlock();
    }
}
