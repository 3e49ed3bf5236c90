package com.vaultoracle.ingestion.reconcile;

import com.vaultoracle.common.PipelineException;
import com.vaultoracle.common.PipelineFailure;
import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.domain.Checkpoint;
import com.vaultoracle.ingestion.adapter.ChainReader;
import com.vaultoracle.ingestion.config.ReconcilerProperties;
import com.vaultoracle.ingestion.store.CheckpointStore;
import com.vaultoracle.ingestion.store.IdempotentRawEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One reconciliation pass: fetch engine events since the checkpoint, append new ones to the ledger, fold final vault
 * events into vaults, then advance the checkpoint. The pass is bracketed by the checkpoint's inProgress flag.
 * A failed pass leaves lastProcessedBlock unchanged so the whole range is replayed. Ledger membership only decides
 * whether an event is appended; every eligible vault event reaches the reducer, whose position guard turns events
 * already reflected in the vault into no-ops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventReconciler {

    private final CheckpointStore checkpointStore;
    private final IdempotentRawEventStore rawEventStore;
    private final VaultReducer vaultReducer;
    private final ChainReader chainReader;
    private final ReconcilerProperties reconcilerProperties;

    /**
     * @return events that changed a vault in this pass, in fetch order
     * @throws PipelineException RECONCILIATION_FAILED on any failure
     */
    public List<ChainEvent> processEvents(long targetHeight) {
        RuntimeException failure = null;
        try {
            Checkpoint checkpoint = checkpointStore.markInProgress();
            long fromBlock = checkpoint.resolveFromBlock();
            List<ChainEvent> events = chainReader.fetchEvents(fromBlock);
            List<ChainEvent> updated = applyAll(events);
            checkpointStore.advance(targetHeight, Instant.now());
            log.info("Reconciled blocks {}..{}: {} fetched, {} vault updates", fromBlock, targetHeight,
                    events.size(), updated.size());
            return updated;
        } catch (RuntimeException e) {
            failure = e instanceof PipelineException ? e
                    : new PipelineException(PipelineFailure.RECONCILIATION_FAILED,
                            "Reconciliation up to block " + targetHeight + " failed: " + e.getMessage(), e);
            recordError(failure);
            throw failure;
        } finally {
            clearInProgress(failure);
        }
    }

    private List<ChainEvent> applyAll(List<ChainEvent> events) {
        List<ChainEvent> updated = new ArrayList<>();
        Map<String, Integer> nextIndexByBlock = new HashMap<>();
        for (ChainEvent event : events) {
            int eventIndex = nextIndexByBlock.merge(blockKey(event), 1, Integer::sum) - 1;
            if (rawEventStore.contains(event.transactionHash(), event.chainStatus())) {
                log.debug("Raw event {} ({}) already stored", event.transactionHash(), event.chainStatus());
            } else {
                rawEventStore.append(event);
            }
            if (!event.isVaultEvent()) {
                continue;
            }
            if (!reconcilerProperties.isFinal(event.chainStatus()) && !reconcilerProperties.isApplyPendingEvents()) {
                log.debug("Vault event {} is {}, kept in ledger only", event.transactionHash(), event.chainStatus());
                continue;
            }
            if (vaultReducer.apply(event, eventIndex)) {
                updated.add(event);
            }
        }
        return updated;
    }

    /** Events are indexed within their block as observed under one chain status. */
    private static String blockKey(ChainEvent event) {
        return event.blockHeight() + ":" + event.chainStatus() + ":" + event.blockHash();
    }

    private void recordError(RuntimeException failure) {
        try {
            checkpointStore.recordError(failure.getMessage());
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private void clearInProgress(RuntimeException failure) {
        try {
            checkpointStore.clearInProgress();
        } catch (RuntimeException e) {
            if (failure != null) {
                failure.addSuppressed(e);
                return;
            }
            throw new PipelineException(PipelineFailure.RECONCILIATION_FAILED,
                    "Could not clear checkpoint inProgress: " + e.getMessage(), e);
        }
    }
}
