package com.vaultoracle.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Reconciliation watermark. Exactly one document ({@link #SINGLETON_ID}); written only by CheckpointStore.
 * inProgress is an advisory crash marker, not a lock.
 */
@Document(collection = "block_checkpoint")
@NoArgsConstructor
@Getter
@Setter
public class Checkpoint {

    public static final String SINGLETON_ID = "block-checkpoint";
    /** lastProcessedBlock before the first successful pass. */
    public static final long UNSET_BLOCK = 0L;

    @Id
    private String id;
    private long lastProcessedBlock;
    private Instant lastProcessedAt;
    private long startBlock;
    private boolean inProgress;
    private String lastError;
    private Instant updatedAt;

    /** First height the next pass must fetch from. */
    public long resolveFromBlock() {
        return lastProcessedBlock == UNSET_BLOCK ? startBlock : lastProcessedBlock;
    }
}
