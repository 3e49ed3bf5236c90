package com.vaultoracle.ingestion.store;

import com.vaultoracle.domain.Checkpoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Single writer of the block_checkpoint document. Every mutation is one atomic findAndModify on the singleton id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CheckpointStore {

    private final MongoTemplate mongoTemplate;

    /**
     * Create the checkpoint at startBlock if it does not exist. An existing checkpoint is returned untouched.
     */
    public Checkpoint initialize(long startBlock) {
        Update update = new Update()
                .setOnInsert("lastProcessedBlock", Checkpoint.UNSET_BLOCK)
                .setOnInsert("startBlock", startBlock)
                .setOnInsert("inProgress", false)
                .setOnInsert("updatedAt", Instant.now());
        Checkpoint checkpoint = mongoTemplate.findAndModify(singleton(), update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), Checkpoint.class);
        if (checkpoint.isInProgress()) {
            log.warn("Checkpoint was left in progress (previous pass interrupted); range from block {} will be replayed",
                    checkpoint.resolveFromBlock());
        }
        log.info("Checkpoint ready: lastProcessedBlock={}, startBlock={}",
                checkpoint.getLastProcessedBlock(), checkpoint.getStartBlock());
        return checkpoint;
    }

    public Optional<Checkpoint> find() {
        return Optional.ofNullable(mongoTemplate.findById(Checkpoint.SINGLETON_ID, Checkpoint.class));
    }

    /**
     * @throws IllegalStateException if the checkpoint was never initialized
     */
    public Checkpoint current() {
        return find().orElseThrow(() -> new IllegalStateException("Checkpoint not initialized"));
    }

    public Checkpoint markInProgress() {
        return modify(new Update().set("inProgress", true).set("updatedAt", Instant.now()));
    }

    public Checkpoint clearInProgress() {
        return modify(new Update().set("inProgress", false).set("updatedAt", Instant.now()));
    }

    /**
     * Advance the watermark to targetHeight. Never moves it backwards.
     */
    public Checkpoint advance(long targetHeight, Instant processedAt) {
        Update update = new Update()
                .max("lastProcessedBlock", targetHeight)
                .set("lastProcessedAt", processedAt)
                .set("updatedAt", processedAt)
                .unset("lastError");
        return modify(update);
    }

    public Checkpoint recordError(String message) {
        return modify(new Update().set("lastError", message).set("updatedAt", Instant.now()));
    }

    private Checkpoint modify(Update update) {
        Checkpoint checkpoint = mongoTemplate.findAndModify(singleton(), update,
                FindAndModifyOptions.options().returnNew(true), Checkpoint.class);
        if (checkpoint == null) {
            throw new IllegalStateException("Checkpoint not initialized");
        }
        return checkpoint;
    }

    private static Query singleton() {
        return Query.query(where("_id").is(Checkpoint.SINGLETON_ID));
    }
}
