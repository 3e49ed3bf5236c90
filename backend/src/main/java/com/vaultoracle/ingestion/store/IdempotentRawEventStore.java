package com.vaultoracle.ingestion.store;

import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.domain.RawEvent;
import com.vaultoracle.domain.RawEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Append-only event ledger keyed by (transactionHash, chainStatus). Appending an event whose key already exists
 * returns the stored row unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentRawEventStore {

    private final RawEventRepository repository;
    private final MongoTemplate mongoTemplate;

    public boolean contains(String transactionHash, String chainStatus) {
        return repository.existsByTransactionHashAndChainStatus(transactionHash, chainStatus);
    }

    /**
     * Upsert with setOnInsert only, so a concurrent duplicate insert cannot overwrite the first row.
     */
    public RawEvent append(ChainEvent event) {
        RawEvent raw = RawEvent.from(event);
        Query query = Query.query(where("transactionHash").is(raw.getTransactionHash())
                .and("chainStatus").is(raw.getChainStatus()));
        Update update = new Update()
                .setOnInsert("blockHeight", raw.getBlockHeight())
                .setOnInsert("blockHash", raw.getBlockHash())
                .setOnInsert("parentBlockHash", raw.getParentBlockHash())
                .setOnInsert("globalSlot", raw.getGlobalSlot())
                .setOnInsert("type", raw.getType())
                .setOnInsert("payload", raw.getPayload())
                .setOnInsert("transactionStatus", raw.getTransactionStatus())
                .setOnInsert("transactionMemo", raw.getTransactionMemo())
                .setOnInsert("createdAt", raw.getCreatedAt());
        try {
            return mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), RawEvent.class);
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert of raw event {} ({}), reading stored row",
                    raw.getTransactionHash(), raw.getChainStatus());
            return repository.findByTransactionHashAndChainStatus(raw.getTransactionHash(), raw.getChainStatus())
                    .orElseThrow(() -> e);
        }
    }
}
