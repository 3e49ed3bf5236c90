package com.vaultoracle.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Ingested engine event. Idempotency key is (transactionHash, chainStatus): the same transaction seen as pending and
 * later as included is two rows. Never mutated once stored.
 */
@Document(collection = "raw_events")
@CompoundIndexes({
    @CompoundIndex(name = "txHash_chainStatus", def = "{'transactionHash': 1, 'chainStatus': 1}", unique = true),
    @CompoundIndex(name = "type_block", def = "{'type': 1, 'blockHeight': 1}"),
    @CompoundIndex(name = "chainStatus_block", def = "{'chainStatus': 1, 'blockHeight': 1}"),
    @CompoundIndex(name = "vault_block", def = "{'payload.vaultAddress': 1, 'blockHeight': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RawEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long blockHeight;
    private String blockHash;
    private String parentBlockHash;
    private long globalSlot;
    private String chainStatus;
    /** Wire name, e.g. NewVault. */
    private String type;
    private org.bson.Document payload;
    private String transactionHash;
    private String transactionStatus;
    private String transactionMemo;
    private Instant createdAt;

    public static RawEvent from(ChainEvent event) {
        RawEvent raw = new RawEvent();
        raw.setBlockHeight(event.blockHeight());
        raw.setBlockHash(event.blockHash());
        raw.setParentBlockHash(event.parentBlockHash());
        raw.setGlobalSlot(event.globalSlot());
        raw.setChainStatus(event.chainStatus());
        raw.setType(event.type().wireName());
        raw.setPayload(event.payload().toDocument());
        raw.setTransactionHash(event.transactionHash());
        raw.setTransactionStatus(event.transactionStatus());
        raw.setTransactionMemo(event.transactionMemo());
        raw.setCreatedAt(Instant.now());
        return raw;
    }
}
