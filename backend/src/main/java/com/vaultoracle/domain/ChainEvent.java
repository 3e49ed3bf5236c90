package com.vaultoracle.domain;

import java.util.Objects;

/**
 * Engine event as observed on chain, in the order the chain query returned it. Immutable; this is also what
 * crosses the worker boundary in a success reply.
 *
 * @param chainStatus chain status reported for the containing block (e.g. pending, included, canonical)
 */
public record ChainEvent(
        long blockHeight,
        String blockHash,
        String parentBlockHash,
        long globalSlot,
        String chainStatus,
        String transactionHash,
        String transactionStatus,
        String transactionMemo,
        EventPayload payload
) {

    public ChainEvent {
        BlockHeights.requireUInt32(blockHeight, "blockHeight");
        BlockHeights.requireUInt32(globalSlot, "globalSlot");
        Objects.requireNonNull(chainStatus, "chainStatus");
        Objects.requireNonNull(transactionHash, "transactionHash");
        Objects.requireNonNull(payload, "payload");
    }

    public EventType type() {
        return payload.type();
    }

    public boolean isVaultEvent() {
        return payload instanceof EventPayload.VaultEvent;
    }
}
