package com.vaultoracle.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Derived per-vault state. Amounts are BigDecimal (Decimal128 in Mongo). The (lastUpdateBlock, lastEventIndex)
 * pair is the position of the last applied event; older or equal positions are never re-applied.
 */
@Document(collection = "vaults")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class VaultAggregate {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String address;
    private String owner;
    private BigDecimal collateralAmount;
    private BigDecimal debtAmount;
    private Long lastUpdateBlock;
    /** Position of the applied event within its block, in chain query order. */
    private Integer lastEventIndex;
    private Instant lastUpdateTimestamp;
    private String latestTransactionHash;

    public static VaultAggregate forAddress(String address) {
        VaultAggregate vault = new VaultAggregate();
        vault.setAddress(address);
        vault.setCollateralAmount(BigDecimal.ZERO);
        vault.setDebtAmount(BigDecimal.ZERO);
        return vault;
    }

    /**
     * True when the event at this position (or with this transaction hash) is already reflected in the aggregate.
     */
    public boolean alreadyReflects(String transactionHash, long blockHeight, int eventIndex) {
        if (transactionHash != null && transactionHash.equals(latestTransactionHash)) {
            return true;
        }
        if (lastUpdateBlock == null) {
            return false;
        }
        if (blockHeight != lastUpdateBlock) {
            return blockHeight < lastUpdateBlock;
        }
        return lastEventIndex != null && eventIndex <= lastEventIndex;
    }

    public void markApplied(String transactionHash, long blockHeight, int eventIndex, Instant at) {
        this.latestTransactionHash = transactionHash;
        this.lastUpdateBlock = blockHeight;
        this.lastEventIndex = eventIndex;
        this.lastUpdateTimestamp = at;
    }
}
