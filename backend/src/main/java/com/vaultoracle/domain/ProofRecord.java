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
 * Aggregated oracle price proof for one block. Append-only; the proof body is opaque JSON from the prover.
 */
@Document(collection = "oracle_price_proofs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ProofRecord {

    /** UUID assigned on creation. */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private long blockHeight;
    private Instant timestamp;
    private org.bson.Document proof;
    /** Aggregated price in nanoUSD. */
    private BigDecimal price;
}
