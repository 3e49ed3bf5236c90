package com.vaultoracle.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for raw_events. Writes go through IdempotentRawEventStore.
 */
public interface RawEventRepository extends MongoRepository<RawEvent, String> {

    boolean existsByTransactionHashAndChainStatus(String transactionHash, String chainStatus);

    Optional<RawEvent> findByTransactionHashAndChainStatus(String transactionHash, String chainStatus);

    List<RawEvent> findByTransactionHashOrderByCreatedAtAsc(String transactionHash);
}
