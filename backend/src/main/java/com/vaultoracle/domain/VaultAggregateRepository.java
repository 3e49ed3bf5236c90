package com.vaultoracle.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface VaultAggregateRepository extends MongoRepository<VaultAggregate, String> {

    Optional<VaultAggregate> findByAddress(String address);
}
