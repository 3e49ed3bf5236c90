package com.vaultoracle.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ProofRecordRepository extends MongoRepository<ProofRecord, String> {

    Optional<ProofRecord> findFirstByOrderByBlockHeightDescTimestampDesc();
}
