package com.vaultoracle.proof;

import com.vaultoracle.config.CaffeineConfig;
import com.vaultoracle.domain.ProofRecord;
import com.vaultoracle.domain.ProofRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Read side of oracle_price_proofs for the API.
 */
@Service
@RequiredArgsConstructor
public class ProofQueryService {

    private final ProofRecordRepository proofRecordRepository;

    @Cacheable(cacheNames = CaffeineConfig.LATEST_PROOF_CACHE, key = "'latest'")
    public ProofRecord getLatest() {
        return proofRecordRepository.findFirstByOrderByBlockHeightDescTimestampDesc()
                .orElseThrow(() -> new ProofLookupException(ProofLookupException.NO_PROOF_FOUND, "No proofs available"));
    }

    @Cacheable(cacheNames = CaffeineConfig.PROOF_BY_ID_CACHE, key = "#id")
    public ProofRecord getById(String id) {
        if (!isUuid(id)) {
            throw new ProofLookupException(ProofLookupException.VALIDATION_ERROR, "Invalid proof id format");
        }
        return proofRecordRepository.findById(id)
                .orElseThrow(() -> new ProofLookupException(ProofLookupException.PROOF_NOT_FOUND, "Proof not found: " + id));
    }

    static boolean isUuid(String value) {
        if (value == null || value.length() != 36) {
            return false;
        }
        try {
            UUID.fromString(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
