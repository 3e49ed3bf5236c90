package com.vaultoracle.api.controller;

import com.vaultoracle.api.dto.ProofResponse;
import com.vaultoracle.domain.ProofRecord;
import com.vaultoracle.proof.ProofQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to stored price proofs.
 */
@RestController
@RequestMapping("/api/v1/proofs")
@RequiredArgsConstructor
public class ProofController {

    private final ProofQueryService proofQueryService;

    @GetMapping("/latest")
    public ResponseEntity<ProofResponse> getLatest() {
        return ResponseEntity.ok(toResponse(proofQueryService.getLatest()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProofResponse> getById(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(proofQueryService.getById(id)));
    }

    private static ProofResponse toResponse(ProofRecord record) {
        return new ProofResponse(
                record.getId(),
                record.getBlockHeight(),
                record.getTimestamp(),
                record.getProof(),
                record.getPrice() != null ? record.getPrice().toPlainString() : null
        );
    }
}
