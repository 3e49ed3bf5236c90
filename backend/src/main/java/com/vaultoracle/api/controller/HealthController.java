package com.vaultoracle.api.controller;

import com.vaultoracle.api.dto.HealthResponse;
import com.vaultoracle.ingestion.store.CheckpointStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/v1/health: liveness plus the reconciliation checkpoint.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final CheckpointStore checkpointStore;

    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(checkpointStore.find()
                .map(c -> new HealthResponse("ok", c.getLastProcessedBlock(), c.isInProgress(), c.getLastError()))
                .orElse(new HealthResponse("ok", null, null, null)));
    }
}
