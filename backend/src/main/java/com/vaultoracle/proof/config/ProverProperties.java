package com.vaultoracle.proof.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Prover sidecar endpoint and per-call timeouts.
 */
@ConfigurationProperties(prefix = "oracleproof.prover")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ProverProperties {

    @NotBlank
    private String baseUrl = "http://localhost:3001";

    /** Program compilation can take minutes on a cold start. */
    @Positive
    private long compileTimeoutMs = 600_000;

    /** Kept below oracleproof.orchestrator.process-timeout-ms so a stuck prover fails the block instead of the process. */
    @Positive
    private long computeTimeoutMs = 50_000;
}
