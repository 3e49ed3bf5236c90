package com.vaultoracle.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Store connectivity check performed by the worker at startup.
 */
@ConfigurationProperties(prefix = "oracleproof.store")
@NoArgsConstructor
@Getter
@Setter
public class StoreProperties {

    private int connectAttempts = 3;

    private long connectBaseDelayMs = 5_000;
}
