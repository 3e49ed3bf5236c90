package com.vaultoracle.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Event reconciliation config.
 */
@ConfigurationProperties(prefix = "oracleproof.reconciler")
@NoArgsConstructor
@Getter
@Setter
public class ReconcilerProperties {

    /** Height the first pass fetches from when the checkpoint is created. */
    private long startBlock = 0;

    /**
     * Chain statuses treated as final. Only events in a final status reach the vault reducer; others are kept in the
     * ledger for audit.
     */
    private List<String> finalStatuses = List.of("included", "canonical");

    /** Apply pending events to vaults too (local networks that never finalize). */
    private boolean applyPendingEvents = false;

    public boolean isFinal(String chainStatus) {
        return chainStatus != null && finalStatuses.stream().anyMatch(s -> s.equalsIgnoreCase(chainStatus));
    }
}
