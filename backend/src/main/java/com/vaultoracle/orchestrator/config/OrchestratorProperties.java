package com.vaultoracle.orchestrator.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Block watch loop and worker lifecycle timing.
 */
@ConfigurationProperties(prefix = "oracleproof.orchestrator")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class OrchestratorProperties {

    /** Delay between the end of one check and the start of the next. */
    @Positive
    private long checkIntervalMs = 10_000;

    /** Hard limit for one block cycle; exceeding it kills the worker and exits the process. */
    @Positive
    private long processTimeoutMs = 60_000;

    /** Delay between a fatal worker failure and process exit, to let logs flush. */
    @PositiveOrZero
    private long fatalExitGraceMs = 1_000;

    /** Worker startup includes proof program compilation. */
    @Positive
    private long startupTimeoutMs = 600_000;

    @Positive
    private long shutdownTimeoutMs = 10_000;

    /** Start the worker and watch loop with the application context. */
    private boolean autoStart = true;
}
