package com.vaultoracle.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Chain read endpoints: the node GraphQL API for the head height, the archive API for engine events.
 */
@ConfigurationProperties(prefix = "oracleproof.chain")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    @NotBlank
    private String graphqlUrl = "http://localhost:8080/graphql";

    @NotBlank
    private String archiveUrl = "http://localhost:8282";

    /** Engine contract address whose events are reconciled. */
    private String engineAddress;

    @Positive
    private long requestTimeoutMs = 30_000;

    /** Local limiter: max chain requests per second. */
    @Positive
    private int maxRequestsPerSecond = 5;

    /** How long a call may wait for a limiter permit before failing. */
    private long limiterTimeoutMs = 5_000;
}
