package com.vaultoracle.ingestion.config;

import com.vaultoracle.common.RetryPolicy;
import com.vaultoracle.ingestion.adapter.GraphQlClient;
import com.vaultoracle.ingestion.adapter.WebClientGraphQlClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Chain read client, its rate limiter, and the store retry policy.
 */
@Configuration
@EnableConfigurationProperties({ ChainProperties.class, ReconcilerProperties.class, StoreProperties.class })
public class IngestionAdapterConfig {

    @Bean
    public GraphQlClient graphQlClient(WebClient.Builder webClientBuilder) {
        return new WebClientGraphQlClient(webClientBuilder);
    }

    @Bean(name = "chainRateLimiter")
    public RateLimiter chainRateLimiter(ChainProperties chainProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, chainProperties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, chainProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-read", config);
    }

    @Bean(name = "storeRetryPolicy")
    public RetryPolicy storeRetryPolicy(StoreProperties storeProperties) {
        return new RetryPolicy(storeProperties.getConnectBaseDelayMs(), storeProperties.getConnectAttempts());
    }
}
