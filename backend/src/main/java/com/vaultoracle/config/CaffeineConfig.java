package com.vaultoracle.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches for the read API. The latest proof changes at most once per block, so a short TTL is enough.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String LATEST_PROOF_CACHE = "latestProofCache";
    public static final String PROOF_BY_ID_CACHE = "proofByIdCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(LATEST_PROOF_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.SECONDS)
                .maximumSize(1)
                .build());
        manager.registerCustomCache(PROOF_BY_ID_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.HOURS)
                .maximumSize(1_000)
                .build());
        return manager;
    }
}
