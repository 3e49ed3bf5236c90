package com.vaultoracle.proof.config;

import com.vaultoracle.proof.HttpProofBackend;
import com.vaultoracle.proof.ProofBackend;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(ProverProperties.class)
public class ProverConfig {

    @Bean
    public ProofBackend proofBackend(WebClient.Builder webClientBuilder, ProverProperties proverProperties) {
        return new HttpProofBackend(webClientBuilder, proverProperties);
    }
}
