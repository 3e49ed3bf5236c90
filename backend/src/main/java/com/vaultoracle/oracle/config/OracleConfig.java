package com.vaultoracle.oracle.config;

import com.vaultoracle.oracle.HttpOracleSigner;
import com.vaultoracle.oracle.OracleSigner;
import com.vaultoracle.oracle.OracleWhitelist;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Oracle whitelist and signer beans.
 */
@Configuration
@EnableConfigurationProperties(OracleProperties.class)
public class OracleConfig {

    @Bean
    public OracleWhitelist oracleWhitelist(OracleProperties oracleProperties) {
        return buildWhitelist(oracleProperties);
    }

    @Bean
    public OracleSigner oracleSigner(WebClient.Builder webClientBuilder, OracleProperties oracleProperties) {
        return new HttpOracleSigner(webClientBuilder, oracleProperties.getSignerUrl(),
                Duration.ofMillis(oracleProperties.getSignTimeoutMs()));
    }

    /**
     * Participant keys in configured order, then the dummy key for every remaining slot.
     *
     * @throws IllegalStateException if there are more participants than slots or padding is needed without a dummy key
     */
    static OracleWhitelist buildWhitelist(OracleProperties oracleProperties) {
        int slots = oracleProperties.getMaxParticipants();
        List<OracleProperties.Participant> participants = oracleProperties.getParticipants();
        if (participants.size() > slots) {
            throw new IllegalStateException("oracleproof.oracle.participants has " + participants.size()
                    + " entries but max-participants is " + slots);
        }
        List<String> addresses = new ArrayList<>(slots);
        for (OracleProperties.Participant participant : participants) {
            if (participant.getPublicKey() == null || participant.getPublicKey().isBlank()) {
                throw new IllegalStateException("oracle participant without public-key");
            }
            addresses.add(participant.getPublicKey());
        }
        if (addresses.size() < slots) {
            String dummy = oracleProperties.getDummyPublicKey();
            if (dummy == null || dummy.isBlank()) {
                throw new IllegalStateException("oracleproof.oracle.dummy-public-key is required to pad the whitelist");
            }
            while (addresses.size() < slots) {
                addresses.add(dummy);
            }
        }
        return new OracleWhitelist(addresses);
    }
}
