package com.vaultoracle.oracle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Oracle participants, whitelist sizing and the price each oracle submits.
 */
@ConfigurationProperties(prefix = "oracleproof.oracle")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class OracleProperties {

    /** Whitelist slot count; submissions are padded with dummies to this size. */
    @Min(1)
    private int maxParticipants = 10;

    /** Public key used for unfilled slots. */
    private String dummyPublicKey;

    /** Submitted price in nanoUSD (0.80 USD). */
    @NotNull
    private BigInteger price = BigInteger.valueOf(800_000_000L);

    @NotNull
    private BigInteger minPrice = BigInteger.ONE;

    @NotNull
    private BigInteger maxPrice = BigInteger.TEN.pow(15);

    @Valid
    private List<Participant> participants = new ArrayList<>();

    /** Signer sidecar base URL ({@code POST /sign-fields}). */
    private String signerUrl = "http://localhost:3001";

    private long signTimeoutMs = 10_000;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Participant {
        @NotBlank
        private String publicKey;
        @NotBlank
        private String privateKey;
    }
}
