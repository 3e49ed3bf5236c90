package com.vaultoracle.proof;

import com.fasterxml.jackson.databind.JsonNode;
import com.vaultoracle.oracle.OraclePriceSubmissions;
import com.vaultoracle.oracle.OracleWhitelist;
import com.vaultoracle.oracle.PriceSubmission;
import com.vaultoracle.proof.config.ProverProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prover sidecar client: {@code POST /compile}, {@code POST /whitelist-commitment}, {@code POST /prove}.
 * Numbers cross the wire as decimal strings.
 */
@Slf4j
public class HttpProofBackend implements ProofBackend {

    private final WebClient webClient;
    private final ProverProperties proverProperties;

    public HttpProofBackend(WebClient.Builder builder, ProverProperties proverProperties) {
        this.webClient = builder.baseUrl(proverProperties.getBaseUrl()).build();
        this.proverProperties = proverProperties;
    }

    @Override
    public void init() {
        post("/compile", Map.of(), proverProperties.getCompileTimeoutMs());
        log.info("Prover program compiled");
    }

    @Override
    public String commitWhitelist(OracleWhitelist whitelist) {
        JsonNode response = post("/whitelist-commitment", Map.of("addresses", whitelist.addresses()),
                proverProperties.getCompileTimeoutMs());
        String commitment = response.path("commitment").asText(null);
        if (commitment == null || commitment.isBlank()) {
            throw new ProverException("whitelist-commitment returned no commitment");
        }
        return commitment;
    }

    @Override
    public ProofResult compute(long blockHeight, OraclePriceSubmissions submissions, OracleWhitelist whitelist,
                               String whitelistCommitment) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("currentBlockHeight", Long.toString(blockHeight));
        body.put("oracleWhitelistHash", whitelistCommitment);
        body.put("oracleWhitelist", Map.of("addresses", whitelist.addresses()));
        body.put("oraclePriceSubmissions", Map.of("submissions", submissionsBody(submissions.submissions())));
        JsonNode response = post("/prove", body, proverProperties.getComputeTimeoutMs());
        JsonNode proof = response.path("proof");
        if (!proof.isObject()) {
            throw new ProverException("prove returned no proof object");
        }
        String price = response.path("price").asText(null);
        try {
            return new ProofResult(proof.toString(), new BigInteger(price));
        } catch (NumberFormatException | NullPointerException e) {
            throw new ProverException("prove returned invalid price: " + price, e);
        }
    }

    private static List<Map<String, Object>> submissionsBody(List<PriceSubmission> submissions) {
        return submissions.stream()
                .map(s -> Map.<String, Object>of(
                        "publicKey", s.publicKey(),
                        "price", s.price().toString(),
                        "signature", s.signature(),
                        "blockHeight", Long.toString(s.blockHeight()),
                        "isDummy", s.dummy()))
                .toList();
    }

    private JsonNode post(String path, Object body, long timeoutMs) {
        JsonNode response = webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new ProverException(path + " HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new ProverException(path + " request failed: " + e.getMessage(), e))
                .block(Duration.ofMillis(timeoutMs));
        if (response == null) {
            throw new ProverException(path + " returned no body");
        }
        return response;
    }
}
