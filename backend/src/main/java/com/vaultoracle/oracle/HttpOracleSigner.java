package com.vaultoracle.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Signs fields through the signer sidecar: {@code POST /sign-fields} with decimal-string fields.
 */
public class HttpOracleSigner implements OracleSigner {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpOracleSigner(WebClient.Builder builder, String baseUrl, Duration timeout) {
        this.webClient = builder.baseUrl(baseUrl).build();
        this.timeout = timeout;
    }

    @Override
    public String sign(List<BigInteger> fields, String privateKey) {
        Map<String, Object> body = Map.of(
                "fields", fields.stream().map(BigInteger::toString).toList(),
                "privateKey", privateKey);
        JsonNode response = webClient.post()
                .uri("/sign-fields")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new SignerException("sign-fields HTTP " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new SignerException("sign-fields request failed: " + e.getMessage(), e))
                .block(timeout);
        String signature = response == null ? null : response.path("signature").asText(null);
        if (signature == null || signature.isBlank()) {
            throw new SignerException("sign-fields returned no signature");
        }
        return signature;
    }
}
