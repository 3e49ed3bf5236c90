package com.vaultoracle.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * GraphQL client using WebClient. Used by GraphQlChainReader.
 */
public class WebClientGraphQlClient implements GraphQlClient {

    private final WebClient webClient;

    public WebClientGraphQlClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<JsonNode> execute(String endpointUrl, String query, Map<String, Object> variables) {
        Map<String, Object> body = new HashMap<>();
        body.put("query", query);
        body.put("variables", variables != null ? variables : Map.of());
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorMap(WebClientResponseException.class, e -> new ChainReadException(
                        "GraphQL HTTP " + e.getStatusCode().value() + " from " + endpointUrl, e))
                .onErrorMap(WebClientRequestException.class, e -> new ChainReadException(
                        "GraphQL request to " + endpointUrl + " failed: " + e.getMessage(), e));
    }
}
