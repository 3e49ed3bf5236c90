package com.vaultoracle.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Minimal GraphQL-over-HTTP transport, separated from GraphQlChainReader so queries can be tested without a node.
 */
public interface GraphQlClient {

    /**
     * POST a query document with variables.
     *
     * @return the full response body (including any {@code errors} array); fails with ChainReadException on HTTP errors
     */
    Mono<JsonNode> execute(String endpointUrl, String query, Map<String, Object> variables);
}
