package com.vaultoracle.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.ingestion.config.ChainProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Reads head height from the node GraphQL API and engine events from the archive GraphQL API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GraphQlChainReader implements ChainReader {

    static final String HEAD_QUERY = "query { bestChain(maxLength: 1) { protocolState { consensusState { blockHeight } } } }";

    static final String EVENTS_QUERY = """
            query Events($input: EventFilterOptionsInput!) {
              events(input: $input) {
                blockInfo { height stateHash parentHash chainStatus globalSlotSinceGenesis }
                eventData {
                  transactionInfo { hash status memo }
                  type
                  data
                }
              }
            }
            """;

    private final GraphQlClient graphQlClient;
    private final ChainEventParser parser;
    private final ChainProperties chainProperties;
    @Qualifier("chainRateLimiter")
    private final RateLimiter chainRateLimiter;

    @Override
    public long getHeadHeight() {
        JsonNode data = query(chainProperties.getGraphqlUrl(), HEAD_QUERY, Map.of(), "bestChain");
        JsonNode bestChain = data.path("bestChain");
        if (!bestChain.isArray() || bestChain.isEmpty()) {
            throw new ChainReadException("bestChain returned no blocks");
        }
        String height = bestChain.get(0).path("protocolState").path("consensusState").path("blockHeight").asText(null);
        try {
            return Long.parseLong(height);
        } catch (NumberFormatException e) {
            throw new ChainReadException("bestChain invalid blockHeight: " + height, e);
        }
    }

    @Override
    public List<ChainEvent> fetchEvents(long fromHeight) {
        if (chainProperties.getEngineAddress() == null || chainProperties.getEngineAddress().isBlank()) {
            throw new ChainReadException("oracleproof.chain.engine-address is not configured");
        }
        Map<String, Object> input = Map.of(
                "address", chainProperties.getEngineAddress(),
                "from", fromHeight);
        JsonNode data = query(chainProperties.getArchiveUrl(), EVENTS_QUERY, Map.of("input", input), "events");
        List<ChainEvent> events = parser.parseBlocks(data.path("events"));
        log.debug("Fetched {} engine events from block {}", events.size(), fromHeight);
        return events;
    }

    private JsonNode query(String url, String query, Map<String, Object> variables, String operation) {
        if (!chainRateLimiter.acquirePermission()) {
            throw new ChainReadException(operation + " rate limited");
        }
        JsonNode response = graphQlClient.execute(url, query, variables)
                .block(Duration.ofMillis(chainProperties.getRequestTimeoutMs()));
        if (response == null) {
            throw new ChainReadException(operation + " returned no body");
        }
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new ChainReadException(operation + " error: " + errors.get(0).path("message").asText(errors.toString()));
        }
        JsonNode data = response.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new ChainReadException(operation + " returned no data");
        }
        return data;
    }
}
