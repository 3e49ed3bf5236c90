package com.vaultoracle.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.domain.EventPayload;
import com.vaultoracle.domain.EventType;
import com.vaultoracle.ingestion.config.ChainProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphQlChainReaderTest {

    private static final String GRAPHQL_URL = "http://node/graphql";
    private static final String ARCHIVE_URL = "http://archive";

    private MockGraphQlClient mockClient;
    private ChainProperties chainProperties;
    private GraphQlChainReader reader;

    @BeforeEach
    void setUp() {
        mockClient = new MockGraphQlClient();
        chainProperties = new ChainProperties();
        chainProperties.setGraphqlUrl(GRAPHQL_URL);
        chainProperties.setArchiveUrl(ARCHIVE_URL);
        chainProperties.setEngineAddress("B62qengine");
        chainProperties.setRequestTimeoutMs(1_000);
        reader = new GraphQlChainReader(mockClient, new ChainEventParser(), chainProperties, fastLimiter());
    }

    @Test
    void getHeadHeight_parsesBestChain() {
        mockClient.response = """
                {"data":{"bestChain":[{"protocolState":{"consensusState":{"blockHeight":"4321"}}}]}}
                """;

        assertThat(reader.getHeadHeight()).isEqualTo(4321L);
        assertThat(mockClient.lastUrl).isEqualTo(GRAPHQL_URL);
    }

    @Test
    void getHeadHeight_emptyBestChain_throws() {
        mockClient.response = "{\"data\":{\"bestChain\":[]}}";

        assertThatThrownBy(() -> reader.getHeadHeight()).isInstanceOf(ChainReadException.class);
    }

    @Test
    void graphQlErrors_throw() {
        mockClient.response = "{\"errors\":[{\"message\":\"bad query\"}]}";

        assertThatThrownBy(() -> reader.getHeadHeight())
                .isInstanceOf(ChainReadException.class)
                .hasMessageContaining("bad query");
    }

    @Test
    void fetchEvents_sendsAddressAndFrom_andParsesInOrder() {
        mockClient.response = """
                {"data":{"events":[
                  {"blockInfo":{"height":"100","stateHash":"3Nh100","parentHash":"3Nh99","chainStatus":"canonical","globalSlotSinceGenesis":"300"},
                   "eventData":[
                     {"transactionInfo":{"hash":"5Jtx1","status":"applied","memo":""},"type":"NewVault",
                      "data":{"vaultAddress":"B62qv","owner":"B62qo"}},
                     {"transactionInfo":{"hash":"5Jtx2","status":"applied","memo":"m"},"type":"DepositCollateral",
                      "data":{"vaultAddress":"B62qv","amount":"100","vaultCollateralAmount":"100","vaultDebtAmount":"0"}}
                   ]},
                  {"blockInfo":{"height":"101","stateHash":"3Nh101","parentHash":"3Nh100","chainStatus":"pending","globalSlotSinceGenesis":"303"},
                   "eventData":[
                     {"transactionInfo":{"hash":"5Jtx3","status":"applied","memo":""},"type":"EmergencyStopToggled",
                      "data":{"emergencyStopped":true}}
                   ]}
                ]}}
                """;

        List<ChainEvent> events = reader.fetchEvents(100);

        assertThat(mockClient.lastUrl).isEqualTo(ARCHIVE_URL);
        @SuppressWarnings("unchecked")
        Map<String, Object> input = (Map<String, Object>) mockClient.lastVariables.get("input");
        assertThat(input).containsEntry("address", "B62qengine").containsEntry("from", 100L);
        assertThat(events).extracting(ChainEvent::transactionHash).containsExactly("5Jtx1", "5Jtx2", "5Jtx3");
        assertThat(events.get(0).payload()).isEqualTo(new EventPayload.NewVault("B62qv", "B62qo"));
        assertThat(events.get(1).type()).isEqualTo(EventType.DEPOSIT_COLLATERAL);
        assertThat(events.get(1).blockHash()).isEqualTo("3Nh100");
        assertThat(events.get(2).chainStatus()).isEqualTo("pending");
        assertThat(events.get(2).globalSlot()).isEqualTo(303L);
    }

    @Test
    void fetchEvents_withoutEngineAddress_throws() {
        chainProperties.setEngineAddress(" ");

        assertThatThrownBy(() -> reader.fetchEvents(1)).isInstanceOf(ChainReadException.class);
    }

    @Test
    void exhaustedLimiter_throws() {
        RateLimiter limiter = RateLimiter.of("test-exhausted", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(60))
                .limitForPeriod(1)
                .timeoutDuration(Duration.ZERO)
                .build());
        reader = new GraphQlChainReader(mockClient, new ChainEventParser(), chainProperties, limiter);
        mockClient.response = "{\"data\":{\"bestChain\":[{\"protocolState\":{\"consensusState\":{\"blockHeight\":\"1\"}}}]}}";

        reader.getHeadHeight();

        assertThatThrownBy(() -> reader.getHeadHeight())
                .isInstanceOf(ChainReadException.class)
                .hasMessageContaining("rate limited");
    }

    private static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-chain-fast-limiter", config);
    }

    private static class MockGraphQlClient implements GraphQlClient {
        private static final ObjectMapper MAPPER = new ObjectMapper();

        private String response = "{\"data\":{}}";
        private String lastUrl;
        private Map<String, Object> lastVariables;

        @Override
        public Mono<JsonNode> execute(String endpointUrl, String query, Map<String, Object> variables) {
            lastUrl = endpointUrl;
            lastVariables = variables;
            try {
                return Mono.just(MAPPER.readTree(response));
            } catch (JsonProcessingException e) {
                return Mono.error(e);
            }
        }
    }
}
