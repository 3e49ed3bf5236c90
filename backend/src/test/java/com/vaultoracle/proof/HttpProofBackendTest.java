package com.vaultoracle.proof;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultoracle.oracle.OraclePriceSubmissions;
import com.vaultoracle.oracle.OracleWhitelist;
import com.vaultoracle.oracle.PriceSubmission;
import com.vaultoracle.proof.config.ProverProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpProofBackendTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, String> responses = new HashMap<>();
    private final Map<String, HttpStatus> statuses = new HashMap<>();
    private final List<String> paths = new ArrayList<>();
    private final Map<String, JsonNode> bodies = new HashMap<>();

    private HttpProofBackend backend;

    @BeforeEach
    void setUp() {
        ProverProperties properties = new ProverProperties();
        properties.setBaseUrl("http://prover");
        properties.setCompileTimeoutMs(1_000);
        properties.setComputeTimeoutMs(1_000);
        WebClient.Builder builder = WebClient.builder().exchangeFunction(this::exchange);
        backend = new HttpProofBackend(builder, properties);
    }

    @Test
    void init_postsCompile() {
        responses.put("/compile", "{\"status\":\"ok\"}");

        backend.init();

        assertThat(paths).containsExactly("/compile");
    }

    @Test
    void commitWhitelist_returnsCommitment() {
        responses.put("/whitelist-commitment", "{\"commitment\":\"12345\"}");

        String commitment = backend.commitWhitelist(new OracleWhitelist(List.of("B62qa", "B62qd")));

        assertThat(commitment).isEqualTo("12345");
        assertThat(bodies.get("/whitelist-commitment").path("addresses")).hasSize(2);
    }

    @Test
    void compute_sendsInputsAndParsesProof() {
        responses.put("/prove", "{\"proof\":{\"publicOutput\":{\"priceNanoUSD\":\"800000000\"}},\"price\":\"800000000\"}");
        OraclePriceSubmissions submissions = new OraclePriceSubmissions(List.of(
                new PriceSubmission("B62qa", BigInteger.valueOf(800_000_000L), "sig", 42, false),
                PriceSubmission.dummy("B62qd", BigInteger.valueOf(800_000_000L), 42)));

        ProofResult result = backend.compute(42, submissions, new OracleWhitelist(List.of("B62qa", "B62qd")), "12345");

        assertThat(result.price()).isEqualTo(BigInteger.valueOf(800_000_000L));
        assertThat(result.proofJson()).contains("publicOutput");
        JsonNode sent = bodies.get("/prove");
        assertThat(sent.path("currentBlockHeight").asText()).isEqualTo("42");
        assertThat(sent.path("oracleWhitelistHash").asText()).isEqualTo("12345");
        assertThat(sent.path("oraclePriceSubmissions").path("submissions")).hasSize(2);
        assertThat(sent.path("oraclePriceSubmissions").path("submissions").get(1).path("isDummy").asBoolean()).isTrue();
    }

    @Test
    void compute_httpError_throwsProverException() {
        statuses.put("/prove", HttpStatus.INTERNAL_SERVER_ERROR);
        responses.put("/prove", "{\"error\":\"boom\"}");

        assertThatThrownBy(() -> backend.compute(1, new OraclePriceSubmissions(List.of()),
                new OracleWhitelist(List.of()), "c"))
                .isInstanceOf(ProverException.class)
                .hasMessageContaining("500");
    }

    @Test
    void compute_missingProof_throwsProverException() {
        responses.put("/prove", "{\"price\":\"1\"}");

        assertThatThrownBy(() -> backend.compute(1, new OraclePriceSubmissions(List.of()),
                new OracleWhitelist(List.of()), "c"))
                .isInstanceOf(ProverException.class);
    }

    private Mono<ClientResponse> exchange(ClientRequest request) {
        String path = request.url().getPath();
        paths.add(path);
        MockClientHttpRequest mockRequest = new MockClientHttpRequest(request.method(), request.url());
        @SuppressWarnings("unchecked")
        BodyInserter<Object, ClientHttpRequest> inserter = (BodyInserter<Object, ClientHttpRequest>) request.body();
        return inserter.insert(mockRequest, new BodyInserter.Context() {
                    @Override
                    public List<HttpMessageWriter<?>> messageWriters() {
                        return ExchangeStrategies.withDefaults().messageWriters();
                    }

                    @Override
                    public Optional<ServerHttpRequest> serverRequest() {
                        return Optional.empty();
                    }

                    @Override
                    public Map<String, Object> hints() {
                        return Map.of();
                    }
                })
                .then(mockRequest.getBodyAsString())
                .map(body -> {
                    try {
                        bodies.put(path, MAPPER.readTree(body));
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                    return ClientResponse.create(statuses.getOrDefault(path, HttpStatus.OK))
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(responses.getOrDefault(path, "{}"))
                            .build();
                });
    }
}
