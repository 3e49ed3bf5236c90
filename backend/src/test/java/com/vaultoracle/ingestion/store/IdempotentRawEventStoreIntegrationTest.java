package com.vaultoracle.ingestion.store;

import com.vaultoracle.config.MongoConfig;
import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.domain.EventPayload;
import com.vaultoracle.domain.RawEvent;
import com.vaultoracle.domain.RawEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.List;

import static com.vaultoracle.domain.ChainEventFixtures.VAULT;
import static com.vaultoracle.domain.ChainEventFixtures.deposit;
import static com.vaultoracle.domain.ChainEventFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers
@Import({ MongoConfig.class, IdempotentRawEventStore.class })
class IdempotentRawEventStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    IdempotentRawEventStore store;
    @Autowired
    RawEventRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("storing the same (transactionHash, chainStatus) twice keeps exactly one row")
    void duplicateAppend_singleRow() {
        ChainEvent event = deposit(100, "0xdup", "10", "0");

        RawEvent first = store.append(event);
        RawEvent second = store.append(deposit(100, "0xdup", "999", "0"));

        assertThat(repository.count()).isEqualTo(1);
        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getPayload().get("vaultCollateralAmount", org.bson.types.Decimal128.class).bigDecimalValue())
                .isEqualByComparingTo(new BigDecimal("10"));
        assertThat(store.contains("0xdup", "canonical")).isTrue();
    }

    @Test
    @DisplayName("pending then included for the same transaction are two rows")
    void statusTransition_secondRow() {
        EventPayload payload = new EventPayload.NewVault(VAULT, "B62qo");
        store.append(event(100, "abc", "pending", payload));
        store.append(event(100, "abc", "included", payload));

        List<RawEvent> rows = repository.findByTransactionHashOrderByCreatedAtAsc("abc");
        assertThat(rows).extracting(RawEvent::getChainStatus).containsExactlyInAnyOrder("pending", "included");
        assertThat(store.contains("abc", "canonical")).isFalse();
    }

    @Test
    @DisplayName("stored row keeps block and transaction metadata")
    void append_keepsMetadata() {
        RawEvent stored = store.append(deposit(77, "0xmeta", "5", "1"));

        assertThat(stored.getBlockHeight()).isEqualTo(77);
        assertThat(stored.getBlockHash()).isEqualTo("hash-77");
        assertThat(stored.getType()).isEqualTo("DepositCollateral");
        assertThat(stored.getTransactionStatus()).isEqualTo("applied");
        assertThat(stored.getCreatedAt()).isNotNull();
    }
}
