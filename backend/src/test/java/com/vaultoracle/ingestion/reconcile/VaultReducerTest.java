package com.vaultoracle.ingestion.reconcile;

import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.domain.EventPayload;
import com.vaultoracle.domain.VaultAggregate;
import com.vaultoracle.domain.VaultAggregateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.vaultoracle.domain.ChainEventFixtures.OWNER;
import static com.vaultoracle.domain.ChainEventFixtures.VAULT;
import static com.vaultoracle.domain.ChainEventFixtures.deposit;
import static com.vaultoracle.domain.ChainEventFixtures.event;
import static com.vaultoracle.domain.ChainEventFixtures.mint;
import static com.vaultoracle.domain.ChainEventFixtures.newVault;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class VaultReducerTest {

    @Mock
    VaultAggregateRepository vaultRepository;

    VaultReducer reducer;
    Map<String, VaultAggregate> store;

    @BeforeEach
    void setUp() {
        store = new HashMap<>();
        when(vaultRepository.findByAddress(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(store.get(inv.getArgument(0, String.class))));
        when(vaultRepository.save(any(VaultAggregate.class))).thenAnswer(inv -> {
            VaultAggregate vault = inv.getArgument(0);
            store.put(vault.getAddress(), vault);
            return vault;
        });
        reducer = new VaultReducer(vaultRepository);
    }

    @Test
    @DisplayName("NewVault then DepositCollateral yields owner and absolute amounts")
    void newVaultThenDeposit() {
        assertThat(reducer.apply(newVault(10, "0xh1", OWNER), 0)).isTrue();
        assertThat(reducer.apply(deposit(11, "0xh2", "50", "0"), 0)).isTrue();

        VaultAggregate vault = store.get(VAULT);
        assertThat(vault.getAddress()).isEqualTo(VAULT);
        assertThat(vault.getOwner()).isEqualTo(OWNER);
        assertThat(vault.getCollateralAmount()).isEqualByComparingTo("50");
        assertThat(vault.getDebtAmount()).isEqualByComparingTo("0");
        assertThat(vault.getLatestTransactionHash()).isEqualTo("0xh2");
        assertThat(vault.getLastUpdateBlock()).isEqualTo(11L);
    }

    @Test
    @DisplayName("balance events replace amounts rather than accumulate")
    void balanceEvents_replace() {
        reducer.apply(newVault(10, "0xh1", OWNER), 0);
        reducer.apply(deposit(11, "0xh2", "100", "0"), 0);
        reducer.apply(mint(12, "0xh3", "100", "40"), 0);
        reducer.apply(event(13, "0xh4", "canonical", new EventPayload.RedeemCollateral(VAULT,
                new BigDecimal("30"), new BigDecimal("70"), new BigDecimal("40"))), 0);

        VaultAggregate vault = store.get(VAULT);
        assertThat(vault.getCollateralAmount()).isEqualByComparingTo("70");
        assertThat(vault.getDebtAmount()).isEqualByComparingTo("40");
    }

    @Test
    @DisplayName("owner update and liquidation")
    void ownerUpdateAndLiquidate() {
        reducer.apply(newVault(10, "0xh1", OWNER), 0);
        reducer.apply(mint(11, "0xh2", "100", "40"), 0);
        reducer.apply(event(12, "0xh3", "canonical", new EventPayload.VaultOwnerUpdated(VAULT, OWNER, "B62qnew")), 0);
        reducer.apply(event(13, "0xh4", "canonical", new EventPayload.Liquidate(VAULT, "B62qliq",
                new BigDecimal("100"), new BigDecimal("40"))), 0);

        VaultAggregate vault = store.get(VAULT);
        assertThat(vault.getOwner()).isEqualTo("B62qnew");
        assertThat(vault.getCollateralAmount()).isEqualByComparingTo("0");
        assertThat(vault.getDebtAmount()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("applying the same sequence twice gives the same state as applying it once")
    void idempotentReplay() {
        List<ChainEvent> events = List.of(newVault(10, "0xh1", OWNER), deposit(11, "0xh2", "100", "0"),
                mint(11, "0xh3", "100", "25"));

        for (int i = 0; i < events.size(); i++) {
            reducer.apply(events.get(i), i);
        }
        BigDecimal collateral = store.get(VAULT).getCollateralAmount();
        BigDecimal debt = store.get(VAULT).getDebtAmount();

        for (int i = 0; i < events.size(); i++) {
            assertThat(reducer.apply(events.get(i), i)).isFalse();
        }
        assertThat(store.get(VAULT).getCollateralAmount()).isEqualByComparingTo(collateral);
        assertThat(store.get(VAULT).getDebtAmount()).isEqualByComparingTo(debt);
        assertThat(store.get(VAULT).getLatestTransactionHash()).isEqualTo("0xh3");
    }

    @Test
    @DisplayName("replaying an older event after a newer one was applied does not re-apply it")
    void outOfOrderReplay_ignored() {
        ChainEvent e1 = deposit(11, "0xh1", "100", "0");
        ChainEvent e2 = mint(12, "0xh2", "100", "50");
        reducer.apply(newVault(10, "0xh0", OWNER), 0);
        reducer.apply(e1, 0);
        reducer.apply(e2, 0);

        assertThat(reducer.apply(e1, 0)).isFalse();

        VaultAggregate vault = store.get(VAULT);
        assertThat(vault.getDebtAmount()).isEqualByComparingTo("50");
        assertThat(vault.getLatestTransactionHash()).isEqualTo("0xh2");
    }

    @Test
    @DisplayName("balance event for an unseen vault creates it without an owner")
    void unknownVault_createdWithoutOwner() {
        assertThat(reducer.apply(deposit(5, "0xh1", "10", "0"), 0)).isTrue();

        assertThat(store.get(VAULT).getOwner()).isNull();
        assertThat(store.get(VAULT).getCollateralAmount()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("non-vault events are rejected")
    void nonVaultEvent_rejected() {
        assertThatThrownBy(() -> reducer.apply(event(5, "0xh1", "canonical",
                new EventPayload.AdminUpdated("B62qa", "B62qb")), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
