package com.vaultoracle.ingestion.reconcile;

import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.domain.EventPayload;
import com.vaultoracle.domain.VaultAggregate;
import com.vaultoracle.domain.VaultAggregateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Folds vault events into VaultAggregate. Balance events carry absolute resulting amounts, so applying one replaces
 * collateral and debt rather than accumulating.
 * <p>
 * An event is applied only if it is strictly after the vault's last applied position (blockHeight, eventIndex) and
 * its transaction hash differs from latestTransactionHash; replays and out-of-order redelivery are no-ops.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultReducer {

    private final VaultAggregateRepository vaultRepository;

    /**
     * @param eventIndex position of the event within its block, in fetch order
     * @return true if the vault changed and was saved
     * @throws IllegalArgumentException if the event is not a vault event
     */
    public boolean apply(ChainEvent event, int eventIndex) {
        if (!(event.payload() instanceof EventPayload.VaultEvent vaultEvent)) {
            throw new IllegalArgumentException("Not a vault event: " + event.type());
        }
        String address = vaultEvent.vaultAddress();
        VaultAggregate vault = vaultRepository.findByAddress(address)
                .orElseGet(() -> VaultAggregate.forAddress(address));
        if (vault.alreadyReflects(event.transactionHash(), event.blockHeight(), eventIndex)) {
            log.debug("Vault {} already reflects {} ({}@{}:{}), skipping", address, event.type().wireName(),
                    event.transactionHash(), event.blockHeight(), eventIndex);
            return false;
        }
        transition(vault, vaultEvent);
        vault.markApplied(event.transactionHash(), event.blockHeight(), eventIndex, Instant.now());
        vaultRepository.save(vault);
        log.debug("Vault {} updated by {} at block {}", address, event.type().wireName(), event.blockHeight());
        return true;
    }

    static void transition(VaultAggregate vault, EventPayload.VaultEvent payload) {
        switch (payload.type()) {
            case NEW_VAULT -> {
                vault.setOwner(((EventPayload.NewVault) payload).owner());
                vault.setCollateralAmount(BigDecimal.ZERO);
                vault.setDebtAmount(BigDecimal.ZERO);
            }
            case VAULT_OWNER_UPDATED -> vault.setOwner(((EventPayload.VaultOwnerUpdated) payload).newOwner());
            case DEPOSIT_COLLATERAL, REDEEM_COLLATERAL, MINT_ZKUSD, BURN_ZKUSD -> {
                EventPayload.VaultBalanceEvent balance = (EventPayload.VaultBalanceEvent) payload;
                vault.setCollateralAmount(balance.vaultCollateralAmount());
                vault.setDebtAmount(balance.vaultDebtAmount());
            }
            case LIQUIDATE -> {
                vault.setCollateralAmount(BigDecimal.ZERO);
                vault.setDebtAmount(BigDecimal.ZERO);
            }
            case EMERGENCY_STOP_TOGGLED, VALID_PRICE_BLOCK_COUNT_UPDATED, ADMIN_UPDATED, ORACLE_WHITELIST_UPDATED ->
                    throw new IllegalArgumentException("Not a vault event: " + payload.type());
        }
    }
}
