package com.vaultoracle.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.vaultoracle.domain.ChainEvent;
import com.vaultoracle.domain.EventPayload;
import com.vaultoracle.domain.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps archive {@code events} results to ChainEvent. Each result is one block ({@code blockInfo}) with its decoded
 * engine events ({@code eventData[]}: transactionInfo, type, data). Event order within a block is preserved.
 * Unknown event types are skipped with a warning.
 */
@Component
@Slf4j
public class ChainEventParser {

    public List<ChainEvent> parseBlocks(JsonNode blocks) {
        List<ChainEvent> events = new ArrayList<>();
        if (blocks == null || !blocks.isArray()) {
            return events;
        }
        for (JsonNode block : blocks) {
            JsonNode blockInfo = block.path("blockInfo");
            for (JsonNode eventData : block.path("eventData")) {
                parseEvent(blockInfo, eventData).ifPresent(events::add);
            }
        }
        return events;
    }

    Optional<ChainEvent> parseEvent(JsonNode blockInfo, JsonNode eventData) {
        String wireType = eventData.path("type").asText(null);
        Optional<EventType> type = EventType.fromWireName(wireType);
        if (type.isEmpty()) {
            log.warn("Skipping engine event of unknown type '{}' at block {}", wireType, blockInfo.path("height").asText());
            return Optional.empty();
        }
        JsonNode tx = eventData.path("transactionInfo");
        try {
            return Optional.of(new ChainEvent(
                    requiredLong(blockInfo, "height"),
                    blockInfo.path("stateHash").asText(null),
                    blockInfo.path("parentHash").asText(null),
                    blockInfo.path("globalSlotSinceGenesis").asLong(0),
                    requiredText(blockInfo, "chainStatus"),
                    requiredText(tx, "hash"),
                    tx.path("status").asText(null),
                    tx.path("memo").asText(null),
                    payload(type.get(), eventData.path("data"))));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ChainReadException("Malformed " + wireType + " event at block " + blockInfo.path("height").asText(), e);
        }
    }

    EventPayload payload(EventType type, JsonNode data) {
        return switch (type) {
            case NEW_VAULT -> new EventPayload.NewVault(text(data, "vaultAddress"), text(data, "owner"));
            case VAULT_OWNER_UPDATED -> new EventPayload.VaultOwnerUpdated(
                    text(data, "vaultAddress"), text(data, "previousOwner"), text(data, "newOwner"));
            case DEPOSIT_COLLATERAL -> new EventPayload.DepositCollateral(
                    text(data, "vaultAddress"), amount(data, "amount"),
                    amount(data, "vaultCollateralAmount"), amount(data, "vaultDebtAmount"));
            case REDEEM_COLLATERAL -> new EventPayload.RedeemCollateral(
                    text(data, "vaultAddress"), amount(data, "amount"),
                    amount(data, "vaultCollateralAmount"), amount(data, "vaultDebtAmount"));
            case MINT_ZKUSD -> new EventPayload.MintZkUsd(
                    text(data, "vaultAddress"), amount(data, "amount"),
                    amount(data, "vaultCollateralAmount"), amount(data, "vaultDebtAmount"));
            case BURN_ZKUSD -> new EventPayload.BurnZkUsd(
                    text(data, "vaultAddress"), amount(data, "amount"),
                    amount(data, "vaultCollateralAmount"), amount(data, "vaultDebtAmount"));
            case LIQUIDATE -> new EventPayload.Liquidate(
                    text(data, "vaultAddress"), text(data, "liquidator"),
                    amount(data, "vaultCollateralLiquidated"), amount(data, "vaultDebtRepaid"));
            case EMERGENCY_STOP_TOGGLED -> new EventPayload.EmergencyStopToggled(data.path("emergencyStopped").asBoolean());
            case VALID_PRICE_BLOCK_COUNT_UPDATED -> new EventPayload.ValidPriceBlockCountUpdated(
                    data.path("previousCount").asLong(), data.path("newCount").asLong());
            case ADMIN_UPDATED -> new EventPayload.AdminUpdated(text(data, "previousAdmin"), text(data, "newAdmin"));
            case ORACLE_WHITELIST_UPDATED -> new EventPayload.OracleWhitelistUpdated(
                    text(data, "previousHash"), text(data, "newHash"));
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String requiredText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value;
    }

    private static long requiredLong(JsonNode node, String field) {
        return Long.parseLong(requiredText(node, field));
    }

    /** Unsigned amount; the archive reports UInt64 values as decimal strings. */
    private static BigDecimal amount(JsonNode node, String field) {
        BigDecimal amount = new BigDecimal(requiredText(node, field));
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(field + " must be unsigned: " + amount);
        }
        return amount;
    }
}
