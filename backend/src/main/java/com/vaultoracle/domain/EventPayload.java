package com.vaultoracle.domain;

import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Typed payload of an engine event; one record per {@link EventType}. Vault events carry the vault address,
 * balance events carry the resulting absolute vault amounts (not deltas).
 */
public sealed interface EventPayload
        permits EventPayload.VaultEvent, EventPayload.EmergencyStopToggled, EventPayload.ValidPriceBlockCountUpdated,
        EventPayload.AdminUpdated, EventPayload.OracleWhitelistUpdated {

    EventType type();

    /** BSON form stored in raw_events.payload. */
    org.bson.Document toDocument();

    sealed interface VaultEvent extends EventPayload
            permits NewVault, VaultOwnerUpdated, Liquidate, VaultBalanceEvent {

        String vaultAddress();
    }

    sealed interface VaultBalanceEvent extends VaultEvent
            permits DepositCollateral, RedeemCollateral, MintZkUsd, BurnZkUsd {

        BigDecimal amount();

        BigDecimal vaultCollateralAmount();

        BigDecimal vaultDebtAmount();

        @Override
        default org.bson.Document toDocument() {
            return new org.bson.Document("vaultAddress", vaultAddress())
                    .append("amount", decimal(amount()))
                    .append("vaultCollateralAmount", decimal(vaultCollateralAmount()))
                    .append("vaultDebtAmount", decimal(vaultDebtAmount()));
        }
    }

    record NewVault(String vaultAddress, String owner) implements VaultEvent {
        public NewVault {
            Objects.requireNonNull(vaultAddress, "vaultAddress");
        }

        @Override
        public EventType type() {
            return EventType.NEW_VAULT;
        }

        @Override
        public org.bson.Document toDocument() {
            return new org.bson.Document("vaultAddress", vaultAddress).append("owner", owner);
        }
    }

    record VaultOwnerUpdated(String vaultAddress, String previousOwner, String newOwner) implements VaultEvent {
        public VaultOwnerUpdated {
            Objects.requireNonNull(vaultAddress, "vaultAddress");
        }

        @Override
        public EventType type() {
            return EventType.VAULT_OWNER_UPDATED;
        }

        @Override
        public org.bson.Document toDocument() {
            return new org.bson.Document("vaultAddress", vaultAddress)
                    .append("previousOwner", previousOwner)
                    .append("newOwner", newOwner);
        }
    }

    record DepositCollateral(String vaultAddress, BigDecimal amount, BigDecimal vaultCollateralAmount,
                             BigDecimal vaultDebtAmount) implements VaultBalanceEvent {
        public DepositCollateral {
            Objects.requireNonNull(vaultAddress, "vaultAddress");
        }

        @Override
        public EventType type() {
            return EventType.DEPOSIT_COLLATERAL;
        }
    }

    record RedeemCollateral(String vaultAddress, BigDecimal amount, BigDecimal vaultCollateralAmount,
                            BigDecimal vaultDebtAmount) implements VaultBalanceEvent {
        public RedeemCollateral {
            Objects.requireNonNull(vaultAddress, "vaultAddress");
        }

        @Override
        public EventType type() {
            return EventType.REDEEM_COLLATERAL;
        }
    }

    record MintZkUsd(String vaultAddress, BigDecimal amount, BigDecimal vaultCollateralAmount,
                     BigDecimal vaultDebtAmount) implements VaultBalanceEvent {
        public MintZkUsd {
            Objects.requireNonNull(vaultAddress, "vaultAddress");
        }

        @Override
        public EventType type() {
            return EventType.MINT_ZKUSD;
        }
    }

    record BurnZkUsd(String vaultAddress, BigDecimal amount, BigDecimal vaultCollateralAmount,
                     BigDecimal vaultDebtAmount) implements VaultBalanceEvent {
        public BurnZkUsd {
            Objects.requireNonNull(vaultAddress, "vaultAddress");
        }

        @Override
        public EventType type() {
            return EventType.BURN_ZKUSD;
        }
    }

    record Liquidate(String vaultAddress, String liquidator, BigDecimal vaultCollateralLiquidated,
                     BigDecimal vaultDebtRepaid) implements VaultEvent {
        public Liquidate {
            Objects.requireNonNull(vaultAddress, "vaultAddress");
        }

        @Override
        public EventType type() {
            return EventType.LIQUIDATE;
        }

        @Override
        public org.bson.Document toDocument() {
            return new org.bson.Document("vaultAddress", vaultAddress)
                    .append("liquidator", liquidator)
                    .append("vaultCollateralLiquidated", decimal(vaultCollateralLiquidated))
                    .append("vaultDebtRepaid", decimal(vaultDebtRepaid));
        }
    }

    record EmergencyStopToggled(boolean emergencyStopped) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.EMERGENCY_STOP_TOGGLED;
        }

        @Override
        public org.bson.Document toDocument() {
            return new org.bson.Document("emergencyStopped", emergencyStopped);
        }
    }

    record ValidPriceBlockCountUpdated(long previousCount, long newCount) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.VALID_PRICE_BLOCK_COUNT_UPDATED;
        }

        @Override
        public org.bson.Document toDocument() {
            return new org.bson.Document("previousCount", previousCount).append("newCount", newCount);
        }
    }

    record AdminUpdated(String previousAdmin, String newAdmin) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.ADMIN_UPDATED;
        }

        @Override
        public org.bson.Document toDocument() {
            return new org.bson.Document("previousAdmin", previousAdmin).append("newAdmin", newAdmin);
        }
    }

    record OracleWhitelistUpdated(String previousHash, String newHash) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.ORACLE_WHITELIST_UPDATED;
        }

        @Override
        public org.bson.Document toDocument() {
            return new org.bson.Document("previousHash", previousHash).append("newHash", newHash);
        }
    }

    private static Decimal128 decimal(BigDecimal value) {
        return value == null ? null : new Decimal128(value);
    }
}
