package com.vaultoracle.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Engine contract event kinds, with the wire name the chain reports.
 */
public enum EventType {
    NEW_VAULT("NewVault"),
    VAULT_OWNER_UPDATED("VaultOwnerUpdated"),
    DEPOSIT_COLLATERAL("DepositCollateral"),
    REDEEM_COLLATERAL("RedeemCollateral"),
    MINT_ZKUSD("MintZkUsd"),
    BURN_ZKUSD("BurnZkUsd"),
    LIQUIDATE("Liquidate"),
    EMERGENCY_STOP_TOGGLED("EmergencyStopToggled"),
    VALID_PRICE_BLOCK_COUNT_UPDATED("ValidPriceBlockCountUpdated"),
    ADMIN_UPDATED("AdminUpdated"),
    ORACLE_WHITELIST_UPDATED("OracleWhitelistUpdated");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }
}
