package com.vaultoracle.domain;

/**
 * Range checks for on-chain counters. Heights, slots and indexes are unsigned 32-bit values on chain.
 */
public final class BlockHeights {

    public static final long MAX_UINT32 = 0xFFFF_FFFFL;

    private BlockHeights() {
    }

    public static long requireUInt32(long value, String name) {
        if (value < 0 || value > MAX_UINT32) {
            throw new IllegalArgumentException(name + " out of unsigned 32-bit range: " + value);
        }
        return value;
    }
}
