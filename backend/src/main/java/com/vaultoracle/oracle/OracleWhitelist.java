package com.vaultoracle.oracle;

import java.util.List;

/**
 * Oracle public keys in slot order, padded with the dummy key to the slot count.
 */
public record OracleWhitelist(List<String> addresses) {

    public OracleWhitelist {
        addresses = List.copyOf(addresses);
    }

    public boolean contains(String publicKey) {
        return addresses.contains(publicKey);
    }

    public int size() {
        return addresses.size();
    }
}
