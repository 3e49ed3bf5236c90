package com.vaultoracle.oracle;

import java.util.List;

/**
 * Fixed-arity submission set, one entry per whitelist slot in slot order.
 */
public record OraclePriceSubmissions(List<PriceSubmission> submissions) {

    public OraclePriceSubmissions {
        submissions = List.copyOf(submissions);
    }

    public long realCount() {
        return submissions.stream().filter(s -> !s.dummy()).count();
    }
}
