package com.scalper.core.market;

import java.time.Instant;

/**
 * Best bid/ask snapshot for the traded symbol.
 * Immutable - the cache swaps whole instances, so bid and ask always belong together.
 */
public record Quote(
    double bid,
    double ask,
    Instant receivedAt
) {
    public Quote {
        if (!isValidPrice(bid)) {
            throw new IllegalArgumentException("Bid must be positive: " + bid);
        }
        if (!isValidPrice(ask)) {
            throw new IllegalArgumentException("Ask must be positive: " + ask);
        }
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt is required");
        }
    }

    public Quote(double bid, double ask) {
        this(bid, ask, Instant.now());
    }

    static boolean isValidPrice(Double price) {
        return price != null && !price.isNaN() && !price.isInfinite() && price > 0;
    }
}
