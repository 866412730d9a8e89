package com.scalper.core.position;

import java.time.Instant;

/**
 * The single open market exposure. Target price is fixed at creation.
 */
public record Position(
    String orderId,
    String symbol,
    double quantity,
    double entryPrice,
    double targetPrice,
    Instant openedAt
) {
    public Position {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (entryPrice <= 0) {
            throw new IllegalArgumentException("Entry price must be positive");
        }
    }

    /**
     * Create a position whose target sits {@code targetProfitPercent} above entry.
     */
    public static Position open(String orderId, String symbol, double quantity,
                                double entryPrice, double targetProfitPercent) {
        return new Position(orderId, symbol, quantity, entryPrice,
            calculateTargetPrice(entryPrice, targetProfitPercent), Instant.now());
    }

    public static double calculateTargetPrice(double entryPrice, double targetProfitPercent) {
        return entryPrice * (1 + targetProfitPercent / 100);
    }

    /**
     * Profit in percent if sold at {@code bid}.
     */
    public double profitPercent(double bid) {
        return (bid / entryPrice - 1) * 100;
    }

    public boolean isTargetReached(double bid) {
        return bid >= targetPrice;
    }
}
