package com.scalper.core.position;

import java.time.Duration;

/**
 * Process-lifetime trading settings consumed by the lifecycle manager.
 *
 * @param quoteWait     how long open() waits for a first quote when the cache is still empty
 * @param monitorInterval delay between monitoring ticks while a position is open
 */
public record TradingParameters(
    String symbol,
    double quantity,
    double targetProfitPercent,
    Duration openTimeout,
    Duration closeTimeout,
    Duration monitorInterval,
    Duration quoteWait
) {
    public TradingParameters {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (targetProfitPercent <= 0) {
            throw new IllegalArgumentException("Target profit percent must be positive");
        }
        if (openTimeout == null || closeTimeout == null || quoteWait == null) {
            throw new IllegalArgumentException("Timeouts are required");
        }
        if (monitorInterval == null || monitorInterval.isZero() || monitorInterval.isNegative()) {
            throw new IllegalArgumentException("Monitor interval must be positive");
        }
    }
}
