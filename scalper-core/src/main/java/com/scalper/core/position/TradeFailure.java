package com.scalper.core.position;

/**
 * Why an open or close attempt failed. All of these are recoverable.
 */
public enum TradeFailure {
    NO_MARKET_DATA("No market data yet"),
    GATEWAY_REJECTED("Order rejected by exchange"),
    CONFIRMATION_TIMEOUT("No order confirmation in time"),
    INVALID_STATE("Operation not allowed in current state");

    private final String description;

    TradeFailure(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
