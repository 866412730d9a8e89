package com.scalper.core.execution;

/**
 * Market order direction. {@link #exchangeValue()} is the casing Bybit expects.
 */
public enum OrderSide {
    BUY("Buy"),
    SELL("Sell");

    private final String exchangeValue;

    OrderSide(String exchangeValue) {
        this.exchangeValue = exchangeValue;
    }

    public String exchangeValue() {
        return exchangeValue;
    }
}
