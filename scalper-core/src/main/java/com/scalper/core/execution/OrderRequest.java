package com.scalper.core.execution;

import java.util.UUID;

/**
 * Immutable market order request. {@code clientOrderId} correlates the
 * gateway's confirmation with the call that is waiting for it.
 */
public record OrderRequest(
    String clientOrderId,
    OrderSide side,
    String symbol,
    double quantity
) {
    public OrderRequest {
        if (clientOrderId == null || clientOrderId.isBlank()) {
            throw new IllegalArgumentException("clientOrderId is required");
        }
        if (side == null) {
            throw new IllegalArgumentException("side is required");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
    }

    /**
     * New request with a fresh 32-char id (fits Bybit's 36-char orderLinkId limit).
     */
    public static OrderRequest market(OrderSide side, String symbol, double quantity) {
        String id = UUID.randomUUID().toString().replace("-", "");
        return new OrderRequest(id, side, symbol, quantity);
    }
}
