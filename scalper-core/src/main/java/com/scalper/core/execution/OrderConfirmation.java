package com.scalper.core.execution;

/**
 * Asynchronous answer from the order gateway for one {@link OrderRequest}.
 */
public record OrderConfirmation(
    String clientOrderId,
    boolean success,
    String orderId,
    String reason
) {
    public static OrderConfirmation accepted(String clientOrderId, String orderId) {
        return new OrderConfirmation(clientOrderId, true, orderId, null);
    }

    public static OrderConfirmation rejected(String clientOrderId, String reason) {
        return new OrderConfirmation(clientOrderId, false, null, reason);
    }
}
