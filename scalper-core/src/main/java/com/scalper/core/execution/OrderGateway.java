package com.scalper.core.execution;

import java.util.concurrent.CompletableFuture;

/**
 * Exchange-side order entry.
 * Implementations complete the returned future with the confirmation whose
 * {@code clientOrderId} matches the request, and forget the request once the
 * caller cancels the future.
 */
public interface OrderGateway {

    /**
     * Submit a market order. Never blocks on the exchange round trip.
     */
    CompletableFuture<OrderConfirmation> place(OrderRequest request);

    /**
     * Check if orders can currently be submitted.
     */
    boolean isConnected();
}
