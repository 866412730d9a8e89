package com.scalper.core.execution;

/**
 * Outcome of {@link OrderExecutionCoordinator#execute}.
 * A {@code TIMEOUT} says nothing about the order's fate at the exchange.
 */
public record ExecutionResult(
    ExecutionStatus status,
    OrderRequest request,
    String orderId,
    String reason
) {
    public static ExecutionResult filled(OrderRequest request, String orderId) {
        return new ExecutionResult(ExecutionStatus.FILLED, request, orderId, null);
    }

    public static ExecutionResult rejected(OrderRequest request, String reason) {
        return new ExecutionResult(ExecutionStatus.REJECTED, request, null, reason);
    }

    public static ExecutionResult timeout(OrderRequest request) {
        return new ExecutionResult(ExecutionStatus.TIMEOUT, request, null, "No confirmation received in time");
    }

    public boolean isFilled() {
        return status == ExecutionStatus.FILLED;
    }
}
