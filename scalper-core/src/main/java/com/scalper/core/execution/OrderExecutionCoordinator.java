package com.scalper.core.execution;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ORDER EXECUTION COORDINATOR
 *
 * Turns the gateway's asynchronous confirmations into a blocking call with a deadline:
 * one request out, then wait for the confirmation carrying the same client order id.
 *
 * On timeout the wait is cancelled so the gateway drops its correlation entry.
 * There is no cancel-order path - a timed-out order may still fill at the exchange.
 */
public class OrderExecutionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(OrderExecutionCoordinator.class);

    private final OrderGateway gateway;
    private final MeterRegistry meterRegistry;

    public OrderExecutionCoordinator(OrderGateway gateway, MeterRegistry meterRegistry) {
        this.gateway = gateway;
        this.meterRegistry = meterRegistry;
    }

    public ExecutionResult execute(OrderSide side, String symbol, double quantity, Duration timeout) {
        OrderRequest request = OrderRequest.market(side, symbol, quantity);
        long start = System.nanoTime();

        logger.info("📤 Placing {} {} x{} (clientOrderId={}, timeout={}ms)",
            side, symbol, quantity, request.clientOrderId(), timeout.toMillis());
        meterRegistry.counter("scalper.orders.placed", "side", side.name()).increment();

        CompletableFuture<OrderConfirmation> pending;
        try {
            pending = gateway.place(request);
        } catch (RuntimeException e) {
            logger.error("❌ Gateway refused {} order: {}", side, e.getMessage());
            return failed(request, "rejected", ExecutionResult.rejected(request, e.getMessage()));
        }

        OrderConfirmation confirmation;
        try {
            confirmation = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(false);
            logger.error("⏰ Timeout waiting for {} confirmation (clientOrderId={}) - order state at exchange unknown",
                side, request.clientOrderId());
            return failed(request, "timeout", ExecutionResult.timeout(request));
        } catch (InterruptedException e) {
            pending.cancel(false);
            Thread.currentThread().interrupt();
            logger.warn("{} confirmation wait interrupted (clientOrderId={})", side, request.clientOrderId());
            return failed(request, "interrupted", ExecutionResult.rejected(request, "Interrupted while waiting for confirmation"));
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("❌ {} order failed before confirmation: {}", side, cause.getMessage());
            return failed(request, "rejected", ExecutionResult.rejected(request, cause.getMessage()));
        }

        meterRegistry.timer("scalper.order.latency", "side", side.name())
            .record(Duration.ofNanos(System.nanoTime() - start));

        if (!request.clientOrderId().equals(confirmation.clientOrderId())) {
            // Gateways must correlate by id; anything else is a gateway bug
            logger.error("❌ Confirmation for {} delivered to {}", confirmation.clientOrderId(), request.clientOrderId());
            return failed(request, "mismatch", ExecutionResult.rejected(request, "Confirmation did not match request"));
        }

        if (!confirmation.success()) {
            logger.error("❌ {} order rejected: {}", side, confirmation.reason());
            return failed(request, "rejected", ExecutionResult.rejected(request, confirmation.reason()));
        }

        logger.info("✅ {} order filled (orderId={})", side, confirmation.orderId());
        return ExecutionResult.filled(request, confirmation.orderId());
    }

    private ExecutionResult failed(OrderRequest request, String reason, ExecutionResult result) {
        meterRegistry.counter("scalper.orders.failed",
            "side", request.side().name(),
            "reason", reason).increment();
        return result;
    }
}
