package com.scalper.core.position;

import com.scalper.core.execution.ExecutionResult;
import com.scalper.core.execution.OrderExecutionCoordinator;
import com.scalper.core.execution.OrderSide;
import com.scalper.core.market.Quote;
import com.scalper.core.market.QuoteCache;
import com.scalper.core.notify.NotificationSink;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * POSITION LIFECYCLE STATE MACHINE
 *
 * Owns the single position record: IDLE -> OPENING -> OPEN -> CLOSING -> IDLE.
 *
 * State and position live together in one immutable snapshot and every transition
 * is a compare-and-set on it, so two callers can never both open (or both close)
 * and a second position can never be created.
 *
 * While OPEN a monitor polls the quote cache on a fixed delay and closes the
 * position once the bid reaches the target. A failed close puts the position
 * back to OPEN and the next tick tries again.
 */
public class PositionLifecycleManager {
    private static final Logger logger = LoggerFactory.getLogger(PositionLifecycleManager.class);

    private static final Snapshot IDLE = new Snapshot(PositionState.IDLE, null);

    private record Snapshot(PositionState state, Position position) {}

    private final QuoteCache quoteCache;
    private final OrderExecutionCoordinator coordinator;
    private final NotificationSink notificationSink;
    private final TradingParameters parameters;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<Snapshot> current = new AtomicReference<>(IDLE);
    private final AtomicReference<ScheduledFuture<?>> monitorTask = new AtomicReference<>();
    private volatile boolean quoteMissingLogged = false;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "position-monitor");
        t.setDaemon(true);
        return t;
    });

    public PositionLifecycleManager(QuoteCache quoteCache,
                                    OrderExecutionCoordinator coordinator,
                                    NotificationSink notificationSink,
                                    TradingParameters parameters,
                                    MeterRegistry meterRegistry) {
        this.quoteCache = quoteCache;
        this.coordinator = coordinator;
        this.notificationSink = notificationSink;
        this.parameters = parameters;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("scalper.position.open", current,
            ref -> ref.get().state() == PositionState.OPEN ? 1 : 0);
    }

    /**
     * Buy {@code quantity} at market and start monitoring for the target.
     * Only valid from IDLE.
     */
    public TradeResult open() {
        Snapshot snapshot = current.get();
        if (snapshot.state() != PositionState.IDLE) {
            logger.warn("⚠️ Open rejected: position already active ({})", snapshot.state());
            return TradeResult.failed(TradeFailure.INVALID_STATE, "A position is already active");
        }

        Optional<Quote> quote = awaitQuote();
        if (quote.isEmpty()) {
            logger.error("Cannot open position: no orderbook data for {}", parameters.symbol());
            return TradeResult.failed(TradeFailure.NO_MARKET_DATA, "No orderbook data for " + parameters.symbol());
        }

        Snapshot opening = new Snapshot(PositionState.OPENING, null);
        if (!transition(snapshot, opening)) {
            logger.warn("⚠️ Open rejected: another open is in progress");
            return TradeResult.failed(TradeFailure.INVALID_STATE, "A position is already active");
        }

        // Pre-trade ask is the entry reference
        double entryPrice = quote.get().ask();

        ExecutionResult result;
        try {
            result = coordinator.execute(OrderSide.BUY, parameters.symbol(),
                parameters.quantity(), parameters.openTimeout());
        } catch (RuntimeException e) {
            transition(opening, IDLE);
            logger.error("Unexpected error while opening position: {}", e.getMessage(), e);
            return TradeResult.failed(TradeFailure.GATEWAY_REJECTED, e.getMessage());
        }

        switch (result.status()) {
            case FILLED -> {
                Position position = Position.open(result.orderId(), parameters.symbol(),
                    parameters.quantity(), entryPrice, parameters.targetProfitPercent());
                // Monitor is scheduled before OPEN is visible so a fast close always finds it
                startMonitoring();
                transition(opening, new Snapshot(PositionState.OPEN, position));
                meterRegistry.counter("scalper.positions.opened").increment();
                logger.info("🟢 Opened new position: {} x{} entry={} target={} (orderId={})",
                    position.symbol(), position.quantity(), position.entryPrice(),
                    position.targetPrice(), position.orderId());
                return TradeResult.opened(position);
            }
            case TIMEOUT -> {
                transition(opening, IDLE);
                logger.error("⏰ Open timed out - buy {} may still fill at the exchange, check the account manually",
                    result.request().clientOrderId());
                return TradeResult.failed(TradeFailure.CONFIRMATION_TIMEOUT, result.reason());
            }
            default -> {
                transition(opening, IDLE);
                logger.error("Error opening position: {}", result.reason());
                return TradeResult.failed(TradeFailure.GATEWAY_REJECTED, result.reason());
            }
        }
    }

    /**
     * Sell the open position at market. Only valid from OPEN.
     * On failure the position stays OPEN and unchanged.
     */
    public TradeResult close() {
        Snapshot snapshot = current.get();
        if (snapshot.state() != PositionState.OPEN) {
            String reason = snapshot.state() == PositionState.IDLE
                ? "No open position"
                : "Position is " + snapshot.state().name().toLowerCase();
            return TradeResult.failed(TradeFailure.INVALID_STATE, reason);
        }

        Optional<Quote> quote = quoteCache.read();
        if (quote.isEmpty()) {
            return TradeResult.failed(TradeFailure.NO_MARKET_DATA, "No orderbook data for " + parameters.symbol());
        }
        double exitBid = quote.get().bid();

        Position position = snapshot.position();
        Snapshot closing = new Snapshot(PositionState.CLOSING, position);
        if (!transition(snapshot, closing)) {
            return TradeResult.failed(TradeFailure.INVALID_STATE, "Position is already being closed");
        }

        ExecutionResult result;
        try {
            result = coordinator.execute(OrderSide.SELL, position.symbol(),
                position.quantity(), parameters.closeTimeout());
        } catch (RuntimeException e) {
            transition(closing, snapshot);
            logger.error("Unexpected error while closing position: {}", e.getMessage(), e);
            return TradeResult.failed(TradeFailure.GATEWAY_REJECTED, e.getMessage());
        }

        if (!result.isFilled()) {
            transition(closing, snapshot);
            TradeFailure failure = switch (result.status()) {
                case TIMEOUT -> TradeFailure.CONFIRMATION_TIMEOUT;
                default -> TradeFailure.GATEWAY_REJECTED;
            };
            logger.error("Error closing position: {} - position stays open", result.reason());
            return TradeResult.failed(failure, result.reason());
        }

        double profitPercent = position.profitPercent(exitBid);
        notifySafely(PositionMessages.closed(position, exitBid, profitPercent));

        transition(closing, IDLE);
        stopMonitoring();

        meterRegistry.counter("scalper.positions.closed").increment();
        meterRegistry.summary("scalper.position.profit.percent").record(profitPercent);
        logger.info("🔴 Position closed successfully: {} exit={} profit={}% (orderId={})",
            position.symbol(), exitBid, String.format("%.2f", profitPercent), result.orderId());
        return TradeResult.closed(position, exitBid, profitPercent);
    }

    /**
     * Snapshot of the current position. Never changes state.
     */
    public PositionStatus status() {
        Snapshot snapshot = current.get();
        if (snapshot.state() == PositionState.IDLE) {
            return PositionStatus.idle();
        }

        Double bid = quoteCache.read().map(Quote::bid).orElse(null);
        Position position = snapshot.position();
        Double profit = bid != null && position != null ? position.profitPercent(bid) : null;
        return new PositionStatus(snapshot.state(), position, bid, profit);
    }

    public PositionState state() {
        return current.get().state();
    }

    public Optional<Position> currentPosition() {
        return Optional.ofNullable(current.get().position());
    }

    /**
     * Stop monitoring and release the scheduler. An open position stays open at the exchange.
     */
    public void shutdown() {
        stopMonitoring();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        Snapshot snapshot = current.get();
        if (snapshot.state() != PositionState.IDLE) {
            logger.warn("⚠️ Shutting down with position in state {}: {}", snapshot.state(), snapshot.position());
        }
        logger.info("Position monitor stopped");
    }

    private boolean transition(Snapshot from, Snapshot to) {
        if (!from.state().canTransitionTo(to.state())) {
            throw new IllegalStateException("Illegal transition " + from.state() + " -> " + to.state());
        }
        boolean moved = current.compareAndSet(from, to);
        if (moved) {
            logger.debug("Position state {} -> {}", from.state(), to.state());
        }
        return moved;
    }

    // ==================== Monitoring ====================

    private void startMonitoring() {
        long intervalMs = parameters.monitorInterval().toMillis();
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(
            this::checkPosition, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = monitorTask.getAndSet(task);
        if (previous != null) {
            previous.cancel(false);
        }
        logger.info("👀 Monitoring {} every {}ms", parameters.symbol(), intervalMs);
    }

    private void stopMonitoring() {
        ScheduledFuture<?> task = monitorTask.getAndSet(null);
        if (task != null) {
            task.cancel(false);
        }
    }

    boolean isMonitoring() {
        ScheduledFuture<?> task = monitorTask.get();
        return task != null && !task.isDone();
    }

    /**
     * One monitoring tick. Exceptions are logged so the schedule keeps running.
     */
    void checkPosition() {
        try {
            Snapshot snapshot = current.get();
            if (snapshot.state() != PositionState.OPEN) {
                return;
            }

            Optional<Quote> quote = quoteCache.read();
            if (quote.isEmpty()) {
                if (!quoteMissingLogged) {
                    logger.warn("No orderbook data available for monitoring");
                    quoteMissingLogged = true;
                }
                return;
            }
            quoteMissingLogged = false;

            double bid = quote.get().bid();
            Position position = snapshot.position();
            if (position.isTargetReached(bid)) {
                logger.info("🎯 Target reached: bid {} >= target {}", bid, position.targetPrice());
                TradeResult result = close();
                if (!result.success()) {
                    logger.warn("Close attempt failed ({}), retrying on next tick", result.message());
                }
            }
        } catch (Exception e) {
            logger.error("Error in position monitor: {}", e.getMessage(), e);
        }
    }

    private Optional<Quote> awaitQuote() {
        Optional<Quote> cached = quoteCache.read();
        if (cached.isPresent() || parameters.quoteWait().isZero()) {
            return cached;
        }

        logger.info("Waiting up to {}ms for first quote on {}", parameters.quoteWait().toMillis(), parameters.symbol());
        var next = quoteCache.awaitNextQuote();
        try {
            return Optional.of(next.get(parameters.quoteWait().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            next.cancel(false);
            return quoteCache.read();
        } catch (InterruptedException e) {
            next.cancel(false);
            Thread.currentThread().interrupt();
            return quoteCache.read();
        } catch (ExecutionException e) {
            return quoteCache.read();
        }
    }

    private void notifySafely(String text) {
        try {
            notificationSink.notify(text);
        } catch (RuntimeException e) {
            logger.error("Error while sending notification: {}", e.getMessage());
        }
    }
}
