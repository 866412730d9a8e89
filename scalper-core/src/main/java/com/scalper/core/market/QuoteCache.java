package com.scalper.core.market;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * QUOTE CACHE
 *
 * Latest best bid/ask for one symbol, written by the market feed and read by
 * the position lifecycle. Only the most recent quote is retained (last write wins).
 *
 * Callers that need a fresh quote register through {@link #awaitNextQuote()};
 * each accepted update completes every future registered before it, exactly once.
 */
public class QuoteCache {
    private static final Logger logger = LoggerFactory.getLogger(QuoteCache.class);

    private final String symbol;
    private final AtomicReference<Quote> latest = new AtomicReference<>();
    private final Queue<CompletableFuture<Quote>> waiters = new ConcurrentLinkedQueue<>();

    public QuoteCache(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Replace the cached quote.
     *
     * @return false if the update was discarded because a side was missing or not positive
     */
    public boolean update(Double bid, Double ask) {
        if (!Quote.isValidPrice(bid) || !Quote.isValidPrice(ask)) {
            logger.warn("⚠️ Incomplete orderbook data for {} discarded (bid={}, ask={})", symbol, bid, ask);
            return false;
        }

        Quote quote = new Quote(bid, ask, Instant.now());
        latest.set(quote);
        logger.debug("📈 {} bid={} ask={}", symbol, bid, ask);

        CompletableFuture<Quote> waiter;
        while ((waiter = waiters.poll()) != null) {
            waiter.complete(quote);
        }
        return true;
    }

    /**
     * Latest quote, empty until the first valid update arrives.
     */
    public Optional<Quote> read() {
        return Optional.ofNullable(latest.get());
    }

    /**
     * Future completed by the next accepted update. Cancelling it simply drops interest.
     */
    public CompletableFuture<Quote> awaitNextQuote() {
        CompletableFuture<Quote> waiter = new CompletableFuture<>();
        waiters.add(waiter);
        waiter.whenComplete((quote, error) -> waiters.remove(waiter));
        return waiter;
    }

    public String symbol() {
        return symbol;
    }
}
