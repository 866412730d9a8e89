package com.scalper.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scalper.core.market.QuoteCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * BYBIT ORDERBOOK STREAM
 *
 * Public spot WebSocket feed for a single symbol. Subscribes to
 * {@code orderbook.<depth>.<SYMBOL>}, keeps a local copy of the book
 * (snapshot, then deltas) and pushes its best bid/ask into the {@link QuoteCache}.
 *
 * Endpoint: wss://stream.bybit.com/v5/public/spot (testnet: stream-testnet)
 * Docs: https://bybit-exchange.github.io/docs/v5/websocket/public/orderbook
 */
public class BybitOrderbookStream implements WebSocket.Listener {
    private static final Logger logger = LoggerFactory.getLogger(BybitOrderbookStream.class);

    private static final Duration RECONNECT_DELAY = Duration.ofSeconds(5);
    private static final Duration PING_INTERVAL = Duration.ofSeconds(20);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<WebSocket> webSocket = new AtomicReference<>();
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean shouldReconnect = new AtomicBoolean(true);

    private final String url;
    private final String topic;
    private final QuoteCache quoteCache;
    private final HttpClient httpClient;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "bybit-orderbook-scheduler");
        t.setDaemon(true);
        return t;
    });

    // Fragments of the current text message
    private final StringBuilder messageBuffer = new StringBuilder();

    // Local book, price -> size. Only touched from the listener callbacks.
    private final NavigableMap<Double, Double> bids = new TreeMap<>(Comparator.reverseOrder());
    private final NavigableMap<Double, Double> asks = new TreeMap<>();
    private volatile boolean bookReady = false;

    public BybitOrderbookStream(String url, String symbol, int depth, QuoteCache quoteCache) {
        this(url, symbol, depth, quoteCache, HttpClient.newHttpClient());
    }

    BybitOrderbookStream(String url, String symbol, int depth, QuoteCache quoteCache, HttpClient httpClient) {
        this.url = url;
        this.topic = "orderbook." + depth + "." + symbol;
        this.quoteCache = quoteCache;
        this.httpClient = httpClient;
        scheduler.scheduleAtFixedRate(this::sendPing,
            PING_INTERVAL.toSeconds(), PING_INTERVAL.toSeconds(), TimeUnit.SECONDS);
    }

    /**
     * Connect and subscribe. Failures schedule a reconnect rather than completing exceptionally.
     */
    public CompletableFuture<Void> connect() {
        logger.info("🔌 Connecting to Bybit orderbook stream: {}", url);

        return httpClient.newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .buildAsync(URI.create(url), this)
            .thenAccept(ws -> {
                webSocket.set(ws);
                connected.set(true);
                logger.info("✅ Bybit orderbook stream connected");
                subscribe(ws);
            })
            .exceptionally(e -> {
                logger.error("❌ Orderbook stream connection failed: {}", e.getMessage());
                scheduleReconnect();
                return null;
            });
    }

    void subscribe(WebSocket ws) {
        try {
            String subscribeMsg = objectMapper.writeValueAsString(Map.of(
                "op", "subscribe",
                "args", List.of(topic)
            ));
            ws.sendText(subscribeMsg, true);
            logger.info("📡 Subscribed to {}", topic);
        } catch (Exception e) {
            logger.error("Failed to subscribe to {}: {}", topic, e.getMessage());
        }
    }

    private void sendPing() {
        if (!connected.get()) {
            return;
        }
        WebSocket ws = webSocket.get();
        if (ws == null) {
            return;
        }
        try {
            ws.sendText("{\"op\":\"ping\"}", true);
        } catch (Exception e) {
            logger.warn("Ping failed: {}", e.getMessage());
        }
    }

    // ==================== WebSocket.Listener Implementation ====================

    @Override
    public void onOpen(WebSocket webSocket) {
        logger.debug("Orderbook socket opened");
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        messageBuffer.append(data);
        if (last) {
            handleMessage(messageBuffer.toString());
            messageBuffer.setLength(0);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        logger.warn("🔒 Orderbook stream closed: {} - {}", statusCode, reason);
        connected.set(false);
        bookReady = false;
        scheduleReconnect();
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        logger.error("❌ Orderbook stream error: {}", error.getMessage());
        connected.set(false);
        bookReady = false;
        scheduleReconnect();
    }

    /**
     * Process one complete text frame.
     */
    void handleMessage(String message) {
        JsonNode root;
        try {
            root = objectMapper.readTree(message);
        } catch (Exception e) {
            logger.warn("Failed to parse orderbook message: {}", e.getMessage());
            return;
        }

        if (root.has("op")) {
            String op = root.path("op").asText();
            if ("subscribe".equals(op) && !root.path("success").asBoolean(false)) {
                logger.error("❌ Subscription to {} failed: {}", topic, root.path("ret_msg").asText());
            } else {
                logger.debug("📬 {} response: {}", op, root.path("ret_msg").asText("ok"));
            }
            return;
        }

        if (!topic.equals(root.path("topic").asText())) {
            logger.debug("📩 Ignoring message for topic {}", root.path("topic").asText());
            return;
        }

        JsonNode data = root.path("data");
        String type = root.path("type").asText();
        if ("snapshot".equals(type)) {
            bids.clear();
            asks.clear();
            bookReady = true;
        } else if (!bookReady) {
            logger.debug("📩 Delta before first snapshot ignored");
            return;
        }

        applyLevels(bids, data.path("b"));
        applyLevels(asks, data.path("a"));
        quoteCache.update(bestPrice(bids), bestPrice(asks));
    }

    /**
     * Apply [price, size] levels to one side of the book. Size 0 removes the level.
     */
    private static void applyLevels(NavigableMap<Double, Double> side, JsonNode levels) {
        for (JsonNode level : levels) {
            if (!level.isArray() || level.size() < 2) {
                continue;
            }
            try {
                double price = Double.parseDouble(level.get(0).asText());
                double size = Double.parseDouble(level.get(1).asText());
                if (size > 0) {
                    side.put(price, size);
                } else {
                    side.remove(price);
                }
            } catch (NumberFormatException e) {
                logger.warn("Skipping malformed orderbook level {}", level);
            }
        }
    }

    private static Double bestPrice(NavigableMap<Double, Double> side) {
        return side.isEmpty() ? null : side.firstKey();
    }

    private void scheduleReconnect() {
        if (shouldReconnect.get() && !scheduler.isShutdown()) {
            logger.info("🔄 Reconnecting orderbook stream in {} seconds...", RECONNECT_DELAY.toSeconds());
            scheduler.schedule(this::connect, RECONNECT_DELAY.toSeconds(), TimeUnit.SECONDS);
        }
    }

    /**
     * Close the socket and stop reconnecting.
     */
    public void disconnect() {
        shouldReconnect.set(false);
        connected.set(false);

        WebSocket ws = webSocket.getAndSet(null);
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "Shutting down");
        }

        scheduler.shutdownNow();
        logger.info("🔌 Bybit orderbook stream disconnected");
    }
}
