package com.scalper.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scalper.core.execution.OrderConfirmation;
import com.scalper.core.execution.OrderGateway;
import com.scalper.core.execution.OrderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * BYBIT TRADE WEBSOCKET CLIENT
 *
 * Places spot market orders over Bybit's authenticated trade WebSocket.
 *
 * Every request carries the caller's client order id as both {@code reqId} and
 * {@code orderLinkId}; the response with the same {@code reqId} completes the
 * matching pending future. Responses for requests nobody waits for any more are
 * logged and dropped.
 *
 * Endpoint: wss://stream.bybit.com/v5/trade (testnet: stream-testnet)
 * Docs: https://bybit-exchange.github.io/docs/v5/websocket/trade/guideline
 *
 * Flow:
 * 1. Connect
 * 2. Send {@code auth} signed with HMAC-SHA256
 * 3. Send {@code order.create} per order
 */
public class BybitTradeWebSocketClient implements WebSocket.Listener, OrderGateway {
    private static final Logger logger = LoggerFactory.getLogger(BybitTradeWebSocketClient.class);

    private static final Duration PING_INTERVAL = Duration.ofSeconds(20);
    private static final long AUTH_EXPIRY_MS = 10_000;

    // Exponential backoff for reconnects: 1s -> 2s -> 4s ... (max 60s)
    private static final long INITIAL_RECONNECT_DELAY_SEC = 1;
    private static final long MAX_RECONNECT_DELAY_SEC = 60;
    private volatile long currentReconnectDelaySec = INITIAL_RECONNECT_DELAY_SEC;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<WebSocket> webSocket = new AtomicReference<>();
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean authenticated = new AtomicBoolean(false);
    private final AtomicBoolean shouldReconnect = new AtomicBoolean(true);
    private final AtomicReference<CompletableFuture<Void>> authResult =
        new AtomicReference<>(new CompletableFuture<>());

    // Order confirmations - keyed by reqId (= client order id)
    private final ConcurrentHashMap<String, CompletableFuture<OrderConfirmation>> pendingOrders =
        new ConcurrentHashMap<>();

    private final String url;
    private final String apiKey;
    private final BybitSigner signer;
    private final long recvWindowMs;
    private final HttpClient httpClient;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "bybit-trade-scheduler");
        t.setDaemon(true);
        return t;
    });

    private final StringBuilder messageBuffer = new StringBuilder();

    public BybitTradeWebSocketClient(String url, String apiKey, BybitSigner signer, long recvWindowMs) {
        this(url, apiKey, signer, recvWindowMs, HttpClient.newHttpClient());
    }

    BybitTradeWebSocketClient(String url, String apiKey, BybitSigner signer, long recvWindowMs,
                              HttpClient httpClient) {
        this.url = url;
        this.apiKey = apiKey;
        this.signer = signer;
        this.recvWindowMs = recvWindowMs;
        this.httpClient = httpClient;
        scheduler.scheduleAtFixedRate(this::sendPing,
            PING_INTERVAL.toSeconds(), PING_INTERVAL.toSeconds(), TimeUnit.SECONDS);
    }

    /**
     * Connect and authenticate.
     *
     * @return completes once the exchange accepts the auth request, exceptionally if it refuses
     */
    public CompletableFuture<Void> connect() {
        logger.info("🔐 Connecting to Bybit trade WebSocket: {}", url);
        CompletableFuture<Void> auth = new CompletableFuture<>();
        authResult.set(auth);

        httpClient.newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .buildAsync(URI.create(url), this)
            .thenAccept(ws -> attach(ws, false))
            .exceptionally(e -> {
                logger.error("❌ Trade WebSocket connection failed: {}", e.getMessage());
                auth.completeExceptionally(e);
                scheduleReconnect();
                return null;
            });
        return auth;
    }

    /**
     * Adopt an open socket, sending the auth request unless it is already authenticated.
     */
    void attach(WebSocket ws, boolean alreadyAuthenticated) {
        webSocket.set(ws);
        connected.set(true);
        authenticated.set(alreadyAuthenticated);
        if (alreadyAuthenticated) {
            authResult.get().complete(null);
        } else {
            sendAuth(ws);
        }
    }

    private void sendAuth(WebSocket ws) {
        try {
            long expires = System.currentTimeMillis() + AUTH_EXPIRY_MS;
            ObjectNode msg = objectMapper.createObjectNode();
            msg.put("reqId", UUID.randomUUID().toString().replace("-", ""));
            msg.put("op", "auth");
            msg.putArray("args")
                .add(apiKey)
                .add(expires)
                .add(signer.signAuth(expires));
            ws.sendText(objectMapper.writeValueAsString(msg), true);
            logger.info("🔑 Auth request sent");
        } catch (Exception e) {
            logger.error("Failed to send auth request: {}", e.getMessage());
            authResult.get().completeExceptionally(e);
        }
    }

    @Override
    public CompletableFuture<OrderConfirmation> place(OrderRequest request) {
        WebSocket ws = webSocket.get();
        if (!connected.get() || ws == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Trade WebSocket not connected"));
        }
        if (!authenticated.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Trade WebSocket not authenticated"));
        }

        String reqId = request.clientOrderId();
        CompletableFuture<OrderConfirmation> future = new CompletableFuture<>();
        pendingOrders.put(reqId, future);
        future.whenComplete((confirmation, error) -> pendingOrders.remove(reqId, future));

        try {
            ws.sendText(objectMapper.writeValueAsString(orderCreateMessage(request)), true);
            logger.info("📤 WS Order sent: {} {} x{} (reqId={})",
                request.side(), request.symbol(), request.quantity(), reqId);
        } catch (Exception e) {
            logger.error("Failed to send order via WebSocket: {}", e.getMessage());
            future.completeExceptionally(e);
        }
        return future;
    }

    ObjectNode orderCreateMessage(OrderRequest request) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("reqId", request.clientOrderId());
        ObjectNode header = msg.putObject("header");
        header.put("X-BAPI-TIMESTAMP", String.valueOf(System.currentTimeMillis()));
        header.put("X-BAPI-RECV-WINDOW", String.valueOf(recvWindowMs));
        msg.put("op", "order.create");

        ObjectNode order = msg.putArray("args").addObject();
        order.put("symbol", request.symbol());
        order.put("side", request.side().exchangeValue());
        order.put("orderType", "Market");
        order.put("qty", BigDecimal.valueOf(request.quantity()).stripTrailingZeros().toPlainString());
        order.put("category", "spot");
        order.put("marketUnit", "baseCoin");
        order.put("orderLinkId", request.clientOrderId());
        return msg;
    }

    @Override
    public boolean isConnected() {
        return connected.get() && authenticated.get();
    }

    int pendingCount() {
        return pendingOrders.size();
    }

    private void sendPing() {
        WebSocket ws = webSocket.get();
        if (!connected.get() || ws == null) {
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
        logger.debug("Trade socket opened");
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
        logger.warn("🔒 Trade WebSocket closed: {} - {}", statusCode, reason);
        connectionLost("Trade WebSocket closed: " + reason);
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        logger.error("❌ Trade WebSocket error: {}", error.getMessage());
        connectionLost("Trade WebSocket error: " + error.getMessage());
    }

    private void connectionLost(String reason) {
        connected.set(false);
        authenticated.set(false);
        failPending(reason);
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
            logger.warn("Failed to parse trade message: {}", e.getMessage());
            return;
        }

        String op = root.path("op").asText();
        switch (op) {
            case "auth" -> handleAuthResponse(root);
            case "order.create" -> handleOrderResponse(root);
            case "pong", "ping" -> logger.debug("💓 Trade pong");
            default -> logger.debug("📩 Unhandled trade message: {}",
                message.substring(0, Math.min(200, message.length())));
        }
    }

    private void handleAuthResponse(JsonNode root) {
        int retCode = root.path("retCode").asInt(-1);
        if (retCode == 0) {
            authenticated.set(true);
            currentReconnectDelaySec = INITIAL_RECONNECT_DELAY_SEC;
            authResult.get().complete(null);
            logger.info("✅ Trade WebSocket authenticated");
        } else {
            String retMsg = root.path("retMsg").asText("unknown error");
            authenticated.set(false);
            authResult.get().completeExceptionally(
                new IllegalStateException("Bybit auth failed: " + retMsg));
            logger.error("❌ Trade WebSocket auth failed: {} ({})", retMsg, retCode);
        }
    }

    private void handleOrderResponse(JsonNode root) {
        String reqId = root.path("reqId").asText(null);
        int retCode = root.path("retCode").asInt(-1);
        String retMsg = root.path("retMsg").asText("unknown error");
        String orderId = root.path("data").path("orderId").asText(null);

        CompletableFuture<OrderConfirmation> future = reqId == null ? null : pendingOrders.get(reqId);
        if (future == null) {
            logger.warn("⚠️ Order response for unknown or expired request {}: retCode={} orderId={}",
                reqId, retCode, orderId);
            return;
        }

        if (retCode == 0) {
            logger.info("✅ WS Order confirmed: {} (orderId={})", reqId, orderId);
            future.complete(OrderConfirmation.accepted(reqId, orderId));
        } else {
            logger.error("❌ WS Order failed: {} - {} ({})", reqId, retMsg, retCode);
            future.complete(OrderConfirmation.rejected(reqId, retMsg));
        }
    }

    private void failPending(String reason) {
        for (Map.Entry<String, CompletableFuture<OrderConfirmation>> entry : pendingOrders.entrySet()) {
            entry.getValue().completeExceptionally(new IllegalStateException(reason));
        }
        pendingOrders.clear();
    }

    private void scheduleReconnect() {
        if (!shouldReconnect.get() || scheduler.isShutdown()) {
            return;
        }
        long delay = currentReconnectDelaySec;
        currentReconnectDelaySec = Math.min(currentReconnectDelaySec * 2, MAX_RECONNECT_DELAY_SEC);
        logger.info("🔄 Scheduling trade reconnect in {} seconds (exponential backoff)", delay);
        scheduler.schedule(this::connect, delay, TimeUnit.SECONDS);
    }

    /**
     * Close the socket, fail outstanding requests and stop reconnecting.
     */
    public void disconnect() {
        shouldReconnect.set(false);
        connected.set(false);
        authenticated.set(false);
        failPending("Trade WebSocket disconnected");

        WebSocket ws = webSocket.getAndSet(null);
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "Shutting down");
        }

        scheduler.shutdownNow();
        logger.info("🔌 Bybit trade WebSocket disconnected");
    }
}
