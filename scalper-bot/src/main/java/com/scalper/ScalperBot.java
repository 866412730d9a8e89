package com.scalper;

import com.scalper.broker.BybitOrderbookStream;
import com.scalper.broker.BybitSigner;
import com.scalper.broker.BybitTradeWebSocketClient;
import com.scalper.config.BotConfig;
import com.scalper.core.execution.OrderExecutionCoordinator;
import com.scalper.core.market.QuoteCache;
import com.scalper.core.position.PositionLifecycleManager;
import com.scalper.core.position.TradingParameters;
import com.scalper.notifications.TelegramNotifier;
import com.scalper.telegram.TelegramApi;
import com.scalper.telegram.TelegramCommandPoller;
import com.scalper.telegram.commands.CloseCommand;
import com.scalper.telegram.commands.StartCommand;
import com.scalper.telegram.commands.StatusCommand;
import com.scalper.telegram.commands.TradeCommand;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point: wires the Bybit feed and gateway, the position lifecycle and the
 * Telegram front end, then blocks until the JVM is asked to stop.
 */
public final class ScalperBot {
    private static final Logger logger = LoggerFactory.getLogger(ScalperBot.class);
    private static final long GATEWAY_CONNECT_TIMEOUT_SEC = 15;

    private final BotConfig config;
    private final MeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private BybitOrderbookStream orderbookStream;
    private BybitTradeWebSocketClient tradeClient;
    private PositionLifecycleManager lifecycle;
    private TelegramNotifier notifier;
    private TelegramCommandPoller poller;

    ScalperBot(BotConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        logger.info("🚀 Starting Bybit scalper bot...");

        BotConfig config;
        try {
            config = new BotConfig();
        } catch (IllegalStateException e) {
            logger.error("❌ {}", e.getMessage());
            System.exit(1);
            return;
        }

        ScalperBot bot = new ScalperBot(config);
        Runtime.getRuntime().addShutdownHook(new Thread(bot::stop, "shutdown-hook"));
        bot.start();
        bot.awaitStop();
    }

    void start() {
        TradingParameters parameters = config.tradingParameters();

        QuoteCache quoteCache = new QuoteCache(parameters.symbol());
        orderbookStream = new BybitOrderbookStream(
            config.publicStreamUrl(), parameters.symbol(), config.orderbookDepth(), quoteCache);
        tradeClient = new BybitTradeWebSocketClient(
            config.tradeStreamUrl(), config.apiKey(), new BybitSigner(config.apiSecret()), config.recvWindowMs());

        TelegramApi telegramApi = new TelegramApi(config.telegramToken());
        notifier = new TelegramNotifier(telegramApi, config.telegramChatId());

        OrderExecutionCoordinator coordinator = new OrderExecutionCoordinator(tradeClient, meterRegistry);
        lifecycle = new PositionLifecycleManager(quoteCache, coordinator, notifier, parameters, meterRegistry);

        poller = new TelegramCommandPoller(telegramApi, config.telegramChatId(), lifecycle, List.of(
            new StartCommand(),
            new TradeCommand(),
            new StatusCommand(),
            new CloseCommand()
        ));

        orderbookStream.connect();
        try {
            tradeClient.connect().get(GATEWAY_CONNECT_TIMEOUT_SEC, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while connecting to the trade WebSocket");
        } catch (Exception e) {
            // Reconnect keeps running in the background; /trade fails fast until it succeeds
            logger.error("⚠️ Trade WebSocket not ready: {}", e.getMessage());
        }

        poller.start();
        logger.info("✅ Bot started: {} x{} target +{}% ({})",
            parameters.symbol(), parameters.quantity(), parameters.targetProfitPercent(),
            config.isTestnet() ? "testnet" : "MAINNET");
    }

    void awaitStop() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void stop() {
        if (stopped.getCount() == 0) {
            return;
        }
        logger.info("Shutdown signal received, stopping bot...");
        if (poller != null) {
            poller.stop();
        }
        if (lifecycle != null) {
            lifecycle.shutdown();
        }
        if (tradeClient != null) {
            tradeClient.disconnect();
        }
        if (orderbookStream != null) {
            orderbookStream.disconnect();
        }
        if (notifier != null) {
            notifier.shutdown();
        }
        logMetricsSummary();
        stopped.countDown();
    }

    void logMetricsSummary() {
        logger.info("📊 Session summary: orders placed={} failed={} positions opened={} closed={}",
            (long) count("scalper.orders.placed"),
            (long) count("scalper.orders.failed"),
            (long) count("scalper.positions.opened"),
            (long) count("scalper.positions.closed"));
    }

    private double count(String name) {
        return Search.in(meterRegistry).name(name).counters().stream()
            .mapToDouble(c -> c.count())
            .sum();
    }
}
