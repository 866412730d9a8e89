package com.scalper.notifications;

import com.scalper.core.notify.NotificationSink;
import com.scalper.telegram.TelegramApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Telegram bot notification service.
 * Messages are delivered on a background thread; failures are logged and dropped.
 */
public final class TelegramNotifier implements NotificationSink {
    private static final Logger logger = LoggerFactory.getLogger(TelegramNotifier.class);

    private final TelegramApi api;
    private final String chatId;
    private final Executor executor;
    private final boolean enabled;

    public TelegramNotifier(TelegramApi api, String chatId) {
        this(api, chatId, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "telegram-notifier");
            t.setDaemon(true);
            return t;
        }));
    }

    TelegramNotifier(TelegramApi api, String chatId, Executor executor) {
        this.api = api;
        this.chatId = chatId;
        this.executor = executor;
        this.enabled = api != null && chatId != null && !chatId.isBlank();

        if (enabled) {
            logger.info("Telegram notifications enabled");
        } else {
            logger.info("Telegram notifications disabled (missing config)");
        }
    }

    @Override
    public void notify(String text) {
        if (!enabled) {
            return;
        }
        try {
            executor.execute(() -> deliver(text));
        } catch (RuntimeException e) {
            logger.error("Error while queueing Telegram notification: {}", e.getMessage());
        }
    }

    private void deliver(String text) {
        try {
            api.sendMessage(chatId, text);
            logger.info("Sent notification to Telegram: {}", text.lines().findFirst().orElse(""));
        } catch (RuntimeException e) {
            logger.error("Error while sending notification to Telegram: {}", e.getMessage());
        }
    }

    boolean isEnabled() {
        return enabled;
    }

    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }
}
