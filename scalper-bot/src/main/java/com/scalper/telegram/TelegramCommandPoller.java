package com.scalper.telegram;

import com.scalper.core.position.PositionLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Telegram command bot with long-polling via getUpdates.
 *
 * Only messages from the configured chat are handled. Commands run on a small
 * worker pool so a slow /trade does not hold up /status.
 */
public class TelegramCommandPoller {
    private static final Logger logger = LoggerFactory.getLogger(TelegramCommandPoller.class);

    private static final int POLL_TIMEOUT_SECONDS = 30;
    private static final long ERROR_BACKOFF_MS = 1500;

    private final TelegramApi api;
    private final String chatId;
    private final PositionLifecycleManager lifecycle;
    private final Map<String, TelegramCommand> commands = new LinkedHashMap<>();
    private final String helpText;
    private final Executor commandExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread pollThread;
    private volatile long offset = 0;

    public TelegramCommandPoller(TelegramApi api,
                                 String chatId,
                                 PositionLifecycleManager lifecycle,
                                 List<TelegramCommand> commands) {
        this(api, chatId, lifecycle, commands, Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "telegram-command");
            t.setDaemon(true);
            return t;
        }));
    }

    TelegramCommandPoller(TelegramApi api,
                          String chatId,
                          PositionLifecycleManager lifecycle,
                          List<TelegramCommand> commands,
                          Executor commandExecutor) {
        this.api = api;
        this.chatId = chatId;
        this.lifecycle = lifecycle;
        this.commandExecutor = commandExecutor;
        for (TelegramCommand command : commands) {
            this.commands.put(command.getCommandName(), command);
        }
        this.helpText = commands.stream()
            .map(TelegramCommand::getHelpText)
            .collect(Collectors.joining("\n"));
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::pollLoop, "telegram-poller");
        thread.setDaemon(true);
        pollThread = thread;
        thread.start();
        logger.info("🤖 Telegram command poller started ({} commands)", commands.size());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = pollThread;
        if (thread != null) {
            thread.interrupt();
        }
        if (commandExecutor instanceof ExecutorService service) {
            service.shutdown();
        }
        logger.info("Telegram command poller stopped");
    }

    private void pollLoop() {
        while (running.get()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                if (!running.get()) {
                    break;
                }
                logger.error("Telegram poll error: {}", e.getMessage());
                try {
                    Thread.sleep(ERROR_BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * Fetch one batch of updates and dispatch them.
     */
    void pollOnce() {
        List<TelegramUpdate> updates = api.getUpdates(offset, POLL_TIMEOUT_SECONDS);
        for (TelegramUpdate update : updates) {
            offset = Math.max(offset, update.updateId() + 1);
            handleUpdate(update);
        }
    }

    void handleUpdate(TelegramUpdate update) {
        if (!chatId.equals(update.chatId())) {
            logger.warn("Ignoring message from unknown chat {}", update.chatId());
            return;
        }
        String text = update.text();
        if (text == null || !text.startsWith("/")) {
            return;
        }

        String[] parts = text.trim().split("\\s+", 2);
        String name = parts[0].substring(1);
        int botSuffix = name.indexOf('@');
        if (botSuffix >= 0) {
            name = name.substring(0, botSuffix);
        }
        name = name.toLowerCase(Locale.ROOT);
        String args = parts.length > 1 ? parts[1] : "";

        TelegramCommand command = commands.get(name);
        if (command == null) {
            logger.debug("Unknown command: /{}", name);
            return;
        }

        String commandName = name;
        commandExecutor.execute(() -> dispatch(command, commandName, args));
    }

    private void dispatch(TelegramCommand command, String name, String args) {
        logger.info("📩 Command /{} received", name);
        TelegramCommandContext context = new TelegramCommandContext(lifecycle, this::reply, helpText);
        try {
            command.execute(args, context);
        } catch (RuntimeException e) {
            logger.error("Error in /{} command: {}", name, e.getMessage(), e);
            reply("❌ An error occurred while processing /" + name);
        }
    }

    private void reply(String text) {
        try {
            api.sendMessage(chatId, text);
        } catch (RuntimeException e) {
            logger.error("Failed to send Telegram reply: {}", e.getMessage());
        }
    }

    long offset() {
        return offset;
    }
}
