package com.scalper.telegram;

import com.scalper.core.position.PositionLifecycleManager;

import java.util.function.Consumer;

/**
 * What a command can reach: the position lifecycle, a reply channel to the
 * chat that sent it, and the help text of all registered commands.
 */
public record TelegramCommandContext(
    PositionLifecycleManager lifecycle,
    Consumer<String> reply,
    String helpText
) {
    public void reply(String text) {
        reply.accept(text);
    }
}
