package com.scalper.telegram;

/**
 * Text message received by the bot.
 */
public record TelegramUpdate(long updateId, String chatId, String text) {
}
