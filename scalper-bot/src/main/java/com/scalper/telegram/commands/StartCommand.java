package com.scalper.telegram.commands;

import com.scalper.telegram.TelegramCommand;
import com.scalper.telegram.TelegramCommandContext;

/**
 * Greets the operator and lists the available commands.
 */
public class StartCommand implements TelegramCommand {

    @Override
    public String getCommandName() {
        return "start";
    }

    @Override
    public void execute(String args, TelegramCommandContext context) {
        context.reply("👋 Hello! I am a trading bot for Bybit.\n"
            + "Available commands:\n"
            + context.helpText());
    }

    @Override
    public String getHelpText() {
        return "/start - show this help";
    }
}
