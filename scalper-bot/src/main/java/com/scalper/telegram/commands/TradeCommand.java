package com.scalper.telegram.commands;

import com.scalper.core.position.PositionMessages;
import com.scalper.core.position.TradeResult;
import com.scalper.telegram.TelegramCommand;
import com.scalper.telegram.TelegramCommandContext;

/**
 * Opens a new position at the current best ask.
 */
public class TradeCommand implements TelegramCommand {

    @Override
    public String getCommandName() {
        return "trade";
    }

    @Override
    public void execute(String args, TelegramCommandContext context) {
        if (context.lifecycle().state().hasActivePosition()) {
            context.reply("⚠️ A position is already open");
            return;
        }

        context.reply("⏳ Opening a position, please wait...");
        TradeResult result = context.lifecycle().open();
        if (result.success()) {
            context.reply(PositionMessages.opened(result.position()));
        } else {
            context.reply("❌ Could not open the position\n" + result.message());
        }
    }

    @Override
    public String getHelpText() {
        return "/trade - open a new position";
    }
}
