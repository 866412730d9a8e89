package com.scalper.telegram.commands;

import com.scalper.core.position.PositionMessages;
import com.scalper.core.position.PositionState;
import com.scalper.core.position.PositionStatus;
import com.scalper.core.position.TradeResult;
import com.scalper.telegram.TelegramCommand;
import com.scalper.telegram.TelegramCommandContext;

/**
 * Sells the open position at market without waiting for the target.
 * The closing summary itself arrives through the notification channel.
 */
public class CloseCommand implements TelegramCommand {

    @Override
    public String getCommandName() {
        return "close";
    }

    @Override
    public void execute(String args, TelegramCommandContext context) {
        PositionState state = context.lifecycle().state();
        if (state != PositionState.OPEN) {
            context.reply(PositionMessages.status(new PositionStatus(state, null, null, null)));
            return;
        }

        context.reply("⏳ Closing the position, please wait...");
        TradeResult result = context.lifecycle().close();
        if (!result.success()) {
            context.reply("❌ Could not close the position\n" + result.message());
        }
    }

    @Override
    public String getHelpText() {
        return "/close - close the position at market";
    }
}
