package com.scalper.telegram.commands;

import com.scalper.core.position.PositionMessages;
import com.scalper.telegram.TelegramCommand;
import com.scalper.telegram.TelegramCommandContext;

/**
 * Reports the current position and its unrealized profit.
 */
public class StatusCommand implements TelegramCommand {

    @Override
    public String getCommandName() {
        return "status";
    }

    @Override
    public void execute(String args, TelegramCommandContext context) {
        context.reply(PositionMessages.status(context.lifecycle().status()));
    }

    @Override
    public String getHelpText() {
        return "/status - check the current position";
    }
}
