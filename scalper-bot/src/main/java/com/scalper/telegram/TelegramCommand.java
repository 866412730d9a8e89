package com.scalper.telegram;

/**
 * Handler for one slash command.
 */
public interface TelegramCommand {

    /**
     * Command name without the leading slash.
     */
    String getCommandName();

    void execute(String args, TelegramCommandContext context);

    String getHelpText();
}
