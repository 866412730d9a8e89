package com.scalper.core.position;

import java.util.Locale;

/**
 * Operator-facing texts for position events.
 */
public final class PositionMessages {

    private PositionMessages() {
    }

    public static String opened(Position position) {
        return String.format(Locale.US, "✅ Position opened!\n" +
            "Trading Pair: %s\n" +
            "Entry Price: %.2f\n" +
            "Target Price: %.2f",
            position.symbol(), position.entryPrice(), position.targetPrice());
    }

    public static String closed(Position position, double exitPrice, double profitPercent) {
        return String.format(Locale.US, "✅ Position closed!\n" +
            "Trading Pair: %s\n" +
            "Profit Percentage: %.2f%%\n" +
            "Entry Price: %s\n" +
            "Target Price: %s\n" +
            "Exit Price: %s",
            position.symbol(), profitPercent, position.entryPrice(), position.targetPrice(), exitPrice);
    }

    public static String status(PositionStatus status) {
        return switch (status.state()) {
            case IDLE -> "⚠️ No open position";
            case OPENING -> "⏳ Position is being opened, waiting for order confirmation";
            case CLOSING -> "⏳ Position is being closed, waiting for order confirmation";
            case OPEN -> openStatus(status);
        };
    }

    private static String openStatus(PositionStatus status) {
        Position position = status.position();
        if (status.currentBid() == null) {
            return "❌ Cannot get current price";
        }
        return String.format(Locale.US, "📊 Current position:\n" +
            "Trading Pair: %s\n" +
            "Entry Price: %s\n" +
            "Target Price: %s\n" +
            "Current Price: %s\n" +
            "Profit: %.2f%%",
            position.symbol(), position.entryPrice(), position.targetPrice(),
            status.currentBid(), status.unrealizedProfitPercent());
    }
}
