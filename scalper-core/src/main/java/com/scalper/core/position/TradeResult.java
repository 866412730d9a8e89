package com.scalper.core.position;

/**
 * Result of {@link PositionLifecycleManager#open()} or {@link PositionLifecycleManager#close()}.
 * On success {@code position} is the opened or just-closed position; on failure
 * {@code failure} and {@code reason} say why.
 */
public record TradeResult(
    boolean success,
    TradeFailure failure,
    String reason,
    Position position,
    Double exitPrice,
    Double profitPercent
) {
    public static TradeResult opened(Position position) {
        return new TradeResult(true, null, null, position, null, null);
    }

    public static TradeResult closed(Position position, double exitPrice, double profitPercent) {
        return new TradeResult(true, null, null, position, exitPrice, profitPercent);
    }

    public static TradeResult failed(TradeFailure failure, String reason) {
        return new TradeResult(false, failure, reason, null, null, null);
    }

    /**
     * Short operator-facing explanation.
     */
    public String message() {
        if (success) {
            return "OK";
        }
        return reason != null ? failure.description() + ": " + reason : failure.description();
    }
}
