package com.scalper.core.position;

/**
 * Read-only view returned by {@link PositionLifecycleManager#status()}.
 * {@code currentBid} and {@code unrealizedProfitPercent} are null when no bid is cached.
 */
public record PositionStatus(
    PositionState state,
    Position position,
    Double currentBid,
    Double unrealizedProfitPercent
) {
    public static PositionStatus idle() {
        return new PositionStatus(PositionState.IDLE, null, null, null);
    }

    public boolean hasPosition() {
        return position != null;
    }
}
