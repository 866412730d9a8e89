package com.scalper.core.position;

/**
 * Position lifecycle. IDLE is both the initial state and the end of every cycle.
 */
public enum PositionState {
    IDLE,       // No position
    OPENING,    // Buy sent, awaiting confirmation
    OPEN,       // Position held, monitoring for target
    CLOSING;    // Sell sent, awaiting confirmation

    public boolean canTransitionTo(PositionState target) {
        if (target == null) return false;

        return switch (this) {
            case IDLE -> target == OPENING;
            case OPENING -> target == OPEN || target == IDLE;
            case OPEN -> target == CLOSING;
            case CLOSING -> target == IDLE || target == OPEN;
        };
    }

    public boolean hasActivePosition() {
        return this != IDLE;
    }
}
