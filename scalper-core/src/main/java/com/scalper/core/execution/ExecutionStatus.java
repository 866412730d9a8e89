package com.scalper.core.execution;

public enum ExecutionStatus {
    FILLED,
    REJECTED,
    TIMEOUT
}
