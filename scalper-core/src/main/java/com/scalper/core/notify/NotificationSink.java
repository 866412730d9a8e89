package com.scalper.core.notify;

/**
 * Operator channel for human-readable status text.
 * Fire-and-forget: implementations log delivery failures and never throw.
 */
public interface NotificationSink {

    void notify(String text);
}
