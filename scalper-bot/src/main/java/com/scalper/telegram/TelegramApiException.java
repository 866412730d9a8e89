package com.scalper.telegram;

/**
 * Failed call to the Telegram Bot API.
 */
public class TelegramApiException extends RuntimeException {
    private final boolean retryable;

    public TelegramApiException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public TelegramApiException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * True for network errors, rate limiting and server-side failures.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
