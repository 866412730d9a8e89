package com.scalper.config;

import com.scalper.core.position.TradingParameters;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for the bot.
 * Loads from environment variables first, then config.properties in the working directory.
 * All values are fixed for the lifetime of the process.
 */
public final class BotConfig {
    private static final Logger logger = LoggerFactory.getLogger(BotConfig.class);
    private static final String CONFIG_FILE = "config.properties";

    @NotBlank(message = "API_KEY is required")
    private final String apiKey;

    @NotBlank(message = "API_SECRET is required")
    private final String apiSecret;

    @NotBlank(message = "TELEGRAM_TOKEN is required")
    private final String telegramToken;

    @NotBlank(message = "TELEGRAM_CHAT_ID is required")
    private final String telegramChatId;

    @NotBlank(message = "SYMBOL is required")
    @Pattern(regexp = "^[A-Z0-9]+$", message = "SYMBOL must look like BTCUSDT")
    private final String symbol;

    @DecimalMin(value = "0.0", inclusive = false, message = "TARGET_PROFIT_PERCENT must be positive")
    private final double targetProfitPercent;

    @DecimalMin(value = "0.0", inclusive = false, message = "AMOUNT must be positive")
    private final double amount;

    private final boolean testnet;

    @Positive(message = "OPEN_ORDER_TIMEOUT_MS must be positive")
    private final long openOrderTimeoutMs;

    @Positive(message = "CLOSE_ORDER_TIMEOUT_MS must be positive")
    private final long closeOrderTimeoutMs;

    @Positive(message = "MONITOR_INTERVAL_MS must be positive")
    private final long monitorIntervalMs;

    @Min(value = 0, message = "QUOTE_WAIT_MS must not be negative")
    private final long quoteWaitMs;

    @Min(value = 1, message = "ORDERBOOK_DEPTH must be at least 1")
    @Max(value = 1000, message = "ORDERBOOK_DEPTH must be at most 1000")
    private final int orderbookDepth;

    @Positive(message = "BYBIT_RECV_WINDOW_MS must be positive")
    private final long recvWindowMs;

    private final Map<String, String> env;
    private final Properties properties;

    public BotConfig() {
        this(System.getenv(), loadProperties());
    }

    BotConfig(Map<String, String> env, Properties properties) {
        this.env = env;
        this.properties = properties;

        this.apiKey = getProperty("API_KEY");
        this.apiSecret = getProperty("API_SECRET");
        this.telegramToken = getProperty("TELEGRAM_TOKEN");
        this.telegramChatId = getProperty("TELEGRAM_CHAT_ID");
        this.symbol = Optional.ofNullable(getProperty("SYMBOL")).map(String::toUpperCase).orElse(null);
        this.targetProfitPercent = getDoubleProperty("TARGET_PROFIT_PERCENT", 0);
        this.amount = getDoubleProperty("AMOUNT", 0);
        this.testnet = Boolean.parseBoolean(getProperty("BYBIT_TESTNET", "true"));
        this.openOrderTimeoutMs = getLongProperty("OPEN_ORDER_TIMEOUT_MS", 2000);
        this.closeOrderTimeoutMs = getLongProperty("CLOSE_ORDER_TIMEOUT_MS", 10000);
        this.monitorIntervalMs = getLongProperty("MONITOR_INTERVAL_MS", 100);
        this.quoteWaitMs = getLongProperty("QUOTE_WAIT_MS", 1000);
        this.orderbookDepth = (int) getLongProperty("ORDERBOOK_DEPTH", 1);
        this.recvWindowMs = getLongProperty("BYBIT_RECV_WINDOW_MS", 8000);

        validate();
        logger.info("Configuration loaded: symbol={}, amount={}, target={}%, testnet={}",
            symbol, amount, targetProfitPercent, testnet);
    }

    private static Properties loadProperties() {
        var props = new Properties();
        try (var fis = new FileInputStream(CONFIG_FILE)) {
            props.load(fis);
            logger.debug("Loaded properties from {}", CONFIG_FILE);
        } catch (IOException e) {
            logger.debug("No config.properties found");
        }
        return props;
    }

    /**
     * Validate configuration using Bean Validation.
     * Throws IllegalStateException if validation fails.
     */
    private void validate() {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            var violations = validator.validate(this);

            if (!violations.isEmpty()) {
                var errorMessages = violations.stream()
                    .map(v -> v.getMessage())
                    .sorted()
                    .toList();

                throw new IllegalStateException(
                    "Configuration validation failed: " + String.join(", ", errorMessages)
                );
            }
        }
    }

    public TradingParameters tradingParameters() {
        return new TradingParameters(
            symbol,
            amount,
            targetProfitPercent,
            Duration.ofMillis(openOrderTimeoutMs),
            Duration.ofMillis(closeOrderTimeoutMs),
            Duration.ofMillis(monitorIntervalMs),
            Duration.ofMillis(quoteWaitMs)
        );
    }

    // ==================== Bybit ====================

    public String apiKey() {
        return apiKey;
    }

    public String apiSecret() {
        return apiSecret;
    }

    public boolean isTestnet() {
        return testnet;
    }

    public String publicStreamUrl() {
        return testnet
            ? "wss://stream-testnet.bybit.com/v5/public/spot"
            : "wss://stream.bybit.com/v5/public/spot";
    }

    public String tradeStreamUrl() {
        return testnet
            ? "wss://stream-testnet.bybit.com/v5/trade"
            : "wss://stream.bybit.com/v5/trade";
    }

    public int orderbookDepth() {
        return orderbookDepth;
    }

    public long recvWindowMs() {
        return recvWindowMs;
    }

    // ==================== Trading ====================

    public String symbol() {
        return symbol;
    }

    public double amount() {
        return amount;
    }

    public double targetProfitPercent() {
        return targetProfitPercent;
    }

    // ==================== Telegram ====================

    public String telegramToken() {
        return telegramToken;
    }

    public String telegramChatId() {
        return telegramChatId;
    }

    private String getProperty(String key) {
        return Optional.ofNullable(env.get(key))
                .or(() -> Optional.ofNullable(properties.getProperty(key)))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .orElse(null);
    }

    private String getProperty(String key, String defaultValue) {
        return Optional.ofNullable(getProperty(key)).orElse(defaultValue);
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " is not a number: " + value, e);
        }
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " is not an integer: " + value, e);
        }
    }
}
