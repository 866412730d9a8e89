package com.scalper.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin client for the Telegram Bot HTTP API.
 * Every call goes through a Resilience4j retry; only transient failures are retried.
 */
public class TelegramApi {
    private static final Logger logger = LoggerFactory.getLogger(TelegramApi.class);
    private static final String BASE_URL = "https://api.telegram.org/bot";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String baseUrl;
    private final HttpClient httpClient;
    private final Retry retry;

    public TelegramApi(String botToken) {
        this(BASE_URL + botToken,
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
            Retry.of("telegram-api", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                .retryOnException(TelegramApi::isRetryable)
                .build()));
    }

    TelegramApi(String baseUrl, HttpClient httpClient, Retry retry) {
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
        this.retry = retry;
        retry.getEventPublisher()
            .onRetry(event -> logger.warn("Telegram call retry #{}: {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    static boolean isRetryable(Throwable e) {
        return e instanceof TelegramApiException apiException && apiException.isRetryable();
    }

    public void sendMessage(String chatId, String text) {
        String body = toJson(Map.of("chat_id", chatId, "text", text));
        execute(() -> call("sendMessage", body, Duration.ofSeconds(15)));
        logger.debug("Telegram message sent to {}", chatId);
    }

    /**
     * Long-poll for new messages.
     *
     * @param offset         first update id to return
     * @param timeoutSeconds how long Telegram may hold the request open
     */
    public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) {
        String body = toJson(Map.of(
            "offset", offset,
            "timeout", timeoutSeconds,
            "allowed_updates", List.of("message")
        ));
        JsonNode result = execute(() -> call("getUpdates", body, Duration.ofSeconds(timeoutSeconds + 10L)));

        List<TelegramUpdate> updates = new ArrayList<>();
        for (JsonNode update : result) {
            JsonNode message = update.path("message");
            updates.add(new TelegramUpdate(
                update.path("update_id").asLong(),
                message.path("chat").path("id").asText(null),
                message.path("text").asText(null)
            ));
        }
        return updates;
    }

    private JsonNode execute(Supplier<JsonNode> call) {
        return Retry.decorateSupplier(retry, call).get();
    }

    private JsonNode call(String method, String body, Duration timeout) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/" + method))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TelegramApiException(method + " failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelegramApiException(method + " interrupted", e, false);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TelegramApiException(method + " returned HTTP " + status, true);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new TelegramApiException(method + " returned invalid JSON", e, false);
        }
        if (status != 200 || !root.path("ok").asBoolean(false)) {
            throw new TelegramApiException(method + " returned HTTP " + status + ": "
                + root.path("description").asText("no description"), false);
        }
        return root.path("result");
    }

    private String toJson(Map<String, ?> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (IOException e) {
            throw new TelegramApiException("Failed to serialize request", e, false);
        }
    }
}
