package com.scalper.telegram;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TelegramApi Tests")
class TelegramApiTest {

    private static final String OK_EMPTY = "{\"ok\":true,\"result\":[]}";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private TelegramApi api;

    @BeforeEach
    void setUp() {
        Retry retry = Retry.of("test", RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(10))
            .retryOnException(TelegramApi::isRetryable)
            .build());
        api = new TelegramApi("https://api.telegram.org/botTOKEN", httpClient, retry);
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
    }

    @Test
    @DisplayName("sendMessage should POST to the bot's sendMessage method")
    void sendMessagePosts() throws Exception {
        respond(200, "{\"ok\":true,\"result\":{\"message_id\":1}}");

        api.sendMessage("42", "hello");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        assertThat(captor.getValue().method()).isEqualTo("POST");
        assertThat(captor.getValue().uri().toString())
            .isEqualTo("https://api.telegram.org/botTOKEN/sendMessage");
    }

    @Test
    @DisplayName("getUpdates should parse update id, chat and text")
    void getUpdatesParses() throws Exception {
        respond(200, """
            {"ok":true,"result":[
              {"update_id":100,"message":{"message_id":5,"chat":{"id":42,"type":"private"},"text":"/trade"}},
              {"update_id":101,"message":{"message_id":6,"chat":{"id":-7},"sticker":{}}}
            ]}
            """);

        List<TelegramUpdate> updates = api.getUpdates(0, 30);

        assertThat(updates).containsExactly(
            new TelegramUpdate(100, "42", "/trade"),
            new TelegramUpdate(101, "-7", null));
    }

    @Test
    @DisplayName("Server errors should be retried")
    void serverErrorRetried() throws Exception {
        when(response.statusCode()).thenReturn(502, 200);
        when(response.body()).thenReturn(OK_EMPTY);
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);

        assertThat(api.getUpdates(0, 30)).isEmpty();

        verify(httpClient, times(2)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    @DisplayName("Network failures should be retried up to the attempt limit")
    void networkFailureExhaustsRetries() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
            .thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> api.sendMessage("42", "hello"))
            .isInstanceOf(TelegramApiException.class)
            .hasMessageContaining("connection reset");

        verify(httpClient, times(3)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }

    @Test
    @DisplayName("Client errors should fail without retry")
    void clientErrorNotRetried() throws Exception {
        respond(400, "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: chat not found\"}");

        assertThatThrownBy(() -> api.sendMessage("0", "hello"))
            .isInstanceOf(TelegramApiException.class)
            .hasMessageContaining("chat not found");

        verify(httpClient, times(1)).send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class));
    }
}
