package com.scalper.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scalper.core.market.Quote;
import com.scalper.core.market.QuoteCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.net.http.WebSocket;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

@DisplayName("BybitOrderbookStream Tests")
class BybitOrderbookStreamTest {

    private static final String SNAPSHOT = """
        {"topic":"orderbook.1.BTCUSDT","ts":1700000000000,"type":"snapshot",
         "data":{"s":"BTCUSDT","b":[["64250.5","1.2"]],"a":[["64251.0","0.8"]],"u":1,"seq":10},
         "cts":1700000000000}
        """;

    private QuoteCache cache;
    private BybitOrderbookStream stream;

    @BeforeEach
    void setUp() {
        cache = new QuoteCache("BTCUSDT");
        stream = new BybitOrderbookStream("wss://localhost/v5/public/spot", "BTCUSDT", 1, cache);
    }

    @AfterEach
    void tearDown() {
        stream.disconnect();
    }

    @Nested
    @DisplayName("Orderbook messages")
    class OrderbookMessageTests {

        @Test
        @DisplayName("Snapshot should update the cache with best bid and ask")
        void snapshotUpdatesCache() {
            stream.handleMessage(SNAPSHOT);

            Quote quote = cache.read().orElseThrow();
            assertThat(quote.bid()).isEqualTo(64250.5);
            assertThat(quote.ask()).isEqualTo(64251.0);
        }

        @Test
        @DisplayName("Message with an empty side should be discarded")
        void emptySideDiscarded() {
            stream.handleMessage(SNAPSHOT);

            stream.handleMessage("""
                {"topic":"orderbook.1.BTCUSDT","type":"snapshot",
                 "data":{"s":"BTCUSDT","b":[["64300.0","1.0"]],"a":[]}}
                """);

            assertThat(cache.read().orElseThrow().bid()).isEqualTo(64250.5);
        }

        @Test
        @DisplayName("Delta before the first snapshot should be ignored")
        void deltaBeforeSnapshotIgnored() {
            stream.handleMessage("""
                {"topic":"orderbook.1.BTCUSDT","type":"delta",
                 "data":{"s":"BTCUSDT","b":[["64250.5","1.0"]],"a":[["64251.0","0.8"]]}}
                """);

            assertThat(cache.read()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Deep orderbook")
    class DeepOrderbookTests {

        private static final String DEEP_SNAPSHOT = """
            {"topic":"orderbook.50.BTCUSDT","type":"snapshot",
             "data":{"s":"BTCUSDT","b":[["100","1"],["99","2"]],"a":[["101","1"],["102","2"]],"u":1}}
            """;

        private BybitOrderbookStream deep;

        @BeforeEach
        void setUp() {
            deep = new BybitOrderbookStream("wss://localhost/v5/public/spot", "BTCUSDT", 50, cache);
            deep.handleMessage(DEEP_SNAPSHOT);
        }

        @AfterEach
        void tearDown() {
            deep.disconnect();
        }

        @Test
        @DisplayName("Delta on deeper levels should keep the real top of book")
        void deeperDeltaKeepsTop() {
            deep.handleMessage("""
                {"topic":"orderbook.50.BTCUSDT","type":"delta",
                 "data":{"s":"BTCUSDT","b":[["99","5"]],"a":[["102","3"]],"u":2}}
                """);

            Quote quote = cache.read().orElseThrow();
            assertThat(quote.bid()).isEqualTo(100.0);
            assertThat(quote.ask()).isEqualTo(101.0);
        }

        @Test
        @DisplayName("Zero size should remove the level and expose the next one")
        void zeroSizeRemovesLevel() {
            deep.handleMessage("""
                {"topic":"orderbook.50.BTCUSDT","type":"delta",
                 "data":{"s":"BTCUSDT","b":[["100","0"]],"a":[],"u":2}}
                """);

            Quote quote = cache.read().orElseThrow();
            assertThat(quote.bid()).isEqualTo(99.0);
            assertThat(quote.ask()).isEqualTo(101.0);
        }

        @Test
        @DisplayName("Delta improving the best price should become the new top")
        void betterPriceBecomesTop() {
            deep.handleMessage("""
                {"topic":"orderbook.50.BTCUSDT","type":"delta",
                 "data":{"s":"BTCUSDT","b":[["100.5","0.3"]],"a":[["100.8","0.4"]],"u":2}}
                """);

            Quote quote = cache.read().orElseThrow();
            assertThat(quote.bid()).isEqualTo(100.5);
            assertThat(quote.ask()).isEqualTo(100.8);
        }

        @Test
        @DisplayName("Emptied side should be discarded and keep the previous quote")
        void emptiedSideKeepsPreviousQuote() {
            deep.handleMessage("""
                {"topic":"orderbook.50.BTCUSDT","type":"delta",
                 "data":{"s":"BTCUSDT","b":[],"a":[["101","0"],["102","0"]],"u":2}}
                """);

            Quote quote = cache.read().orElseThrow();
            assertThat(quote.bid()).isEqualTo(100.0);
            assertThat(quote.ask()).isEqualTo(101.0);
        }

        @Test
        @DisplayName("New snapshot should replace the whole book")
        void snapshotResetsBook() {
            deep.handleMessage("""
                {"topic":"orderbook.50.BTCUSDT","type":"snapshot",
                 "data":{"s":"BTCUSDT","b":[["90","1"]],"a":[["91","1"]],"u":1}}
                """);

            Quote quote = cache.read().orElseThrow();
            assertThat(quote.bid()).isEqualTo(90.0);
            assertThat(quote.ask()).isEqualTo(91.0);
        }
    }

    @Nested
    @DisplayName("Topic filtering")
    class TopicTests {

        @Test
        @DisplayName("Messages for other topics should be ignored")
        void otherTopicIgnored() {
            stream.handleMessage(SNAPSHOT.replace("orderbook.1.BTCUSDT", "orderbook.1.ETHUSDT"));

            assertThat(cache.read()).isEmpty();
        }
    }

    @ParameterizedTest
    @DisplayName("Control and malformed messages should not touch the cache")
    @ValueSource(strings = {
        "{\"success\":true,\"ret_msg\":\"\",\"op\":\"subscribe\",\"conn_id\":\"c1\"}",
        "{\"success\":true,\"ret_msg\":\"pong\",\"op\":\"ping\"}",
        "{\"success\":false,\"ret_msg\":\"Invalid topic\",\"op\":\"subscribe\"}",
        "not json at all"
    })
    void controlMessagesIgnored(String message) {
        assertThatCode(() -> stream.handleMessage(message)).doesNotThrowAnyException();
        assertThat(cache.read()).isEmpty();
    }

    @Test
    @DisplayName("Subscribe should request the configured orderbook topic")
    void subscribeSendsTopic() throws Exception {
        WebSocket ws = mock(WebSocket.class);
        BybitOrderbookStream deep = new BybitOrderbookStream("wss://localhost", "ETHUSDT", 50, cache);
        try {
            deep.subscribe(ws);

            ArgumentCaptor<CharSequence> captor = ArgumentCaptor.forClass(CharSequence.class);
            verify(ws).sendText(captor.capture(), anyBoolean());

            JsonNode sent = new ObjectMapper().readTree(captor.getValue().toString());
            assertThat(sent.path("op").asText()).isEqualTo("subscribe");
            assertThat(sent.path("args").get(0).asText()).isEqualTo("orderbook.50.ETHUSDT");
        } finally {
            deep.disconnect();
        }
    }

    @Test
    @DisplayName("Fragmented frames should be reassembled before parsing")
    void fragmentedFrames() {
        WebSocket ws = mock(WebSocket.class);
        int split = SNAPSHOT.length() / 2;

        stream.onText(ws, SNAPSHOT.substring(0, split), false);
        assertThat(cache.read()).isEmpty();

        stream.onText(ws, SNAPSHOT.substring(split), true);
        assertThat(cache.read()).isPresent();
        verify(ws, times(2)).request(1);
    }
}
