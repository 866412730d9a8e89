package com.scalper.core.market;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

@DisplayName("QuoteCache Tests")
class QuoteCacheTest {

    private QuoteCache cache;

    @BeforeEach
    void setUp() {
        cache = new QuoteCache("BTCUSDT");
    }

    @Nested
    @DisplayName("Updates")
    class UpdateTests {

        @Test
        @DisplayName("Should be empty before the first update")
        void shouldBeEmptyInitially() {
            assertThat(cache.read()).isEmpty();
        }

        @ParameterizedTest
        @DisplayName("Should return exactly the last valid pair")
        @CsvSource({
            "100.0, 101.0",
            "0.00001, 0.00002",
            "64250.5, 64251.0"
        })
        void shouldReturnLastValidPair(double bid, double ask) {
            assertThat(cache.update(bid, ask)).isTrue();

            Quote quote = cache.read().orElseThrow();
            assertThat(quote.bid()).isEqualTo(bid);
            assertThat(quote.ask()).isEqualTo(ask);
        }

        @Test
        @DisplayName("Latest update wins")
        void latestUpdateWins() {
            cache.update(100.0, 101.0);
            cache.update(103.0, 104.0);

            assertThat(cache.read().orElseThrow())
                .extracting(Quote::bid, Quote::ask)
                .containsExactly(103.0, 104.0);
        }

        @Test
        @DisplayName("Missing bid or ask should leave the previous quote unchanged")
        void missingSideKeepsPreviousQuote() {
            cache.update(100.0, 101.0);

            assertThat(cache.update(null, 102.0)).isFalse();
            assertThat(cache.update(99.0, null)).isFalse();

            assertThat(cache.read().orElseThrow())
                .extracting(Quote::bid, Quote::ask)
                .containsExactly(100.0, 101.0);
        }

        @ParameterizedTest
        @DisplayName("Non-positive values should be discarded")
        @CsvSource({
            "0.0, 101.0",
            "-1.0, 101.0",
            "100.0, 0.0",
            "100.0, -5.0",
            "NaN, 101.0"
        })
        void nonPositiveValuesAreDiscarded(double bid, double ask) {
            cache.update(100.0, 101.0);

            assertThat(cache.update(bid, ask)).isFalse();
            assertThat(cache.read().orElseThrow().bid()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Invalid first update should leave cache unset")
        void invalidFirstUpdateLeavesCacheUnset() {
            cache.update(0.0, 0.0);
            assertThat(cache.read()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Waiters")
    class WaiterTests {

        @Test
        @DisplayName("Pending waiters should be completed by the next valid quote")
        void waitersCompletedByNextQuote() {
            CompletableFuture<Quote> first = cache.awaitNextQuote();
            CompletableFuture<Quote> second = cache.awaitNextQuote();

            cache.update(100.0, 101.0);

            assertThat(first).isCompleted();
            assertThat(second).isCompleted();
            assertThat(first.join().ask()).isEqualTo(101.0);
        }

        @Test
        @DisplayName("Discarded quotes should not wake waiters")
        void discardedQuotesDoNotWake() {
            CompletableFuture<Quote> waiter = cache.awaitNextQuote();

            cache.update(null, 101.0);

            assertThat(waiter).isNotDone();
        }

        @Test
        @DisplayName("Satisfied waiters are not re-delivered; new waiters need a new quote")
        void waiterOnlyCompletedOnce() {
            CompletableFuture<Quote> early = cache.awaitNextQuote();
            cache.update(100.0, 101.0);

            CompletableFuture<Quote> late = cache.awaitNextQuote();
            assertThat(late).isNotDone();

            cache.update(103.0, 104.0);

            assertThat(early.join().bid()).isEqualTo(100.0);
            assertThat(late.join().bid()).isEqualTo(103.0);
        }

        @Test
        @DisplayName("Cancelled waiter should be ignored by later updates")
        void cancelledWaiterIgnored() {
            CompletableFuture<Quote> waiter = cache.awaitNextQuote();
            waiter.cancel(false);

            assertThatCode(() -> cache.update(100.0, 101.0)).doesNotThrowAnyException();
            assertThat(waiter).isCancelled();
        }
    }
}
