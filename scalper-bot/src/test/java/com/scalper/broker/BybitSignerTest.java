package com.scalper.broker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BybitSigner Tests")
class BybitSignerTest {

    @Test
    @DisplayName("Should produce the standard HMAC-SHA256 hex digest")
    void knownVector() {
        BybitSigner signer = new BybitSigner("key");

        assertThat(signer.sign("The quick brown fox jumps over the lazy dog"))
            .isEqualTo("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8");
    }

    @Test
    @DisplayName("Auth signature should cover GET/realtime plus expiry")
    void authPayload() {
        BybitSigner signer = new BybitSigner("secret");

        assertThat(signer.signAuth(1700000000000L))
            .isEqualTo(signer.sign("GET/realtime1700000000000"))
            .hasSize(64)
            .matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("Blank secret should be rejected")
    void blankSecretRejected() {
        assertThatThrownBy(() -> new BybitSigner(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
