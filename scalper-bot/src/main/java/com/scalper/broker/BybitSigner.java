package com.scalper.broker;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signatures for Bybit WebSocket authentication.
 */
public final class BybitSigner {
    private static final String ALGORITHM = "HmacSHA256";

    private final String apiSecret;

    public BybitSigner(String apiSecret) {
        if (apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalArgumentException("API secret is required");
        }
        this.apiSecret = apiSecret;
    }

    /**
     * Signature for the {@code auth} operation: hex(HMAC_SHA256(secret, "GET/realtime" + expires)).
     */
    public String signAuth(long expires) {
        return sign("GET/realtime" + expires);
    }

    String sign(String payload) {
        try {
            Mac hmac = Mac.getInstance(ALGORITHM);
            hmac.init(new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = hmac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign Bybit payload", e);
        }
    }
}
