package com.consulthub.core.auth;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;

/**
 * Signed bearer tokens carrying an authenticated user id.
 * <p>
 * <b>Token format:</b> base64url of {@code userId:expiresAt:hmac}
 * <ul>
 *   <li>{@code userId}: User identifier (must not contain {@code ':'})</li>
 *   <li>{@code expiresAt}: Expiry (epoch seconds)</li>
 *   <li>{@code hmac}: HMAC-SHA256 signature over "userId:expiresAt", hex encoded</li>
 * </ul>
 * </p>
 */
public final class AccessToken {
    private static final String DELIMITER = ":";

    private AccessToken() {
    }

    /**
     * Issues a token.
     *
     * @param userId    User identifier
     * @param expiresAt Expiry instant
     * @param secret    HMAC secret key
     * @return Base64url-encoded token
     */
    public static String issue(String userId, Instant expiresAt, String secret) {
        if (userId == null || userId.isEmpty() || userId.contains(DELIMITER)) {
            throw new IllegalArgumentException("Invalid user id for token: " + userId);
        }
        String payload = userId + DELIMITER + expiresAt.getEpochSecond();
        String token = payload + DELIMITER + sign(payload, secret);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Verifies a token's signature and expiry.
     *
     * @param token  Base64url-encoded token
     * @param secret HMAC secret key
     * @param now    Current instant
     * @return User id, or null if the token is malformed, forged or expired
     */
    public static String verify(String token, String secret, Instant now) {
        if (token == null || token.isBlank()) {
            return null;
        }

        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null; // Not base64url
        }

        String[] parts = decoded.split(DELIMITER);
        if (parts.length != 3 || parts[0].isEmpty()) {
            return null;
        }

        long expiresAt;
        try {
            expiresAt = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return null;
        }

        String expected = sign(parts[0] + DELIMITER + parts[1], secret);
        if (!MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8), parts[2].getBytes(StandardCharsets.UTF_8))) {
            return null;
        }

        if (now.getEpochSecond() >= expiresAt) {
            return null;
        }

        return parts[0];
    }

    private static String sign(String payload, String secret) {
        HashFunction hmac = Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8));
        return hmac.hashString(payload, StandardCharsets.UTF_8).toString();
    }
}
