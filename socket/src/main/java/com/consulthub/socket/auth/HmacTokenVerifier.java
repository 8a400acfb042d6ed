package com.consulthub.socket.auth;

import com.consulthub.core.auth.AccessToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Verifies {@link AccessToken}s signed with a shared secret.
 */
public class HmacTokenVerifier implements ITokenVerifier {
    private static final Logger log = LoggerFactory.getLogger(HmacTokenVerifier.class);

    private final String secret;
    private final Clock clock;

    public HmacTokenVerifier(String secret) {
        this(secret, Clock.systemUTC());
    }

    public HmacTokenVerifier(String secret, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Token secret must be set");
        }
        this.secret = secret;
        this.clock = clock;
    }

    @Override
    public Mono<String> verify(String token) {
        return Mono.fromSupplier(() -> {
            String userId = AccessToken.verify(token, secret, clock.instant());
            if (userId == null) {
                log.debug("Rejected access token (bad signature, format or expiry)");
            }
            return userId;
        });
    }
}
