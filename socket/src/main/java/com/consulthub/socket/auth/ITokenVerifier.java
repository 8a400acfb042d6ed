package com.consulthub.socket.auth;

import reactor.core.publisher.Mono;

/**
 * Boundary to the identity-verification service.
 * <p>
 * The hub never inspects credentials itself; it only receives the user id this returns.
 * </p>
 */
public interface ITokenVerifier {

    /**
     * Validates a bearer credential.
     *
     * @param token Raw bearer token
     * @return Mono of the authenticated user id, or empty/error if the token is not valid
     */
    Mono<String> verify(String token);
}
