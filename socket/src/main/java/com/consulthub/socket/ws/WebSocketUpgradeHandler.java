package com.consulthub.socket.ws;

import com.consulthub.core.util.JsonUtils;
import com.consulthub.socket.auth.ITokenVerifier;
import com.consulthub.socket.config.SocketConfig;
import com.consulthub.socket.metrics.MetricsService;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Authenticates WebSocket upgrade requests before handing them to the connection actor.
 * <p>
 * Order of checks:
 * <ol>
 *   <li>Origin header against the {@link OriginPolicy} (403 on reject)</li>
 *   <li>Bearer credential from the {@code token} query parameter or the
 *       {@code Authorization: Bearer} header (401 if absent)</li>
 *   <li>Credential validation by the {@link ITokenVerifier} (401 if invalid)</li>
 * </ol>
 * Rejected requests never reach the hub.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    static final String TOKEN_PARAM = "token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final WebSocketHandler wsHandler;
    private final ITokenVerifier tokenVerifier;
    private final OriginPolicy originPolicy;
    private final MetricsService metricsService;
    private final WebsocketServerSpec websocketSpec;

    public WebSocketUpgradeHandler(
            SocketConfig config,
            WebSocketHandler wsHandler,
            ITokenVerifier tokenVerifier,
            OriginPolicy originPolicy,
            MetricsService metricsService
    ) {
        this.wsHandler = wsHandler;
        this.tokenVerifier = tokenVerifier;
        this.originPolicy = originPolicy;
        this.metricsService = metricsService;
        this.websocketSpec = WebsocketServerSpec.builder()
                .maxFramePayloadLength(config.getMaxFrameBytes())
                .build();
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        String origin = req.requestHeaders().get(HttpHeaderNames.ORIGIN);
        if (!originPolicy.isAllowed(origin)) {
            log.warn("WebSocket connection rejected from origin: {}", origin);
            metricsService.recordUpgradeRejected("origin");
            return reject(res, HttpResponseStatus.FORBIDDEN, "Origin not allowed");
        }

        Optional<String> token = extractToken(req);
        if (token.isEmpty()) {
            log.warn("WebSocket connection rejected: no authentication token provided");
            metricsService.recordUpgradeRejected("unauthorized");
            return reject(res, HttpResponseStatus.UNAUTHORIZED, "No authentication token provided");
        }

        return tokenVerifier.verify(token.get())
                .onErrorResume(err -> {
                    log.warn("WebSocket authentication failed: {}", err.getMessage());
                    return Mono.empty();
                })
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(userId -> {
                    if (userId.isEmpty()) {
                        metricsService.recordUpgradeRejected("unauthorized");
                        return reject(res, HttpResponseStatus.UNAUTHORIZED, "Invalid authentication token");
                    }
                    log.info("WebSocket authentication successful for user: {}", userId.get());
                    return res.sendWebsocket(
                            (inbound, outbound) -> wsHandler.handle(inbound, outbound, userId.get()),
                            websocketSpec
                    );
                });
    }

    static Optional<String> extractToken(HttpServerRequest req) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        Optional<String> fromQuery = Stream.ofNullable(decoder.parameters().get(TOKEN_PARAM))
                .flatMap(Collection::stream)
                .filter(value -> !value.isBlank())
                .findFirst();
        if (fromQuery.isPresent()) {
            return fromQuery;
        }

        String header = req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String token = header.startsWith(BEARER_PREFIX) ? header.substring(BEARER_PREFIX.length()) : header;
        return token.isBlank() ? Optional.empty() : Optional.of(token.trim());
    }

    private static Mono<Void> reject(HttpServerResponse res, HttpResponseStatus status, String error) {
        return res.status(status)
                .header(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .sendString(Mono.just(JsonUtils.writeValueAsString(Map.of("error", error))))
                .then();
    }
}
