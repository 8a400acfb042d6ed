package com.consulthub.socket.ws;

import com.consulthub.core.msg.Envelope;
import com.consulthub.core.msg.EnvelopeCodec;
import com.consulthub.core.msg.MalformedEnvelopeException;
import com.consulthub.core.util.BytesUtils;
import com.consulthub.socket.config.SocketConfig;
import com.consulthub.socket.hub.IHub;
import com.consulthub.socket.metrics.MetricsService;
import com.consulthub.socket.metrics.MetricsService.EvictionReason;
import com.consulthub.socket.session.Connection;
import com.consulthub.socket.session.ConnectionFactory;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.WriteTimeoutException;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Connection actor: owns one WebSocket channel and runs its read and write loops.
 * <p>
 * Read loop (client → hub):
 * <ul>
 *   <li>decodes one envelope per UTF-8 text frame and stamps {@code user_id} from the authenticated
 *   identity; control frames are not decoded</li>
 *   <li>forwards it to {@link IHub#dispatch(Envelope)}, in frame order</li>
 *   <li>a malformed frame ends the loop and closes the connection</li>
 * </ul>
 * </p>
 * <p>
 * Write loop (hub → client): a single publisher that merges the drained outbound queue with a
 * periodic ping, so that only one writer ever touches the channel.
 * </p>
 * <p>
 * Liveness: any inbound frame, including the pong answering a ping, refreshes the idle-read
 * deadline; when it elapses the connection is closed. Writes are bounded by a write timeout.
 * Closing the {@link Connection} is the single signal that unwinds both loops; teardown is always
 * funneled through {@link IHub#unregister(Connection)} when the channel is disposed.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    static final String WRITE_TIMEOUT_HANDLER = "hub.writeTimeout";

    private final SocketConfig config;
    private final IHub hub;
    private final ConnectionFactory connectionFactory;
    private final MetricsService metricsService;

    public WebSocketHandler(
            SocketConfig config,
            IHub hub,
            ConnectionFactory connectionFactory,
            MetricsService metricsService
    ) {
        this.config = config;
        this.hub = hub;
        this.connectionFactory = connectionFactory;
        this.metricsService = metricsService;
    }

    /**
     * Handles the WebSocket lifecycle of one authenticated user.
     *
     * @param inbound  WebSocket inbound
     * @param outbound WebSocket outbound
     * @param userId   Authenticated user identifier
     * @return Publisher completing when the connection is finished
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, String userId) {
        Connection connection = connectionFactory.create(userId);

        ConnectionMdc.run(connection,
                () -> log.debug("WebSocket established for user {} (connection {})", userId, connection.getId()));

        bindChannelLifecycle(inbound, connection);

        return hub.register(connection)
                .flatMap(registered -> {
                    if (!registered) {
                        ConnectionMdc.run(connection, () -> log.warn("Registration refused for {}, closing", connection));
                        return outbound.sendClose();
                    }
                    return Mono.when(
                            writeLoop(outbound, connection),
                            readLoop(inbound, connection)
                    );
                })
                .onErrorResume(err -> {
                    ConnectionMdc.run(connection, () -> log.error("WebSocket error for {}", connection, err));
                    connection.close();
                    return outbound.sendClose();
                });
    }

    private void bindChannelLifecycle(WebsocketInbound inbound, Connection connection) {
        inbound.withConnection(channel -> {
            long writeTimeoutMillis = config.getWriteTimeout().toMillis();
            long idleTimeoutMillis = config.getIdleTimeout().toMillis();

            channel.addHandlerFirst(WRITE_TIMEOUT_HANDLER,
                            new WriteTimeoutHandler(writeTimeoutMillis, TimeUnit.MILLISECONDS))
                    .onReadIdle(idleTimeoutMillis, () -> {
                        if (!connection.isClosed()) {
                            ConnectionMdc.run(connection, () -> log.warn("No frame from {} within {} ms, closing",
                                    connection, idleTimeoutMillis));
                            metricsService.recordEviction(EvictionReason.IDLE_TIMEOUT);
                            connection.close();
                        }
                    })
                    .onDispose(() -> {
                        ConnectionMdc.run(connection, () -> log.debug("Channel disposed for {}, unregistering", connection));
                        connection.close();
                        hub.unregister(connection).subscribe(
                                removed -> ConnectionMdc.run(connection,
                                        () -> log.debug("Unregistered {} (was registered: {})", connection, removed)),
                                err -> ConnectionMdc.run(connection,
                                        () -> log.warn("Unregistration of {} failed: {}", connection, err.getMessage()))
                        );
                    });
        });
    }

    private Mono<Void> writeLoop(WebsocketOutbound outbound, Connection connection) {
        Duration pingInterval = config.getPingInterval();

        Flux<WebSocketFrame> envelopes = connection.outbound()
                .map(EnvelopeCodec::encode)
                .doOnNext(text -> metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(text)))
                .map(TextWebSocketFrame::new);

        Flux<WebSocketFrame> pings = Flux.interval(pingInterval, pingInterval)
                .map(tick -> new PingWebSocketFrame());

        Flux<WebSocketFrame> frames = Flux.merge(envelopes, pings)
                .takeUntilOther(connection.onClose());

        return outbound.sendObject(frames)
                .then()
                .onErrorResume(err -> {
                    ConnectionMdc.run(connection, () -> log.warn("Write to {} failed: {}", connection, err.toString()));
                    metricsService.recordEviction(EvictionReason.WRITE_FAILURE);
                    return Mono.empty();
                })
                .then(Mono.defer(() -> {
                    connection.close();
                    return outbound.sendClose();
                }))
                .onErrorResume(err -> {
                    ConnectionMdc.run(connection, () -> log.debug("Close frame not sent to {}: {}", connection, err.toString()));
                    return Mono.empty();
                });
    }

    private Mono<Void> readLoop(WebsocketInbound inbound, Connection connection) {
        return textPayloads(inbound.aggregateFrames(config.getMaxFrameBytes()).receiveFrames())
                .concatMap(frame -> {
                    long startNanos = System.nanoTime();
                    metricsService.recordNetworkInboundWs(BytesUtils.getBytesLength(frame));

                    // user_id on the wire is advisory; the authenticated identity always wins
                    Envelope envelope = EnvelopeCodec.decode(frame).withUserId(connection.getUserId());
                    ConnectionMdc.run(connection, () -> log.debug("Received {} from {}", envelope.getType(), connection));

                    return hub.dispatch(envelope)
                            .doOnSuccess(v -> metricsService.recordDispatchLatency(startNanos));
                })
                .then()
                .onErrorResume(err -> {
                    handleReadError(connection, err);
                    return Mono.empty();
                })
                .doFinally(signal -> connection.close());
    }

    /**
     * One payload per text frame, decoded as UTF-8. Ping, pong and binary frames carry no
     * envelope; they only count as reads for the idle deadline.
     */
    static Flux<String> textPayloads(Flux<WebSocketFrame> frames) {
        return frames
                .ofType(TextWebSocketFrame.class)
                .map(TextWebSocketFrame::text);
    }

    private void handleReadError(Connection connection, Throwable err) {
        if (err instanceof MalformedEnvelopeException) {
            ConnectionMdc.run(connection,
                    () -> log.warn("Malformed envelope from {}: {}", connection, err.getMessage()));
            metricsService.recordEviction(EvictionReason.MALFORMED);
        } else if (err instanceof WriteTimeoutException) {
            ConnectionMdc.run(connection, () -> log.warn("Write deadline exceeded for {}", connection));
            metricsService.recordEviction(EvictionReason.WRITE_FAILURE);
        } else if (!(err instanceof AbortedException)) {
            // AbortedException is expected on close
            ConnectionMdc.run(connection, () -> log.error("Fatal error in inbound stream for {}", connection, err));
        }
    }
}
