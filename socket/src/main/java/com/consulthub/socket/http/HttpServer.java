package com.consulthub.socket.http;

import com.consulthub.core.util.JsonUtils;
import com.consulthub.socket.config.SocketConfig;
import com.consulthub.socket.hub.Hub;
import com.consulthub.socket.metrics.PrometheusMetricsExporter;
import com.consulthub.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP server for health checks, hub stats, metrics, and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final Hub hub;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server and blocks until it is bound.
     *
     * @return bound server (use {@link DisposableServer#port()} when configured with port 0)
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness: the process answers
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Readiness: the hub accepts connections
                .get("/readyz", (req, res) -> {
                    if (!hub.isRunning()) {
                        return res.status(503).sendString(Mono.just("Not Ready"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                // Connected users and room participants
                .get("/stats", (req, res) -> res
                    .header("Content-Type", "application/json")
                    .sendString(hub.snapshot().map(snapshot -> {
                        Map<String, Integer> participants = new LinkedHashMap<>();
                        snapshot.getRooms().forEach((room, members) -> participants.put(room, members.size()));
                        return JsonUtils.writeValueAsString(Map.of(
                            "nodeId", config.getNodeId(),
                            "connections", snapshot.getConnectionCount(),
                            "connectedUsers", snapshot.getConnectedUsers(),
                            "rooms", participants
                        ));
                    })))
                // Metrics endpoint with Prometheus scraping
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                // WebSocket upgrade endpoint
                .get(config.getWsPath(), upgradeHandler::handle)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
