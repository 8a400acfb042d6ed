package com.consulthub.socket;

import com.consulthub.socket.auth.HmacTokenVerifier;
import com.consulthub.socket.config.SocketConfig;
import com.consulthub.socket.http.HttpServer;
import com.consulthub.socket.hub.Hub;
import com.consulthub.socket.metrics.MetricsService;
import com.consulthub.socket.metrics.PrometheusMetricsExporter;
import com.consulthub.socket.session.ConnectionFactory;
import com.consulthub.socket.ws.AllowListOriginPolicy;
import com.consulthub.socket.ws.WebSocketHandler;
import com.consulthub.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Main entry point for the consultation hub node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at the configured path (bearer token via query or header)</li>
 *   <li>Run the hub coordinator that owns connection and room membership</li>
 *   <li>Fan chat, typing and presence events out to room members</li>
 *   <li>Expose /healthz, /readyz, /stats and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting hub node: {}", config.getNodeId());
        log.info("  WebSocket path: {}", config.getWsPath());
        log.info("  Ping interval: {}, idle timeout: {}, write timeout: {}",
            config.getPingInterval(), config.getIdleTimeout(), config.getWriteTimeout());
        log.info("  Allowed origins: {}", config.getAllowedOrigins());

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        Hub hub = new Hub(metricsService);
        hub.start();

        WebSocketHandler wsHandler = new WebSocketHandler(
            config, hub, new ConnectionFactory(config), metricsService
        );
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            config,
            wsHandler,
            new HmacTokenVerifier(config.getTokenSecret()),
            AllowListOriginPolicy.fromConfig(config),
            metricsService
        );

        HttpServer httpServer = new HttpServer(config, hub, upgradeHandler, metricsExporter);
        httpServer.start();

        log.info("Hub node {} is ready", config.getNodeId());

        handleShutdown(config, hub, httpServer);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SocketConfig config, Hub hub, HttpServer httpServer) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            // Stop accepting upgrades, then close every live connection
            httpServer.stop();
            hub.stop();

            log.info("Shutdown complete");
        }));
    }
}
