package com.consulthub.socket.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the hub node, loaded from environment variables.
 */
@Value
@Builder
public class SocketConfig {

    static final String DEFAULT_ALLOWED_ORIGINS = String.join(",",
        "http://localhost:3000", "https://localhost:3000",
        "http://localhost:8080", "https://localhost:8080",
        "http://127.0.0.1:3000", "https://127.0.0.1:3000",
        "http://127.0.0.1:8080", "https://127.0.0.1:8080");

    String nodeId;
    int httpPort;
    String wsPath;

    // Per-connection limits
    int sendQueueSize;
    int maxFrameBytes;

    // Liveness
    Duration pingInterval;
    Duration idleTimeout;
    Duration writeTimeout;

    // Upgrade policy
    @Singular
    List<String> allowedOrigins;
    boolean allowMissingOrigin;

    // Token verification
    String tokenSecret;

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
            .nodeId(getEnv("NODE_ID", "hub-node-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .wsPath(getEnv("WS_PATH", "/ws"))
            .sendQueueSize(Integer.parseInt(getEnv("SEND_QUEUE_SIZE", "256")))
            .maxFrameBytes(Integer.parseInt(getEnv("MAX_FRAME_BYTES", "65536")))
            .pingInterval(Duration.ofSeconds(Long.parseLong(getEnv("PING_INTERVAL_SEC", "54"))))
            .idleTimeout(Duration.ofSeconds(Long.parseLong(getEnv("IDLE_TIMEOUT_SEC", "60"))))
            .writeTimeout(Duration.ofSeconds(Long.parseLong(getEnv("WRITE_TIMEOUT_SEC", "10"))))
            .allowedOrigins(Splitter.on(',').trimResults().omitEmptyStrings()
                .splitToList(getEnv("ALLOWED_ORIGINS", DEFAULT_ALLOWED_ORIGINS)))
            .allowMissingOrigin(Boolean.parseBoolean(getEnv("ALLOW_MISSING_ORIGIN", "true")))
            .tokenSecret(System.getenv("TOKEN_SECRET"))
            .build()
            .validate();
    }

    /**
     * Checks cross-field invariants.
     *
     * @return this config
     * @throws IllegalArgumentException if a value is out of range
     */
    public SocketConfig validate() {
        Preconditions.checkArgument(nodeId != null && !nodeId.isBlank(), "nodeId must be set");
        Preconditions.checkArgument(httpPort >= 0 && httpPort <= 65535, "httpPort out of range: %s", httpPort);
        Preconditions.checkArgument(wsPath != null && wsPath.startsWith("/"), "wsPath must start with '/': %s", wsPath);
        Preconditions.checkArgument(sendQueueSize > 0, "sendQueueSize must be positive: %s", sendQueueSize);
        Preconditions.checkArgument(maxFrameBytes > 0, "maxFrameBytes must be positive: %s", maxFrameBytes);
        Preconditions.checkArgument(isPositive(pingInterval), "pingInterval must be positive");
        Preconditions.checkArgument(isPositive(idleTimeout), "idleTimeout must be positive");
        Preconditions.checkArgument(isPositive(writeTimeout), "writeTimeout must be positive");
        Preconditions.checkArgument(pingInterval.compareTo(idleTimeout) < 0,
            "pingInterval (%s) must be shorter than idleTimeout (%s)", pingInterval, idleTimeout);
        return this;
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
