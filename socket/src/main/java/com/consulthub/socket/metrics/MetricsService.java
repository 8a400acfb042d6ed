package com.consulthub.socket.metrics;

import com.consulthub.core.metrics.MetricsNames;
import com.consulthub.core.metrics.MetricsTags;
import com.consulthub.socket.config.SocketConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics service for the hub node.
 */
public class MetricsService {

    /**
     * Why a connection was torn down.
     */
    public enum EvictionReason {
        QUEUE_FULL("queue_full"),
        IDLE_TIMEOUT("idle_timeout"),
        MALFORMED("malformed"),
        WRITE_FAILURE("write_failure");

        private final String tag;

        EvictionReason(String tag) {
            this.tag = tag;
        }
    }

    private final MeterRegistry registry;
    private final String nodeId;

    // Gauges
    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicInteger activeRooms = new AtomicInteger();

    // Counters
    private final Counter connectionsTotal;
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    private final DistributionSummary broadcastFanout;
    private final Timer dispatchLatency;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        Gauge.builder(MetricsNames.ACTIVE_CONNECTIONS, activeConnections, AtomicInteger::get)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections currently registered with the hub")
            .register(registry);

        Gauge.builder(MetricsNames.ACTIVE_ROOMS, activeRooms, AtomicInteger::get)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Rooms with at least one member")
            .register(registry);

        connectionsTotal = Counter.builder(MetricsNames.CONNECTIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Connections registered since start")
            .register(registry);

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_INBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_OUTBOUND_WS_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        broadcastFanout = DistributionSummary.builder(MetricsNames.BROADCAST_FANOUT)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Recipients per room broadcast")
            .register(registry);

        // Percentile histogram for p95, p99 tracking
        dispatchLatency = Timer.builder(MetricsNames.DISPATCH_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Frame receipt to end of hub processing")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100)
            )
            .register(registry);
    }

    public void setActiveConnections(int count) {
        activeConnections.set(count);
    }

    public void setActiveRooms(int count) {
        activeRooms.set(count);
    }

    public void recordConnectionRegistered() {
        connectionsTotal.increment();
    }

    public void recordEviction(EvictionReason reason) {
        registry.counter(MetricsNames.EVICTIONS_TOTAL,
            MetricsTags.NODE_ID, nodeId, MetricsTags.REASON, reason.tag).increment();
    }

    /**
     * Counts an inbound envelope by its wire type. Unknown tags share one series.
     *
     * @param knownType wire tag of a catalogued type, or null for unknown tags
     */
    public void recordInboundEnvelope(String knownType) {
        registry.counter(MetricsNames.ENVELOPES_INBOUND_TOTAL,
            MetricsTags.NODE_ID, nodeId, MetricsTags.TYPE, knownType == null ? "unknown" : knownType).increment();
    }

    public void recordUpgradeRejected(String reason) {
        registry.counter(MetricsNames.UPGRADE_REJECTED_TOTAL,
            MetricsTags.NODE_ID, nodeId, MetricsTags.REASON, reason).increment();
    }

    public void recordBroadcastFanout(int recipients) {
        broadcastFanout.record(recipients);
    }

    /**
     * Records dispatch latency.
     *
     * @param startNanos {@link System#nanoTime()} at frame receipt
     */
    public void recordDispatchLatency(long startNanos) {
        dispatchLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Records bytes received from WebSocket client.
     *
     * @param bytes number of bytes received
     */
    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    /**
     * Records bytes sent to WebSocket client.
     *
     * @param bytes number of bytes sent
     */
    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    public double getEvictionCount(EvictionReason reason) {
        Counter counter = registry.find(MetricsNames.EVICTIONS_TOTAL)
            .tag(MetricsTags.REASON, reason.tag)
            .counter();
        return counter == null ? 0 : counter.count();
    }
}
