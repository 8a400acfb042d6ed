package com.consulthub.core.metrics;

/**
 * Micrometer metric names used by the hub.
 * <p>
 * <b>Naming convention:</b> {@code hub.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Connections currently registered with the hub.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String ACTIVE_CONNECTIONS = "hub.connections.active";

    /**
     * Gauge: Rooms with at least one member.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String ACTIVE_ROOMS = "hub.rooms.active";

    /**
     * Counter: Connections registered since start.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String CONNECTIONS_TOTAL = "hub.connections.total";

    /**
     * Counter: Connections torn down by the hub or the connection actor.
     * <p>
     * Tags: nodeId, reason (queue_full/idle_timeout/malformed/write_failure)
     * </p>
     */
    public static final String EVICTIONS_TOTAL = "hub.evictions.total";

    /**
     * Counter: Inbound envelopes dispatched.
     * <p>
     * Tags: nodeId, type (wire tag, or "unknown")
     * </p>
     */
    public static final String ENVELOPES_INBOUND_TOTAL = "hub.envelopes.inbound.total";

    /**
     * Distribution Summary: Recipients per room broadcast.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String BROADCAST_FANOUT = "hub.broadcast.fanout";

    /**
     * Timer: Time from frame receipt to completion of hub processing.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String DISPATCH_LATENCY = "hub.dispatch.latency";

    /**
     * Counter: Network traffic inbound from WebSocket (bytes).
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "hub.network.inbound.ws.bytes";

    /**
     * Counter: Network traffic outbound to WebSocket (bytes).
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "hub.network.outbound.ws.bytes";

    /**
     * Counter: Upgrade attempts rejected before reaching the hub.
     * <p>
     * Tags: nodeId, reason (origin/unauthorized)
     * </p>
     */
    public static final String UPGRADE_REJECTED_TOTAL = "hub.upgrade.rejected.total";
}
