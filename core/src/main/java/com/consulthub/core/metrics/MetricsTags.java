package com.consulthub.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for envelope type.
     */
    public static final String TYPE = "type";

    /**
     * Tag key for eviction/rejection reason.
     */
    public static final String REASON = "reason";

}
