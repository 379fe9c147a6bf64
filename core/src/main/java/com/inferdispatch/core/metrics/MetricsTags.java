package com.inferdispatch.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the control-plane node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for a serving instance identifier.
     */
    public static final String INSTANCE_ID = "instance_id";

    /**
     * Tag key for the dispatch policy name.
     */
    public static final String POLICY = "policy";
}
