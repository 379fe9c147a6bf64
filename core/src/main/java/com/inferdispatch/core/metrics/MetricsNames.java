package com.inferdispatch.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code dispatch.<subject>[.<detail>]}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Number of instances known to the dispatch scheduler.
     * <p>
     * Tags: (none)
     * </p>
     */
    public static final String DISPATCH_INSTANCES = "dispatch.instances";

    /**
     * Gauge: Number of instances currently eligible for new requests.
     * <p>
     * Tags: (none)
     * </p>
     */
    public static final String DISPATCH_ELIGIBLE_INSTANCES = "dispatch.instances.eligible";

    /**
     * Counter: Dispatch decisions made.
     * <p>
     * Tags: policy
     * </p>
     */
    public static final String DISPATCH_DECISIONS_TOTAL = "dispatch.decisions.total";

    /**
     * Gauge: Total dispatched requests as of the last statistics emission.
     * <p>
     * Tags: (none)
     * </p>
     */
    public static final String DISPATCH_STATS_REQUESTS = "dispatch.stats.requests";

    /**
     * Gauge: Requests dispatched to one instance as of the last statistics emission.
     * <p>
     * Tags: instance_id
     * </p>
     */
    public static final String DISPATCH_STATS_INSTANCE_REQUESTS = "dispatch.stats.instance.requests";
}
