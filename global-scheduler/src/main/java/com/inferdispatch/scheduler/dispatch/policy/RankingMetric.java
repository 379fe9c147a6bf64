package com.inferdispatch.scheduler.dispatch.policy;

import com.inferdispatch.core.model.InstanceLoadRecord;

import java.util.Comparator;

/**
 * Snapshot metric a policy needs the eligible instances ranked by before each selection.
 */
public enum RankingMetric {
    /**
     * Policy works on dispatch counters only; no ranking is computed.
     */
    NONE(null),

    /**
     * Ascending load score, least loaded first.
     */
    LOAD_SCORE(Comparator.comparingDouble(InstanceLoadRecord::getLoadScore)),

    /**
     * Ascending queue depth, shortest queue first.
     */
    QUEUE_DEPTH(Comparator.comparingInt(InstanceLoadRecord::getQueueDepth));

    private final Comparator<InstanceLoadRecord> order;

    RankingMetric(Comparator<InstanceLoadRecord> order) {
        this.order = order;
    }

    public boolean ranks() {
        return order != null;
    }

    /**
     * Ascending order by this metric.
     *
     * @throws IllegalStateException for {@link #NONE}
     */
    public Comparator<InstanceLoadRecord> order() {
        if (order == null) {
            throw new IllegalStateException("Metric " + this + " does not rank instances");
        }
        return order;
    }
}
