package com.inferdispatch.scheduler.dispatch.policy;

import com.inferdispatch.core.model.InstanceLoadRecord;

import java.util.List;
import java.util.Map;

/**
 * Strategy choosing the target instance of one incoming request.
 * <p>
 * Policies are resolved once at scheduler setup through {@link DispatchPolicyRegistry}.
 * Each policy declares the {@link RankingMetric} it needs; the scheduler computes the
 * ranked view for that metric before calling {@link #select}.
 * </p>
 */
public interface DispatchPolicy {

    /**
     * Registry name of this policy.
     */
    String name();

    /**
     * Metric the eligible instances must be ranked by before {@link #select} is called.
     */
    default RankingMetric rankingMetric() {
        return RankingMetric.NONE;
    }

    /**
     * Selects the instance the next request goes to.
     *
     * @param dispatchCounts Requests dispatched so far per counted instance, in registration order
     * @param sortedView     Load records of eligible instances in ascending {@link #rankingMetric()}
     *                       order; empty for policies that do not rank
     * @return Selected instance id
     * @throws com.inferdispatch.scheduler.dispatch.NoAvailableInstanceException if there is nothing to choose from
     */
    String select(Map<String, Long> dispatchCounts, List<InstanceLoadRecord> sortedView);
}
