package com.inferdispatch.scheduler.dispatch.policy;

import com.inferdispatch.core.model.InstanceLoadRecord;
import com.inferdispatch.scheduler.dispatch.NoAvailableInstanceException;

import java.util.List;
import java.util.Map;

/**
 * Sends each request to the instance that received the fewest so far.
 * <p>
 * Ties go to the first instance in registration order, so a stable membership is
 * served round-robin with counts never more than one apart.
 * </p>
 */
public final class BalancedPolicy implements DispatchPolicy {
    public static final String NAME = "balanced";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String select(Map<String, Long> dispatchCounts, List<InstanceLoadRecord> sortedView) {
        String selected = null;
        long min = Long.MAX_VALUE;
        for (Map.Entry<String, Long> entry : dispatchCounts.entrySet()) {
            if (entry.getValue() < min) {
                min = entry.getValue();
                selected = entry.getKey();
            }
        }
        if (selected == null) {
            throw new NoAvailableInstanceException("No counted instance to balance over");
        }
        return selected;
    }
}
