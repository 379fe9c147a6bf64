package com.inferdispatch.scheduler.dispatch.policy;

import com.inferdispatch.core.model.InstanceLoadRecord;
import com.inferdispatch.scheduler.dispatch.NoAvailableInstanceException;

import java.util.List;
import java.util.Map;

/**
 * Sends every request to the instance that already received the most.
 * <p>
 * Deliberately unbalanced; used to concentrate traffic on a single instance in tests.
 * Ties go to the first instance in registration order.
 * </p>
 */
public final class FloodPolicy implements DispatchPolicy {
    public static final String NAME = "flood";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String select(Map<String, Long> dispatchCounts, List<InstanceLoadRecord> sortedView) {
        String selected = null;
        long max = Long.MIN_VALUE;
        for (Map.Entry<String, Long> entry : dispatchCounts.entrySet()) {
            if (entry.getValue() > max) {
                max = entry.getValue();
                selected = entry.getKey();
            }
        }
        if (selected == null) {
            throw new NoAvailableInstanceException("No counted instance to flood");
        }
        return selected;
    }
}
