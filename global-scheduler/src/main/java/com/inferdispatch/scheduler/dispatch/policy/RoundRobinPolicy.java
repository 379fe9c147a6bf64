package com.inferdispatch.scheduler.dispatch.policy;

import com.inferdispatch.core.model.InstanceLoadRecord;
import com.inferdispatch.scheduler.dispatch.NoAvailableInstanceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Cycles through the counted instances in lexicographic id order.
 * <p>
 * The cursor survives across calls but not across membership changes: when instances join
 * or leave, the next position is taken modulo the new size, which can skip or repeat an
 * instance once.
 * </p>
 */
public final class RoundRobinPolicy implements DispatchPolicy {
    public static final String NAME = "rr";

    private int prevInstanceIdx = -1;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String select(Map<String, Long> dispatchCounts, List<InstanceLoadRecord> sortedView) {
        if (dispatchCounts.isEmpty()) {
            throw new NoAvailableInstanceException("No counted instance to cycle through");
        }
        List<String> instanceIds = new ArrayList<>(dispatchCounts.keySet());
        Collections.sort(instanceIds);

        int curInstanceIdx = (prevInstanceIdx + 1) % instanceIds.size();
        prevInstanceIdx = curInstanceIdx;
        return instanceIds.get(curInstanceIdx);
    }
}
