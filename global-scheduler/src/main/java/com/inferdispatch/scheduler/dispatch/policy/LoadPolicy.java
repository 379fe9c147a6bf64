package com.inferdispatch.scheduler.dispatch.policy;

import com.inferdispatch.core.model.InstanceLoadRecord;
import com.inferdispatch.scheduler.dispatch.NoAvailableInstanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Sends each request to the least loaded eligible instance.
 */
public final class LoadPolicy implements DispatchPolicy {
    private static final Logger log = LoggerFactory.getLogger(LoadPolicy.class);

    public static final String NAME = "load";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RankingMetric rankingMetric() {
        return RankingMetric.LOAD_SCORE;
    }

    @Override
    public String select(Map<String, Long> dispatchCounts, List<InstanceLoadRecord> sortedView) {
        if (sortedView.isEmpty()) {
            throw new NoAvailableInstanceException("No load record for any eligible instance");
        }
        InstanceLoadRecord least = sortedView.get(0);
        log.debug("Dispatch to {}, load: {}", least.getInstanceId(), least.getLoadScore());
        return least.getInstanceId();
    }
}
