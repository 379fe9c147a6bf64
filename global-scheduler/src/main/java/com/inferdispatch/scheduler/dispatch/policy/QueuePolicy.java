package com.inferdispatch.scheduler.dispatch.policy;

import com.inferdispatch.core.model.InstanceLoadRecord;
import com.inferdispatch.scheduler.dispatch.NoAvailableInstanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Sends each request to an eligible instance with the shortest waiting queue.
 * <p>
 * When several instances share the shortest queue, one of them is picked uniformly at random.
 * </p>
 */
public final class QueuePolicy implements DispatchPolicy {
    private static final Logger log = LoggerFactory.getLogger(QueuePolicy.class);

    public static final String NAME = "queue";

    private final Random random;

    public QueuePolicy(Random random) {
        this.random = random;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RankingMetric rankingMetric() {
        return RankingMetric.QUEUE_DEPTH;
    }

    @Override
    public String select(Map<String, Long> dispatchCounts, List<InstanceLoadRecord> sortedView) {
        if (sortedView.isEmpty()) {
            throw new NoAvailableInstanceException("No load record for any eligible instance");
        }
        int minQueueDepth = sortedView.get(0).getQueueDepth();
        List<String> shortestQueues = new ArrayList<>();
        for (InstanceLoadRecord info : sortedView) {
            if (info.getQueueDepth() != minQueueDepth) {
                break;
            }
            shortestQueues.add(info.getInstanceId());
        }
        String selected = shortestQueues.get(random.nextInt(shortestQueues.size()));
        log.debug("Dispatch to {}, queue depth: {} ({} candidates)", selected, minQueueDepth, shortestQueues.size());
        return selected;
    }
}
