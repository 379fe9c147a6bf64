package com.inferdispatch.scheduler.stats;

import com.inferdispatch.core.model.DispatchStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes dispatch statistics to the log: one line with the total, then one line per instance.
 */
public class LoggingDispatchStatsSink implements DispatchStatsSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingDispatchStatsSink.class);

    @Override
    public void record(DispatchStatistics statistics) {
        log.info("Dispatched requests: {}", statistics.getTotalRequests());
        statistics.getInstanceRequests().forEach((instanceId, count) ->
            log.info("Instance {} dispatched requests: {}", instanceId, count));
    }
}
