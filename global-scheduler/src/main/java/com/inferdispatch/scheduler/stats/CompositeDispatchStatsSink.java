package com.inferdispatch.scheduler.stats;

import com.inferdispatch.core.model.DispatchStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans statistics out to several sinks. A failing sink does not keep the others from recording.
 */
public class CompositeDispatchStatsSink implements DispatchStatsSink {
    private static final Logger log = LoggerFactory.getLogger(CompositeDispatchStatsSink.class);

    private final List<DispatchStatsSink> sinks;

    public CompositeDispatchStatsSink(List<DispatchStatsSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void record(DispatchStatistics statistics) {
        for (DispatchStatsSink sink : sinks) {
            try {
                sink.record(statistics);
            } catch (RuntimeException e) {
                log.warn("Stats sink {} failed to record dispatch statistics", sink.getClass().getSimpleName(), e);
            }
        }
    }
}
