package com.inferdispatch.scheduler.stats;

import com.inferdispatch.core.metrics.MetricsNames;
import com.inferdispatch.core.metrics.MetricsTags;
import com.inferdispatch.core.model.DispatchStatistics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes the latest dispatch statistics as Micrometer gauges.
 * <p>
 * Gauges of instances missing from a newer snapshot are removed from the registry.
 * </p>
 */
public class MicrometerDispatchStatsSink implements DispatchStatsSink {
    private static final Logger log = LoggerFactory.getLogger(MicrometerDispatchStatsSink.class);

    private final MeterRegistry meterRegistry;
    private final AtomicLong totalRequests = new AtomicLong();
    private final Map<String, InstanceGauge> instanceGauges = new HashMap<>();

    public MicrometerDispatchStatsSink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(MetricsNames.DISPATCH_STATS_REQUESTS, totalRequests, AtomicLong::get)
            .description("Total dispatched requests as of the last statistics emission")
            .register(meterRegistry);
    }

    @Override
    public synchronized void record(DispatchStatistics statistics) {
        totalRequests.set(statistics.getTotalRequests());

        Map<String, Long> counts = statistics.getInstanceRequests();
        Iterator<Map.Entry<String, InstanceGauge>> it = instanceGauges.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, InstanceGauge> entry = it.next();
            if (!counts.containsKey(entry.getKey())) {
                meterRegistry.remove(entry.getValue().gauge());
                it.remove();
                log.debug("Removed dispatch gauge of departed instance {}", entry.getKey());
            }
        }

        counts.forEach((instanceId, count) ->
            instanceGauges.computeIfAbsent(instanceId, this::registerInstanceGauge).value().set(count));
    }

    private InstanceGauge registerInstanceGauge(String instanceId) {
        AtomicLong value = new AtomicLong();
        Gauge gauge = Gauge.builder(MetricsNames.DISPATCH_STATS_INSTANCE_REQUESTS, value, AtomicLong::get)
            .description("Requests dispatched to an instance as of the last statistics emission")
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .register(meterRegistry);
        return new InstanceGauge(value, gauge);
    }

    private record InstanceGauge(AtomicLong value, Gauge gauge) {
    }
}
