package com.inferdispatch.scheduler.metrics;

import com.inferdispatch.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Publishes the scheduler's meters in the Prometheus text format.
 * <p>
 * The scheduler and the statistics sink register on {@link #getRegistry()}, the process-wide
 * composite that Reactor Netty also reports into, so one scrape covers dispatch membership,
 * dispatch decisions, per-instance request counts and the HTTP server itself.
 * Every meter carries the {@code node_id} tag of this scheduler.
 * </p>
 */
public class PrometheusMetricsExporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    /**
     * Content type of {@link #scrape()} output.
     */
    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheusRegistry.config().commonTags(MetricsTags.NODE_ID, nodeId);

        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        } else {
            log.warn("Global registry is not composite, Prometheus scrape will only show its own meters");
        }
        log.info("Dispatch metrics exported for node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    /**
     * Detaches the Prometheus registry from the global composite. Meters already registered on
     * the composite stay there.
     */
    @Override
    public void close() {
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.remove(prometheusRegistry);
        }
        prometheusRegistry.close();
    }
}
