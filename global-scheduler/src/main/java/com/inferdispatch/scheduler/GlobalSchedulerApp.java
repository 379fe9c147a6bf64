package com.inferdispatch.scheduler;

import com.inferdispatch.core.config.GlobalSchedulerConfig;
import com.inferdispatch.core.config.MigrationConfig;
import com.inferdispatch.core.model.InstanceIds;
import com.inferdispatch.scheduler.config.SchedulerAppConfig;
import com.inferdispatch.scheduler.dispatch.DispatchScheduler;
import com.inferdispatch.scheduler.dispatch.ReactiveDispatchScheduler;
import com.inferdispatch.scheduler.http.HttpServer;
import com.inferdispatch.scheduler.metrics.PrometheusMetricsExporter;
import com.inferdispatch.scheduler.stats.CompositeDispatchStatsSink;
import com.inferdispatch.scheduler.stats.LoggingDispatchStatsSink;
import com.inferdispatch.scheduler.stats.MicrometerDispatchStatsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

import java.security.SecureRandom;
import java.util.List;

public class GlobalSchedulerApp {
    private static final Logger log = LoggerFactory.getLogger(GlobalSchedulerApp.class);

    public static void main(String[] args) {
        SchedulerAppConfig config = SchedulerAppConfig.fromEnv();
        GlobalSchedulerConfig schedulerConfig = config.getGlobalScheduler();
        MigrationConfig migrationConfig = config.getMigration();

        log.info("Starting Global Scheduler");
        log.info("  Dispatch policy: {}", schedulerConfig.getDispatchPolicy());
        log.info("  Dispatch instances: {}", schedulerConfig.isDispatchCapacityEnforced()
            ? schedulerConfig.getNumDispatchInstances() : "unbounded");
        log.info("  PD disaggregation: {}", schedulerConfig.isEnablePdDisagg());
        log.info("  Migration: policy={}, backend={}, maxStages={}, lastStageMaxBlocks={}",
            migrationConfig.getRequestMigrationPolicy(), migrationConfig.getMigrationBackend().getConfigName(),
            migrationConfig.getMaxStages(), migrationConfig.getLastStageMaxBlocks());

        // Setup metrics
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());

        DispatchScheduler dispatchScheduler = new DispatchScheduler(
            schedulerConfig.getDispatchPolicy(),
            schedulerConfig.getNumDispatchInstances(),
            new CompositeDispatchStatsSink(List.of(
                new LoggingDispatchStatsSink(),
                new MicrometerDispatchStatsSink(metricsExporter.getRegistry())
            )),
            new SecureRandom(),
            InstanceIds::isDecodeOnly,
            metricsExporter.getRegistry()
        );
        ReactiveDispatchScheduler scheduler = new ReactiveDispatchScheduler(dispatchScheduler);

        HttpServer httpServer = new HttpServer(config.getHttpPort(), scheduler, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        log.info("Global Scheduler is ready");

        handleShutDown(httpServer, scheduler, metricsExporter);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(HttpServer httpServer,
                                       ReactiveDispatchScheduler scheduler,
                                       PrometheusMetricsExporter metricsExporter) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            httpServer.stop();

            scheduler.close();
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}
