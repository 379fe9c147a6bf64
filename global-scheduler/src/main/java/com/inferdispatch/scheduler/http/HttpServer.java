package com.inferdispatch.scheduler.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.inferdispatch.core.model.InstanceLoadRecord;
import com.inferdispatch.core.util.JsonUtils;
import com.inferdispatch.scheduler.dispatch.InstanceNotFoundException;
import com.inferdispatch.scheduler.dispatch.NoAvailableInstanceException;
import com.inferdispatch.scheduler.dispatch.ReactiveDispatchScheduler;
import com.inferdispatch.scheduler.dispatch.RegistryView;
import com.inferdispatch.scheduler.metrics.PrometheusMetricsExporter;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP server through which the fleet manager drives the dispatch scheduler.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final TypeReference<List<InstanceLoadRecord>> LOAD_RECORDS = new TypeReference<>() {
    };

    private final int port;
    private final ReactiveDispatchScheduler scheduler;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(int port, ReactiveDispatchScheduler scheduler, PrometheusMetricsExporter metricsExporter) {
        this.port = port;
        this.scheduler = scheduler;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(port)
            .route(this::configureRoutes)
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", PrometheusMetricsExporter.CONTENT_TYPE)
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            // Instance joined
            .post("/api/v1/instances/{instanceId}", (req, res) ->
                scheduler.addInstance(req.param("instanceId"))
                    .then(Mono.defer(() -> res.status(HttpResponseStatus.NO_CONTENT).send().then()))
                    .onErrorResume(err -> sendError(res, err))
            )
            // Instance left
            .delete("/api/v1/instances/{instanceId}", (req, res) ->
                scheduler.removeInstance(req.param("instanceId"))
                    .then(Mono.defer(() -> res.status(HttpResponseStatus.NO_CONTENT).send().then()))
                    .onErrorResume(err -> sendError(res, err))
            )
            // Registry state
            .get("/api/v1/instances", (req, res) ->
                scheduler.registryView()
                    .map(HttpServer::toResponse)
                    .flatMap(body -> sendJson(res, body))
                    .onErrorResume(err -> sendError(res, err))
            )
            // Load snapshot from the load calculator
            .put("/api/v1/instance-infos", (req, res) ->
                req.receive().aggregate().asString()
                    .defaultIfEmpty("[]")
                    .map(json -> toSnapshot(JsonUtils.readValue(json, LOAD_RECORDS)))
                    .flatMap(scheduler::updateInstanceInfos)
                    .then(Mono.defer(() -> res.status(HttpResponseStatus.NO_CONTENT).send().then()))
                    .onErrorResume(err -> sendError(res, err))
            )
            // Pick the target instance of one request
            .post("/api/v1/dispatch", (req, res) ->
                scheduler.dispatch()
                    .flatMap(instanceId -> sendJson(res, Map.of("instanceId", instanceId)))
                    .onErrorResume(err -> sendError(res, err))
            )
            // Current dispatch counters
            .get("/api/v1/stats", (req, res) ->
                scheduler.statistics()
                    .flatMap(stats -> sendJson(res, stats))
                    .onErrorResume(err -> sendError(res, err))
            );
    }

    private static Map<String, InstanceLoadRecord> toSnapshot(List<InstanceLoadRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("Load snapshot must be a JSON array");
        }
        Map<String, InstanceLoadRecord> snapshot = new LinkedHashMap<>();
        for (InstanceLoadRecord record : records) {
            if (record == null) {
                throw new IllegalArgumentException("Load snapshot contains a null record");
            }
            snapshot.put(record.getInstanceId(), record);
        }
        return snapshot;
    }

    private static Map<String, Object> toResponse(RegistryView view) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("policy", view.policy());
        response.put("all", view.instanceIds());
        response.put("eligible", view.dispatchInstanceIds());
        response.put("dispatchCounts", view.dispatchCounts());
        response.put("totalRequests", view.totalRequests());
        return response;
    }

    private static Mono<Void> sendJson(HttpServerResponse res, Object body) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(body))
            .flatMap(json ->
                res.header("Content-Type", "application/json")
                    .sendString(Mono.just(json)).then()
            );
    }

    private static Mono<Void> sendError(HttpServerResponse res, Throwable err) {
        HttpResponseStatus status;
        if (err instanceof InstanceNotFoundException) {
            status = HttpResponseStatus.NOT_FOUND;
        } else if (err instanceof NoAvailableInstanceException) {
            status = HttpResponseStatus.SERVICE_UNAVAILABLE;
        } else if (err instanceof IllegalArgumentException) {
            status = HttpResponseStatus.BAD_REQUEST;
        } else {
            log.error("Request failed", err);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
        }
        String message = err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(JsonUtils.writeValueAsString(Map.of("error", message))))
            .then();
    }
}
