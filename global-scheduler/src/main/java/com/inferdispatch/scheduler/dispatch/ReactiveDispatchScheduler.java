package com.inferdispatch.scheduler.dispatch;

import com.inferdispatch.core.model.DispatchStatistics;
import com.inferdispatch.core.model.InstanceLoadRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Serializes access to a single-writer {@link IDispatchScheduler}.
 * <p>
 * Every operation is queued onto one dedicated worker thread and runs to completion before
 * the next one starts, so multi-step updates such as removal with backfill are never observed
 * half applied. Failures are delivered as error signals carrying the scheduler's exceptions.
 * </p>
 */
public class ReactiveDispatchScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReactiveDispatchScheduler.class);

    private final IDispatchScheduler delegate;
    private final Scheduler worker;

    public ReactiveDispatchScheduler(IDispatchScheduler delegate) {
        this(delegate, Schedulers.newSingle("dispatch-scheduler", true));
    }

    public ReactiveDispatchScheduler(IDispatchScheduler delegate, Scheduler worker) {
        this.delegate = delegate;
        this.worker = worker;
    }

    public Mono<String> dispatch() {
        return Mono.fromCallable(delegate::dispatch)
            .subscribeOn(worker);
    }

    public Mono<Void> updateInstanceInfos(Map<String, InstanceLoadRecord> instanceInfos) {
        return Mono.<Void>fromRunnable(() -> delegate.updateInstanceInfos(instanceInfos))
            .subscribeOn(worker);
    }

    public Mono<Void> addInstance(String instanceId) {
        return Mono.<Void>fromRunnable(() -> delegate.addInstance(instanceId))
            .subscribeOn(worker);
    }

    public Mono<Void> removeInstance(String instanceId) {
        return Mono.<Void>fromRunnable(() -> delegate.removeInstance(instanceId))
            .subscribeOn(worker);
    }

    public Mono<RegistryView> registryView() {
        return Mono.fromCallable(delegate::getRegistryView)
            .subscribeOn(worker);
    }

    public Mono<DispatchStatistics> statistics() {
        return Mono.fromCallable(delegate::getStatistics)
            .subscribeOn(worker);
    }

    @Override
    public void close() {
        worker.dispose();
        log.info("Dispatch scheduler worker stopped");
    }
}
