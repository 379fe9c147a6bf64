package com.inferdispatch.scheduler.dispatch;

import com.inferdispatch.core.model.DispatchStatistics;
import com.inferdispatch.core.model.InstanceLoadRecord;

import java.util.Map;

/**
 * Interface for request dispatch (Dependency Inversion Principle).
 * <p>
 * Abstracts instance membership tracking and per-request target selection.
 * Implementations are single-writer; see {@link ReactiveDispatchScheduler} for shared use.
 * </p>
 */
public interface IDispatchScheduler {

    /**
     * Replaces the load snapshot used for ranking.
     */
    void updateInstanceInfos(Map<String, InstanceLoadRecord> instanceInfos);

    /**
     * Registers an instance that joined the pool.
     */
    void addInstance(String instanceId);

    /**
     * Unregisters an instance that left the pool.
     *
     * @throws InstanceNotFoundException if the instance is not registered
     */
    void removeInstance(String instanceId);

    /**
     * Chooses the target instance of one incoming request.
     *
     * @throws NoAvailableInstanceException if no instance can take the request
     */
    String dispatch();

    /**
     * Gets the current registry state.
     */
    RegistryView getRegistryView();

    /**
     * Gets the current dispatch counters.
     */
    DispatchStatistics getStatistics();
}
