package com.inferdispatch.scheduler.stats;

import com.inferdispatch.core.model.DispatchStatistics;

/**
 * Receives the periodic dispatch statistics of the scheduler.
 * <p>
 * Purely observational. Implementations must not call back into the scheduler.
 * </p>
 */
@FunctionalInterface
public interface DispatchStatsSink {

    void record(DispatchStatistics statistics);
}
