package com.inferdispatch.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time dispatch counters of the scheduler.
 * <p>
 * Emitted periodically for observability; never feeds back into dispatch decisions.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class DispatchStatistics {
    /**
     * Number of requests dispatched since the scheduler started.
     */
    long totalRequests;

    /**
     * Requests dispatched per currently counted instance, in registration order.
     */
    Map<String, Long> instanceRequests;

    Instant capturedAt;
}
