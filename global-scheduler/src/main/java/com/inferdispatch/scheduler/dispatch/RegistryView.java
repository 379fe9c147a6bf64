package com.inferdispatch.scheduler.dispatch;

import java.util.Map;
import java.util.Set;

/**
 * Immutable copy of the scheduler's instance registry.
 */
public record RegistryView(String policy,
                           Set<String> instanceIds,
                           Set<String> dispatchInstanceIds,
                           Map<String, Long> dispatchCounts,
                           long totalRequests) {
}
