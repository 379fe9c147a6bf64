package com.inferdispatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Objects;

/**
 * Load record reported for a single serving instance.
 * <p>
 * Produced by the external load calculator and delivered to the dispatch scheduler
 * as part of a snapshot that fully replaces the previous one.
 * </p>
 */
@Value
@With
public class InstanceLoadRecord {
    /**
     * Identifier of the serving instance this record describes.
     */
    String instanceId;

    /**
     * Scaled load score used for dispatch ranking. Lower means less loaded; may be negative.
     */
    double loadScore;

    /**
     * Number of requests waiting at the instance before execution.
     */
    int queueDepth;

    @Builder(toBuilder = true)
    @JsonCreator
    public InstanceLoadRecord(@JsonProperty("instanceId") String instanceId,
                              @JsonProperty("loadScore") double loadScore,
                              @JsonProperty("queueDepth") int queueDepth) {
        if (queueDepth < 0) {
            throw new IllegalArgumentException("queueDepth must be non-negative, got " + queueDepth);
        }
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.loadScore = loadScore;
        this.queueDepth = queueDepth;
    }
}
