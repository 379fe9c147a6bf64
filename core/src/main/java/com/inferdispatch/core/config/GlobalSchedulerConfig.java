package com.inferdispatch.core.config;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration of the global scheduler, loaded from environment variables.
 * <p>
 * <b>Sign convention:</b> the migrate-out, scale-up and scale-down thresholds are stored as the
 * <em>negation</em> of the values handed to the builder. Load comparisons downstream treat a more
 * negative value as more loaded, so the getters return e.g. {@code -3.0} for a configured
 * threshold of {@code 3.0}. Compare load scores against the getters, never against raw inputs.
 * </p>
 */
@Value
public class GlobalSchedulerConfig {

    int initialInstances;
    String loadMetric;

    String dispatchPolicy;
    int numDispatchInstances;  // <= 0 means every non-decode instance is dispatchable

    String pairMigrationPolicy;
    double migrateOutLoadThreshold;  // negated
    boolean enableDefrag;

    String scalingPolicy;
    double scaleUpThreshold;    // negated
    double scaleDownThreshold;  // negated

    boolean enablePdDisagg;
    String migrationBackend;

    /**
     * Builds the config from raw (non-negated) thresholds.
     */
    @Builder
    private GlobalSchedulerConfig(int initialInstances,
                                  String loadMetric,
                                  String dispatchPolicy,
                                  int numDispatchInstances,
                                  String pairMigrationPolicy,
                                  double migrateOutThreshold,
                                  boolean enableDefrag,
                                  String scalingPolicy,
                                  double scaleUpThreshold,
                                  double scaleDownThreshold,
                                  boolean enablePdDisagg,
                                  String migrationBackend) {
        if (dispatchPolicy == null || dispatchPolicy.isBlank()) {
            throw new IllegalArgumentException("dispatchPolicy is required");
        }
        this.initialInstances = initialInstances;
        this.loadMetric = loadMetric;
        this.dispatchPolicy = dispatchPolicy;
        this.numDispatchInstances = numDispatchInstances;
        this.pairMigrationPolicy = pairMigrationPolicy;
        this.migrateOutLoadThreshold = -migrateOutThreshold;
        this.enableDefrag = enableDefrag;
        this.scalingPolicy = scalingPolicy;
        this.scaleUpThreshold = -scaleUpThreshold;
        this.scaleDownThreshold = -scaleDownThreshold;
        this.enablePdDisagg = enablePdDisagg;
        this.migrationBackend = migrationBackend;
    }

    /**
     * Whether the eligible-instance set is bounded.
     */
    public boolean isDispatchCapacityEnforced() {
        return numDispatchInstances > 0;
    }

    public static GlobalSchedulerConfig fromEnv() {
        return GlobalSchedulerConfig.builder()
            .initialInstances(Integer.parseInt(getEnv("INITIAL_INSTANCES", "1")))
            .loadMetric(getEnv("LOAD_METRIC", "remaining_steps"))
            .dispatchPolicy(getEnv("DISPATCH_POLICY", "load"))
            .numDispatchInstances(Integer.parseInt(getEnv("NUM_DISPATCH_INSTANCES", "0")))
            .pairMigrationPolicy(getEnv("PAIR_MIGRATION_POLICY", "defrag_constrained"))
            .migrateOutThreshold(Double.parseDouble(getEnv("MIGRATE_OUT_THRESHOLD", "3.0")))
            .enableDefrag(Boolean.parseBoolean(getEnv("ENABLE_DEFRAG", "false")))
            .scalingPolicy(getEnv("SCALING_POLICY", "avg_load"))
            .scaleUpThreshold(Double.parseDouble(getEnv("SCALE_UP_THRESHOLD", "10.0")))
            .scaleDownThreshold(Double.parseDouble(getEnv("SCALE_DOWN_THRESHOLD", "60.0")))
            .enablePdDisagg(Boolean.parseBoolean(getEnv("ENABLE_PD_DISAGG", "false")))
            .migrationBackend(getEnv("MIGRATION_BACKEND", "grpc"))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
