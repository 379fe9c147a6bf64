package com.inferdispatch.scheduler.config;

import com.inferdispatch.core.config.GlobalSchedulerConfig;
import com.inferdispatch.core.config.MigrationConfig;
import lombok.Builder;
import lombok.Value;

/**
 * Configuration for the global scheduler process, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SchedulerAppConfig {

    String nodeId;
    int httpPort;

    GlobalSchedulerConfig globalScheduler;

    // Read by the migration subsystem; the dispatcher only validates and logs it
    MigrationConfig migration;

    public static SchedulerAppConfig fromEnv() {
        return SchedulerAppConfig.builder()
            .nodeId(getEnv("NODE_ID", "global-scheduler-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8081")))
            .globalScheduler(GlobalSchedulerConfig.fromEnv())
            .migration(MigrationConfig.fromEnv())
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
