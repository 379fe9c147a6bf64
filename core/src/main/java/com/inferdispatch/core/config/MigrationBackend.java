package com.inferdispatch.core.config;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Transport used by the live-migration subsystem to move request state between instances.
 */
public enum MigrationBackend {
    /**
     * Point-to-point gRPC transfer; needs a server address.
     */
    GRPC("grpc"),

    /**
     * KV-cache transfer engine located through a naming service; needs a naming URL.
     */
    KV_TRANSFER("kv-transfer");

    private final String configName;

    MigrationBackend(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static MigrationBackend fromConfigName(String name) {
        for (MigrationBackend backend : values()) {
            if (backend.configName.equals(name)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown migration backend '" + name + "', expected one of "
            + Arrays.stream(values()).map(MigrationBackend::getConfigName).collect(Collectors.joining(", ")));
    }
}
