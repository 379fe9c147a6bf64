package com.inferdispatch.core.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration of the staged live-migration protocol.
 * <p>
 * Migration itself runs outside the dispatch scheduler. A migration copies at most
 * {@code migrationBufferBlocks} blocks per round, {@code migrationNumLayers} layers at a time,
 * and must converge within {@code maxStages} rounds; the final stop-and-copy round may move at
 * most {@code lastStageMaxBlocks} blocks.
 * </p>
 */
@Value
public class MigrationConfig {

    String requestMigrationPolicy;
    MigrationBackend migrationBackend;
    String migrationBackendTransferType;
    int migrationBufferBlocks;
    int migrationNumLayers;
    int lastStageMaxBlocks;
    int maxStages;
    Duration migrationBackendInitTimeout;
    String grpcMigrationBackendServerAddress;
    String kvtransferMigrationBackendNamingUrl;

    @Builder(toBuilder = true)
    private MigrationConfig(String requestMigrationPolicy,
                            MigrationBackend migrationBackend,
                            String migrationBackendTransferType,
                            int migrationBufferBlocks,
                            int migrationNumLayers,
                            int lastStageMaxBlocks,
                            int maxStages,
                            Duration migrationBackendInitTimeout,
                            String grpcMigrationBackendServerAddress,
                            String kvtransferMigrationBackendNamingUrl) {
        requirePositive("migrationBufferBlocks", migrationBufferBlocks);
        requirePositive("migrationNumLayers", migrationNumLayers);
        requirePositive("lastStageMaxBlocks", lastStageMaxBlocks);
        requirePositive("maxStages", maxStages);
        if (migrationBackend == null) {
            throw new IllegalArgumentException("migrationBackend is required");
        }
        if (migrationBackendInitTimeout == null
            || migrationBackendInitTimeout.isZero() || migrationBackendInitTimeout.isNegative()) {
            throw new IllegalArgumentException("migrationBackendInitTimeout must be positive, got "
                + migrationBackendInitTimeout);
        }
        if (migrationBackend == MigrationBackend.GRPC && isBlank(grpcMigrationBackendServerAddress)) {
            throw new IllegalArgumentException("grpc migration backend requires a server address");
        }
        if (migrationBackend == MigrationBackend.KV_TRANSFER && isBlank(kvtransferMigrationBackendNamingUrl)) {
            throw new IllegalArgumentException("kv-transfer migration backend requires a naming url");
        }

        this.requestMigrationPolicy = requestMigrationPolicy;
        this.migrationBackend = migrationBackend;
        this.migrationBackendTransferType = migrationBackendTransferType == null ? "" : migrationBackendTransferType;
        this.migrationBufferBlocks = migrationBufferBlocks;
        this.migrationNumLayers = migrationNumLayers;
        this.lastStageMaxBlocks = lastStageMaxBlocks;
        this.maxStages = maxStages;
        this.migrationBackendInitTimeout = migrationBackendInitTimeout;
        this.grpcMigrationBackendServerAddress =
            grpcMigrationBackendServerAddress == null ? "" : grpcMigrationBackendServerAddress;
        this.kvtransferMigrationBackendNamingUrl =
            kvtransferMigrationBackendNamingUrl == null ? "" : kvtransferMigrationBackendNamingUrl;
    }

    public static MigrationConfig fromEnv() {
        double initTimeoutSec = Double.parseDouble(getEnv("MIGRATION_BACKEND_INIT_TIMEOUT", "10.0"));
        return MigrationConfig.builder()
            .requestMigrationPolicy(getEnv("REQUEST_MIGRATION_POLICY", "SR"))
            .migrationBackend(MigrationBackend.fromConfigName(getEnv("MIGRATION_BACKEND", "grpc")))
            .migrationBackendTransferType(getEnv("MIGRATION_BACKEND_TRANSFER_TYPE", ""))
            .migrationBufferBlocks(Integer.parseInt(getEnv("MIGRATION_BUFFER_BLOCKS", "32")))
            .migrationNumLayers(Integer.parseInt(getEnv("MIGRATION_NUM_LAYERS", "1")))
            .lastStageMaxBlocks(Integer.parseInt(getEnv("LAST_STAGE_MAX_BLOCKS", "16")))
            .maxStages(Integer.parseInt(getEnv("MAX_STAGES", "3")))
            .migrationBackendInitTimeout(Duration.ofMillis(Math.round(initTimeoutSec * 1000)))
            .grpcMigrationBackendServerAddress(getEnv("GRPC_MIGRATION_BACKEND_SERVER_ADDRESS", "127.0.0.1:50051"))
            .kvtransferMigrationBackendNamingUrl(getEnv("KVTRANSFER_MIGRATION_BACKEND_NAMING_URL", ""))
            .build();
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
