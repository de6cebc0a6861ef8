package com.lhcz.pgcdc.config;

import java.util.List;

/**
 * 应用配置记录类 (application.yaml)
 * <p>
 * 可选项为 null 时使用各记录中的默认值。
 */
public record AppConfig(String mode,
                        DbConfig source,
                        DestinationConfig destination,
                        ReplicationConfig replication,
                        FlushConfig flush,
                        ApplyConfig apply,
                        WebConfig web) {

    public record DbConfig(
            String url,
            String user,
            String password,
            Integer maxLifetimeMs,  // 最大存活时间
            Integer idleTimeoutMs,  // 空闲回收时间
            Integer minIdle,        // 最小空闲连接数
            Integer maxPoolSize     // 最大连接数
    ) {}

    public record DestinationConfig(
            String url,
            String user,
            String password,
            String dialect,         // postgres | databricks
            String catalog,         // 可选，三段式命名的 catalog
            String schema,          // 目标 schema (dataset)，如 bronze
            String stagingDir,      // 本地暂存目录
            Integer maxPoolSize
    ) {
        public String schemaOrDefault() {
            return schema != null && !schema.isBlank() ? schema : "bronze";
        }

        public String stagingDirOrDefault() {
            return stagingDir != null && !stagingDir.isBlank() ? stagingDir : "staging";
        }
    }

    public record ReplicationConfig(
            String slotName,
            String publicationName,
            String schema,              // 源端 schema，默认 public
            List<String> tables,        // 为空时自动发现 schema 下所有表
            Long statusIntervalMs,      // 进度确认间隔
            Long reconnectBackoffMs,
            Long maxReconnectBackoffMs,
            Boolean requireBackfill,    // CDC 模式下要求表已完成全量
            Integer snapshotPageSize
    ) {
        public String slotNameOrDefault() {
            return slotName != null && !slotName.isBlank() ? slotName : "pgcdc_slot";
        }

        public String publicationNameOrDefault() {
            return publicationName != null && !publicationName.isBlank() ? publicationName : "pgcdc_pub";
        }

        public String schemaOrDefault() {
            return schema != null && !schema.isBlank() ? schema : "public";
        }

        public long statusIntervalMsOrDefault() {
            return statusIntervalMs != null ? statusIntervalMs : 10_000L;
        }

        public long reconnectBackoffMsOrDefault() {
            return reconnectBackoffMs != null ? reconnectBackoffMs : 1_000L;
        }

        public long maxReconnectBackoffMsOrDefault() {
            return maxReconnectBackoffMs != null ? maxReconnectBackoffMs : 60_000L;
        }

        public boolean requireBackfillOrDefault() {
            return requireBackfill == null || requireBackfill;
        }

        public int snapshotPageSizeOrDefault() {
            return snapshotPageSize != null ? snapshotPageSize : 5000;
        }
    }

    public record FlushConfig(Integer maxRows, Long maxBytes, Long intervalMs) {
        public static final FlushConfig DEFAULT = new FlushConfig(null, null, null);

        public int maxRowsOrDefault() {
            return maxRows != null ? maxRows : 5000;
        }

        public long maxBytesOrDefault() {
            return maxBytes != null ? maxBytes : 16L * 1024 * 1024;
        }

        public long intervalMsOrDefault() {
            return intervalMs != null ? intervalMs : 10_000L;
        }
    }

    public record ApplyConfig(Integer workers, Integer maxRetries, Long backoffMs, String failedDir) {
        public static final ApplyConfig DEFAULT = new ApplyConfig(null, null, null, null);

        public int workersOrDefault() {
            return workers != null ? workers : 4;
        }

        public int maxRetriesOrDefault() {
            return maxRetries != null ? maxRetries : 3;
        }

        public long backoffMsOrDefault() {
            return backoffMs != null ? backoffMs : 1000L;
        }

        public String failedDirOrDefault() {
            return failedDir != null && !failedDir.isBlank() ? failedDir : "failed_data";
        }
    }

    // Web 控制台配置
    public record WebConfig(Integer port) {}

    public ReplicationConfig replicationOrDefault() {
        return replication != null ? replication : new ReplicationConfig(null, null, null, null, null, null, null, null, null);
    }

    public FlushConfig flushOrDefault() {
        return flush != null ? flush : FlushConfig.DEFAULT;
    }

    public ApplyConfig applyOrDefault() {
        return apply != null ? apply : ApplyConfig.DEFAULT;
    }
}
