package com.example.sandstormtracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the ingestion engine.
 * The server list is consumed as-is; loading and validating it is the job of whoever
 * writes the configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "tracker")
@Data
public class TrackerConfig {

    /**
     * Start all enabled pipelines when the application context comes up.
     */
    private boolean autostart = true;

    private List<ServerEntry> servers = new ArrayList<>();

    private Tailer tailer = new Tailer();

    private Query query = new Query();

    private Matching matching = new Matching();

    private Aggregation aggregation = new Aggregation();

    @Data
    public static class ServerEntry {
        private String name;
        private String logPath;
        private boolean enabled = true;
        /**
         * A2S query endpoint as host:port. Polling is skipped when empty.
         */
        private String queryAddress;
    }

    @Data
    public static class Tailer {
        private long pollIntervalMs = 500;
        private long missingFileMaxBackoffMs = 30_000;
        private int flushEveryLines = 200;
        private int queueCapacity = 1_000;
    }

    @Data
    public static class Query {
        private long intervalMs = 30_000;
        private int timeoutMs = 2_000;
        private int maxRetries = 2;
        private long initialBackoffMs = 250;
        private long fragmentTimeoutMs = 5_000;
    }

    @Data
    public static class Matching {
        private int missingSnapshotThreshold = 3;
        private long identityWindowSeconds = 30;
    }

    @Data
    public static class Aggregation {
        private int recentKeyWindow = 10_000;
        private int maxTransactionAttempts = 3;
        /**
         * Failed store writes held per server before the tracker stops reading its queue
         * and retries until the store recovers.
         */
        private int maxPendingWrites = 1_000;
        private long pendingRetryBackoffMs = 500;
        private long pendingRetryMaxBackoffMs = 30_000;
    }
}
