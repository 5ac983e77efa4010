package com.whereq.scribe.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Scribe.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "scribe")
@Data
public class ScribeProperties {

    /**
     * Where jobs, the queue and status channels live.
     */
    private Backend backend = Backend.REDIS;

    private StoreConfig store = new StoreConfig();

    private QueueConfig queue = new QueueConfig();

    private WorkerConfig worker = new WorkerConfig();

    private ReconcileConfig reconcile = new ReconcileConfig();

    private StorageConfig storage = new StorageConfig();

    @Data
    public static class StoreConfig {
        /**
         * Lifetime of a job record, counted from creation.
         */
        private Duration ttl = Duration.ofDays(7);

        /**
         * Terminal jobs completed longer ago than this are swept.
         */
        private int retentionDays = 7;

        /**
         * How often the retention sweep runs.
         */
        private Duration sweepInterval = Duration.ofHours(1);

        /**
         * Upper bound on records held by the in-memory backend.
         */
        private long maxInMemoryJobs = 10_000;
    }

    @Data
    public static class QueueConfig {
        /**
         * Submissions are rejected while this many ids are pending.
         */
        private long maxSize = 1000;

        /**
         * How often the queue size gauge is refreshed.
         */
        private Duration monitorInterval = Duration.ofSeconds(10);
    }

    @Data
    public static class WorkerConfig {
        /**
         * Run workers in this process.
         * API-only nodes set this to false.
         */
        private boolean enabled = true;

        /**
         * Number of worker threads.
         */
        private int count = 1;

        /**
         * Longest blocking wait on the queue before re-checking for shutdown.
         * At least one second with the Redis backend.
         */
        private Duration pollTimeout = Duration.ofSeconds(5);

        /**
         * Pause after a store or queue failure.
         */
        private Duration errorBackoff = Duration.ofSeconds(5);

        /**
         * How long shutdown waits for in-flight jobs.
         */
        private Duration shutdownTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class ReconcileConfig {
        /**
         * Re-enqueue QUEUED jobs that are missing from the queue.
         */
        private boolean enabled = true;

        private Duration interval = Duration.ofMinutes(5);

        /**
         * Only jobs created longer ago than this are checked, so in-flight
         * submissions and fresh claims are left alone.
         */
        private Duration gracePeriod = Duration.ofMinutes(10);

        /**
         * Maximum number of QUEUED jobs examined per run.
         */
        private int scanLimit = 10_000;
    }

    @Data
    public static class StorageConfig {
        /**
         * Directory holding uploaded audio until a worker is done with it.
         * Must be shared by every API and worker process.
         */
        private String directory = System.getProperty("java.io.tmpdir") + "/scribe-audio";
    }

    public enum Backend {
        /**
         * Redis hashes, list and pub/sub. Workers may run in several processes.
         */
        REDIS,

        /**
         * In-process structures. Single process only, nothing survives a restart.
         */
        MEMORY
    }
}
