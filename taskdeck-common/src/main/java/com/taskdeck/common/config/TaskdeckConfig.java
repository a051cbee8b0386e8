package com.taskdeck.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for taskdeck.
 * Every section is optional in the file; {@link ConfigService} fills in
 * defaults for whatever is missing.
 */
@Data
public class TaskdeckConfig {

    /** Poller, lease and circuit-breaker settings. */
    private SchedulerConfig scheduler;

    /** Bounded agent run settings. */
    private AgentConfig agent;

    /** Outbound webhook client settings. */
    private WebhookConfig webhook;

    /** Job store persistence. */
    private StoreConfig store;

    /** Profiles of the agents that jobs may run for. */
    private List<AgentProfileConfig> agents = new ArrayList<>();

    // --- Nested config types ---

    @Data
    public static class SchedulerConfig {
        /** Maximum jobs claimed per poll cycle. */
        private int batchSize = 5;
        /** How long a runner holds a job before another runner may reclaim it. */
        private int leaseMinutes = 30;
        /** Consecutive failures after which a job is paused. */
        private int failureThreshold = 3;
        private int pollIntervalSeconds = 300;
        private int workerThreads = 4;
        private boolean pollingEnabled = true;
        /** Bearer secret for the trigger endpoint; null leaves it open. */
        private String cronSecret;
        private String defaultTimezone = "UTC";
    }

    @Data
    public static class AgentConfig {
        private String model = "claude-sonnet-4-20250514";
        private int maxToolSteps = 25;
        private int maxTokens = 100_000;
        /** Per-call output cap passed to the model. */
        private int maxOutputTokens = 4096;
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class WebhookConfig {
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;
    }

    @Data
    public static class AgentProfileConfig {
        private String id;
        /** Display name; the id when absent. */
        private String name;
        private String ownerName;
        /** The scheduler's default timezone when absent. */
        private String timezone;
        private String email;
        private String persona;
    }

    @Data
    public static class StoreConfig {
        /** Path of the JSON job store; defaults to the state directory. */
        private String path;
    }
}
