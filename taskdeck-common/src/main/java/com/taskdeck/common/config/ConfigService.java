package com.taskdeck.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches taskdeck configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, TaskdeckConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public TaskdeckConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public TaskdeckConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private TaskdeckConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new TaskdeckConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            TaskdeckConfig config = objectMapper.readValue(raw, TaskdeckConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new TaskdeckConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill in every section that the file left out.
     */
    static TaskdeckConfig applyDefaults(TaskdeckConfig config) {
        if (config.getScheduler() == null) {
            config.setScheduler(new TaskdeckConfig.SchedulerConfig());
        }
        if (config.getAgent() == null) {
            config.setAgent(new TaskdeckConfig.AgentConfig());
        }
        if (config.getWebhook() == null) {
            config.setWebhook(new TaskdeckConfig.WebhookConfig());
        }
        if (config.getStore() == null) {
            config.setStore(new TaskdeckConfig.StoreConfig());
        }
        if (config.getAgents() == null) {
            config.setAgents(new ArrayList<>());
        }
        config.getAgents().removeIf(agent -> {
            boolean unnamed = agent == null || agent.getId() == null || agent.getId().isBlank();
            if (unnamed) {
                log.warn("Ignoring agent profile without an id");
            }
            return unnamed;
        });
        TaskdeckConfig.SchedulerConfig scheduler = config.getScheduler();
        if (scheduler.getBatchSize() <= 0) {
            log.warn("scheduler.batchSize must be positive, using 5");
            scheduler.setBatchSize(5);
        }
        if (scheduler.getFailureThreshold() <= 0) {
            log.warn("scheduler.failureThreshold must be positive, using 3");
            scheduler.setFailureThreshold(3);
        }
        if (scheduler.getCronSecret() != null && scheduler.getCronSecret().isBlank()) {
            scheduler.setCronSecret(null);
        }
        return config;
    }
}
