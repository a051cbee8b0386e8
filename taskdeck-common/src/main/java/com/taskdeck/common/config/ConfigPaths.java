package com.taskdeck.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory, config file and job store file.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    private static final String STATE_DIRNAME = ".taskdeck";
    private static final String CONFIG_FILENAME = "taskdeck.json";
    private static final String STORE_FILENAME = "scheduled-jobs.json";

    /**
     * State directory for mutable data (job store, logs).
     * Can be overridden via TASKDECK_STATE_DIR.
     * Default: ~/.taskdeck
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), System.getProperty("user.home"));
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "TASKDECK_STATE_DIR");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    /**
     * Config file path. TASKDECK_CONFIG wins over the state directory default.
     */
    public static Path resolveConfigPath(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "TASKDECK_CONFIG");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return resolveStateDir(env, homedir).resolve(CONFIG_FILENAME);
    }

    public static Path resolveConfigPath() {
        return resolveConfigPath(System.getenv(), System.getProperty("user.home"));
    }

    /**
     * Job store path: the configured value if present, else
     * {@code <stateDir>/scheduled-jobs.json}.
     */
    public static Path resolveStorePath(TaskdeckConfig config) {
        if (config != null && config.getStore() != null) {
            String configured = config.getStore().getPath();
            if (configured != null && !configured.isBlank()) {
                return resolveUserPath(configured.trim(), System.getProperty("user.home"));
            }
        }
        return resolveStateDir().resolve(STORE_FILENAME);
    }

    static Path resolveUserPath(String input, String homedir) {
        if (input.startsWith("~")) {
            return Path.of(homedir + input.substring(1)).normalize();
        }
        return Path.of(input).toAbsolutePath().normalize();
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
