package com.taskdeck.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("taskdeck.json");
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "scheduler": {
                    "batchSize": 10,
                    "failureThreshold": 4,
                    "cronSecret": "s3cret"
                  },
                  "agent": {
                    "maxToolSteps": 12
                  }
                }
                """;
        Files.writeString(configPath, json);

        TaskdeckConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(10, config.getScheduler().getBatchSize());
        assertEquals(4, config.getScheduler().getFailureThreshold());
        assertEquals("s3cret", config.getScheduler().getCronSecret());
        assertEquals(12, config.getAgent().getMaxToolSteps());
        // untouched fields keep their defaults
        assertEquals(30, config.getScheduler().getLeaseMinutes());
        assertEquals(100_000, config.getAgent().getMaxTokens());
    }

    @Test
    void loadConfig_readsAgentProfiles() throws IOException {
        Files.writeString(configPath, """
                {
                  "agents": [
                    { "id": "agent-ada", "name": "Ada", "ownerName": "Sam", "timezone": "Europe/Berlin",
                      "persona": "Terse and practical." },
                    { "name": "No id" }
                  ]
                }
                """);

        TaskdeckConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(1, config.getAgents().size());
        TaskdeckConfig.AgentProfileConfig ada = config.getAgents().get(0);
        assertEquals("agent-ada", ada.getId());
        assertEquals("Sam", ada.getOwnerName());
        assertEquals("Europe/Berlin", ada.getTimezone());
        assertEquals("Terse and practical.", ada.getPersona());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        TaskdeckConfig config = new ConfigService(tempDir.resolve("nonexistent.json")).loadConfig();

        assertNotNull(config.getScheduler());
        assertNotNull(config.getWebhook());
        assertNotNull(config.getStore());
        assertEquals(5, config.getScheduler().getBatchSize());
        assertEquals(25, config.getAgent().getMaxToolSteps());
        assertNull(config.getScheduler().getCronSecret());
        assertTrue(config.getAgents().isEmpty());
    }

    @Test
    void loadConfig_substitutesEnvironment() throws IOException {
        Files.writeString(configPath, """
                { "agent": { "apiKey": "${TEST_KEY}", "model": "${TEST_MODEL:-fallback-model}" } }
                """);

        ConfigService service = new ConfigService(configPath, Duration.ofSeconds(1),
                Map.of("TEST_KEY", "key-123"));
        TaskdeckConfig config = service.loadConfig();

        assertEquals("key-123", config.getAgent().getApiKey());
        assertEquals("fallback-model", config.getAgent().getModel());
    }

    @Test
    void loadConfig_invalidValuesAreReplaced() throws IOException {
        Files.writeString(configPath, """
                { "scheduler": { "batchSize": 0, "failureThreshold": -1, "cronSecret": "  " } }
                """);

        TaskdeckConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(5, config.getScheduler().getBatchSize());
        assertEquals(3, config.getScheduler().getFailureThreshold());
        assertNull(config.getScheduler().getCronSecret());
    }

    @Test
    void loadConfig_malformedJson_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        TaskdeckConfig config = new ConfigService(configPath).loadConfig();

        assertEquals(5, config.getScheduler().getBatchSize());
    }

    @Test
    void loadConfig_isCachedUntilReload() throws IOException {
        Files.writeString(configPath, """
                { "scheduler": { "batchSize": 7 } }
                """);
        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(5), Map.of());

        TaskdeckConfig first = service.loadConfig();
        Files.writeString(configPath, """
                { "scheduler": { "batchSize": 9 } }
                """);

        assertSame(first, service.loadConfig());
        assertEquals(9, service.reloadConfig().getScheduler().getBatchSize());
    }
}
