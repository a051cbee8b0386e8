package com.taskdeck.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskdeck.scheduler.ScheduledJobService;
import com.taskdeck.scheduler.model.JobTypes.JobStatus;
import com.taskdeck.scheduler.model.ScheduledJob;
import com.taskdeck.scheduler.store.JobStore;
import com.taskdeck.scheduler.workspace.AgentDirectory;
import com.taskdeck.scheduler.workspace.WorkspaceTypes.AgentProfile;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the trigger, job admin and health endpoints and the
 * configured agent directory.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TaskdeckApplicationTest {

    private static final String SECRET = "test-secret";
    private static final Path CONFIG = writeConfig();

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ScheduledJobService jobs;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private AgentDirectory agents;

    private final ObjectMapper mapper = new ObjectMapper();

    @DynamicPropertySource
    static void taskdeckConfig(DynamicPropertyRegistry registry) {
        registry.add("taskdeck.config", CONFIG::toString);
    }

    private static Path writeConfig() {
        try {
            Path dir = Files.createTempDirectory("taskdeck-test");
            Path config = dir.resolve("taskdeck.json");
            String store = dir.resolve("jobs.json").toString().replace("\\", "\\\\");
            Files.writeString(config, "{\n"
                    + "  \"scheduler\": {\"cronSecret\": \"" + SECRET + "\", \"pollingEnabled\": false},\n"
                    + "  \"store\": {\"path\": \"" + store + "\"},\n"
                    + "  \"agents\": [\n"
                    + "    {\"id\": \"agent-e2e\", \"name\": \"Eve\", \"ownerName\": \"Sam\",\n"
                    + "     \"timezone\": \"Europe/Berlin\", \"persona\": \"Brief and friendly.\"},\n"
                    + "    {\"id\": \"agent-admin\"}\n"
                    + "  ]\n"
                    + "}\n");
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void dispatcher_withoutToken_isUnauthorized() {
        ResponseEntity<String> response = restTemplate.postForEntity("/api/cron/dispatcher", null, String.class);

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
    }

    @Test
    void dispatcher_withWrongToken_isUnauthorized() {
        ResponseEntity<String> response = restTemplate.exchange("/api/cron/dispatcher", HttpMethod.GET,
                withToken("nope"), String.class);

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
    }

    @Test
    void dispatcher_withToken_runsDueReminder() throws Exception {
        ScheduledJob job = jobs.scheduleReminder("agent-e2e", "Call Bob", "Call Bob", Instant.now().minusSeconds(5),
                null, null);

        ResponseEntity<String> response = restTemplate.exchange("/api/cron/dispatcher", HttpMethod.POST,
                withToken(SECRET), String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = mapper.readTree(response.getBody());
        assertTrue(body.get("processedCount").asInt() >= 1);
        assertTrue(body.has("timestamp"));

        long deadline = System.currentTimeMillis() + 5000;
        while (jobStore.getJob(job.getId()).orElseThrow().getStatus() != JobStatus.COMPLETED
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(25);
        }
        assertEquals(JobStatus.COMPLETED, jobStore.getJob(job.getId()).orElseThrow().getStatus());
    }

    @Test
    void jobsApi_pausesAndReactivates() throws Exception {
        ScheduledJob job = jobs.scheduleReminder("agent-admin", "Standup", "Standup", null, "0 9 * * 1-5", null);

        ResponseEntity<String> paused = restTemplate.postForEntity("/api/jobs/" + job.getId() + "/pause", null,
                String.class);
        assertEquals(HttpStatus.OK, paused.getStatusCode());
        assertEquals("paused", mapper.readTree(paused.getBody()).get("status").asText());

        ResponseEntity<String> again = restTemplate.postForEntity("/api/jobs/" + job.getId() + "/pause", null,
                String.class);
        assertEquals(HttpStatus.CONFLICT, again.getStatusCode());

        ResponseEntity<String> reactivated = restTemplate.postForEntity(
                "/api/jobs/" + job.getId() + "/reactivate", null, String.class);
        assertEquals("active", mapper.readTree(reactivated.getBody()).get("status").asText());

        ResponseEntity<String> listed = restTemplate.getForEntity("/api/jobs?agentId=agent-admin&status=active",
                String.class);
        assertEquals(1, mapper.readTree(listed.getBody()).get("count").asInt());
    }

    @Test
    void agentDirectory_loadsConfiguredProfiles() {
        AgentProfile eve = agents.findAgent("agent-e2e").orElseThrow();
        assertEquals("Eve", eve.getName());
        assertEquals("Sam", eve.getOwnerName());
        assertEquals("Europe/Berlin", eve.getTimezone());
        assertEquals("Brief and friendly.", eve.getPersona());

        AgentProfile admin = agents.findAgent("agent-admin").orElseThrow();
        assertEquals("agent-admin", admin.getName());
        assertEquals("UTC", admin.getTimezone());

        assertTrue(agents.findAgent("agent-unknown").isEmpty());
    }

    @Test
    void jobsApi_unknownJob_isNotFound() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/jobs/missing", String.class);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void health_reportsSchedulerCounters() throws Exception {
        ResponseEntity<String> response = restTemplate.getForEntity("/health", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode body = mapper.readTree(response.getBody());
        assertEquals("ok", body.get("status").asText());
        assertTrue(body.get("scheduler").has("jobs"));
    }

    private static HttpEntity<Void> withToken(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        return new HttpEntity<>(headers);
    }
}
