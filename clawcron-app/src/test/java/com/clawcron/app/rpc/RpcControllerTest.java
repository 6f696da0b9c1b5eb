package com.clawcron.app.rpc;

import com.clawcron.app.ClawCronApplication;
import com.clawcron.app.bridge.HeartbeatBridge;
import com.clawcron.app.bridge.SystemEventQueue;
import com.clawcron.app.bridge.UnconfiguredAgentTurnRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application on a random port and drives the cron service over
 * {@code POST /rpc}.
 */
@SpringBootTest(classes = ClawCronApplication.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RpcControllerTest {

    private static final Path STATE_DIR = createStateDir();

    @DynamicPropertySource
    static void stateDir(DynamicPropertyRegistry registry) {
        registry.add("clawcron.state.dir", STATE_DIR::toString);
        registry.add("clawcron.config.path", () -> STATE_DIR.resolve("clawcron.json").toString());
    }

    private static Path createStateDir() {
        try {
            return Files.createTempDirectory("clawcron-app-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SystemEventQueue systemEvents;

    @Autowired
    private HeartbeatBridge heartbeat;

    private ResponseEntity<JsonNode> call(String method, String params) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = objectMapper.writeValueAsString(
                Map.of("method", method, "params", objectMapper.readTree(params)));
        return rest.postForEntity("/rpc", new HttpEntity<>(body, headers), JsonNode.class);
    }

    private JsonNode payload(String method, String params) throws IOException {
        ResponseEntity<JsonNode> response = call(method, params);
        assertEquals(HttpStatus.OK, response.getStatusCode(), () -> method + ": " + response.getBody());
        assertTrue(response.getBody().get("ok").asBoolean());
        return response.getBody().get("payload");
    }

    @Test
    void status_reportsStoreUnderStateDir() throws IOException {
        JsonNode status = payload("cron.status", "{}");
        assertTrue(status.get("enabled").asBoolean());
        assertEquals(STATE_DIR.resolve("cron").resolve("jobs.json").toAbsolutePath().toString(),
                Path.of(status.get("storePath").asText()).toAbsolutePath().toString());
    }

    @Test
    void methods_listsCronMethods() {
        JsonNode methods = rest.getForObject("/rpc/methods", JsonNode.class);
        assertTrue(methods.get("methods").toString().contains("cron.add"));
        assertTrue(methods.get("methods").toString().contains("cron.runs"));
    }

    @Test
    void nextHeartbeatJob_queuesSystemEvent() throws IOException {
        JsonNode job = payload("cron.add", """
                {"name": "queued", "agentId": "ops", "schedule": {"kind": "every", "everyMs": 3600000},
                 "sessionTarget": "main", "payload": {"kind": "systemEvent", "text": "check the backups"}}
                """);
        String id = job.get("id").asText();
        assertNotNull(job.get("state").get("nextRunAtMs"));

        JsonNode run = payload("cron.run", "{\"id\": \"%s\"}".formatted(id));
        assertTrue(run.get("ran").asBoolean());
        assertEquals(List.of("check the backups"), systemEvents.peek("ops"));

        JsonNode runs = payload("cron.runs", "{\"id\": \"%s\"}".formatted(id));
        assertEquals(1, runs.get("entries").size());
        assertEquals("ok", runs.get("entries").get(0).get("status").asText());

        assertTrue(payload("cron.remove", "{\"id\": \"%s\"}".formatted(id)).get("removed").asBoolean());
        systemEvents.drain("ops");
    }

    @Test
    void wakeNowJob_isDeliveredByHeartbeat() throws IOException {
        JsonNode job = payload("cron.add", """
                {"name": "urgent", "agentId": "pager", "schedule": {"kind": "every", "everyMs": 3600000},
                 "sessionTarget": "main", "wakeMode": "now",
                 "payload": {"kind": "systemEvent", "text": "disk almost full"}}
                """);
        String id = job.get("id").asText();

        JsonNode run = payload("cron.run", "{\"id\": \"%s\"}".formatted(id));
        assertTrue(run.get("ran").asBoolean());
        List<SystemEventQueue.SystemEvent> delivered = heartbeat.getLastDelivered().get("pager");
        assertNotNull(delivered);
        assertEquals("disk almost full", delivered.get(0).text());
        assertTrue(systemEvents.peek("pager").isEmpty());

        payload("cron.remove", "{\"id\": \"%s\"}".formatted(id));
    }

    @Test
    void isolatedJob_postsErrorWithoutAgentRuntime() throws IOException {
        JsonNode job = payload("cron.add", """
                {"name": "report", "agentId": "reports", "schedule": {"kind": "every", "everyMs": 3600000},
                 "sessionTarget": "isolated", "payload": {"kind": "agentTurn", "message": "summarize"}}
                """);
        String id = job.get("id").asText();

        JsonNode run = payload("cron.run", "{\"id\": \"%s\"}".formatted(id));
        assertTrue(run.get("ran").asBoolean());
        assertEquals("error", run.get("job").get("state").get("lastStatus").asText());
        assertEquals(List.of("Cron (error): " + UnconfiguredAgentTurnRunner.ERROR), systemEvents.peek("reports"));

        payload("cron.remove", "{\"id\": \"%s\"}".formatted(id));
        systemEvents.drain("reports");
    }

    @Test
    void invalidAdd_isBadRequest() throws IOException {
        ResponseEntity<JsonNode> response = call("cron.add", """
                {"name": "broken", "schedule": {"kind": "cron", "expr": "not a cron"},
                 "sessionTarget": "main", "payload": {"kind": "systemEvent", "text": "x"}}
                """);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertFalse(response.getBody().get("ok").asBoolean());
        assertEquals("INVALID_REQUEST", response.getBody().get("error").get("code").asText());
    }

    @Test
    void unknownMethod_isNotFound() throws IOException {
        ResponseEntity<JsonNode> response = call("cron.nope", "{}");
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("NOT_FOUND", response.getBody().get("error").get("code").asText());
    }
}
