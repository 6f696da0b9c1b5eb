package com.clawcron.gateway.cron;

import com.clawcron.common.infra.JsonFile;
import com.clawcron.common.infra.StoreLock;
import com.clawcron.gateway.cron.CronTypes.CronPayload;
import com.clawcron.gateway.cron.CronTypes.CronSchedule;
import com.clawcron.gateway.cron.CronTypes.RunStatus;
import com.clawcron.gateway.cron.CronTypes.ScheduleKind;
import com.clawcron.gateway.cron.CronTypes.SessionTarget;
import com.clawcron.gateway.cron.CronTypes.WakeMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CronStore}.
 */
class CronStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path storePath;

    @BeforeEach
    void setUp() {
        storePath = tempDir.resolve("cron/jobs.json");
    }

    private void writeStore(String json) throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, json, StandardCharsets.UTF_8);
    }

    private CronStore.Snapshot load() throws IOException {
        return CronStore.load(storePath, StoreLock.Options.DEFAULTS);
    }

    private static CronJob job(String id, String text) {
        return CronJob.builder()
                .id(id)
                .name("job " + id)
                .createdAtMs(1)
                .updatedAtMs(1)
                .schedule(CronSchedule.every(60_000L, null))
                .sessionTarget(SessionTarget.MAIN)
                .wakeMode(WakeMode.NEXT_HEARTBEAT)
                .payload(CronPayload.systemEvent(text))
                .build();
    }

    @Test
    void missingFile_isEmptyStore() throws IOException {
        CronStore.Snapshot snapshot = load();
        assertTrue(snapshot.jobs().isEmpty());
        assertFalse(snapshot.migrated());
        assertNull(snapshot.mtime());
    }

    @Test
    void saveThenLoad_keepsJobsAndReleasesLock() throws IOException {
        CronStore.save(storePath, List.of(job("a", "hello"), job("b", "world")), List.of(), StoreLock.Options.DEFAULTS);

        JsonNode root = JsonFile.readTree(storePath);
        assertEquals(1, root.get("version").asInt());
        assertEquals(2, root.get("jobs").size());
        assertFalse(Files.exists(StoreLock.lockPathFor(StoreLock.resolveRealPath(storePath))));

        CronStore.Snapshot snapshot = load();
        assertEquals(List.of("a", "b"), snapshot.jobs().stream().map(CronJob::getId).toList());
        assertEquals("hello", snapshot.jobs().get(0).getPayload().getText());
        assertFalse(snapshot.migrated());
        assertNotNull(snapshot.mtime());
    }

    @Test
    void malformedJson_throws() throws IOException {
        writeStore("{ not json");
        assertThrows(IOException.class, this::load);
    }

    @Test
    void unrecognizedShape_throws() throws IOException {
        writeStore("{\"version\": 1, \"jobs\": 42}");
        assertThrows(IOException.class, this::load);
    }

    @Test
    void bareArray_isMigrated() throws IOException {
        writeStore(MAPPER.writeValueAsString(List.of(job("a", "hello"))));
        CronStore.Snapshot snapshot = load();
        assertTrue(snapshot.migrated());
        assertEquals(1, snapshot.jobs().size());
    }

    @Test
    void jobsKeyedById_takeIdFromKey() throws IOException {
        writeStore("""
                {"jobs": {"legacy-1": {"name": "x", "schedule": {"everyMs": 1000},
                  "payload": {"text": "hi"}}}}
                """);
        CronStore.Snapshot snapshot = load();
        assertTrue(snapshot.migrated());
        CronJob loaded = snapshot.jobs().get(0);
        assertEquals("legacy-1", loaded.getId());
        assertEquals(ScheduleKind.EVERY, loaded.getSchedule().getKind());
        assertEquals(SessionTarget.MAIN, loaded.getSessionTarget());
        assertEquals(WakeMode.NEXT_HEARTBEAT, loaded.getWakeMode());
        assertTrue(loaded.isEnabled());
    }

    @Test
    void legacyProvider_becomesCanonicalChannel_andReloadIsNoOp() throws IOException {
        writeStore("""
                {"version": 1, "jobs": [{
                  "id": "j1", "name": "digest", "enabled": true, "createdAtMs": 1, "updatedAtMs": 1,
                  "schedule": {"kind": "every", "everyMs": 60000},
                  "sessionTarget": "isolated", "wakeMode": "now",
                  "payload": {"kind": "agentTurn", "message": "hi", "provider": " TeLeGrAm "},
                  "state": {}
                }]}
                """);
        CronStore.Snapshot first = load();
        assertTrue(first.migrated());
        assertEquals("telegram", first.jobs().get(0).getPayload().getChannel());

        CronStore.save(storePath, first.jobs(), first.unreadable(), StoreLock.Options.DEFAULTS);
        JsonNode payload = JsonFile.readTree(storePath).get("jobs").get(0).get("payload");
        assertEquals("telegram", payload.get("channel").asText());
        assertFalse(payload.has("provider"));

        CronStore.Snapshot second = load();
        assertFalse(second.migrated());
        assertEquals("telegram", second.jobs().get(0).getPayload().getChannel());
    }

    @Test
    void legacyAtString_becomesAtMs() throws IOException {
        writeStore("""
                {"version": 1, "jobs": [{"id": "once", "name": "once",
                  "schedule": {"at": "2024-01-01T12:00:00Z"}, "payload": {"text": "hi"}}]}
                """);
        CronJob loaded = load().jobs().get(0);
        assertEquals(ScheduleKind.AT, loaded.getSchedule().getKind());
        assertEquals(1704110400000L, loaded.getSchedule().getAtMs());
    }

    @Test
    void invalidPairing_isKeptButMarkedSkipped() throws IOException {
        writeStore("""
                {"version": 1, "jobs": [{"id": "bad", "name": "bad", "enabled": true,
                  "schedule": {"kind": "every", "everyMs": 1000},
                  "sessionTarget": "main", "wakeMode": "now",
                  "payload": {"kind": "agentTurn", "message": "nope"},
                  "state": {"nextRunAtMs": 5}}]}
                """);
        CronStore.Snapshot snapshot = load();
        CronJob bad = snapshot.jobs().get(0);
        assertEquals(RunStatus.SKIPPED, bad.getState().getLastStatus());
        assertTrue(bad.getState().getLastError().contains("main job requires"));
        assertNull(bad.getState().getNextRunAtMs());
        assertTrue(snapshot.migrated());

        CronStore.save(storePath, snapshot.jobs(), snapshot.unreadable(), StoreLock.Options.DEFAULTS);
        assertFalse(load().migrated());
    }

    @Test
    void unreadableEntries_survivePersist() throws IOException {
        writeStore("""
                {"version": 1, "jobs": [
                  {"id": "ok", "name": "ok", "enabled": true, "schedule": {"kind": "every", "everyMs": 1000},
                   "sessionTarget": "main", "wakeMode": "now", "payload": {"kind": "systemEvent", "text": "hi"},
                   "state": {}},
                  {"name": "no id"},
                  {"id": "weird", "schedule": {"kind": "sometimes"}, "payload": {"text": "x"}}
                ]}
                """);
        CronStore.Snapshot snapshot = load();
        assertEquals(1, snapshot.jobs().size());
        assertEquals(2, snapshot.unreadable().size());

        CronStore.save(storePath, snapshot.jobs(), snapshot.unreadable(), StoreLock.Options.DEFAULTS);
        JsonNode jobs = JsonFile.readTree(storePath).get("jobs");
        assertEquals(3, jobs.size());
        assertEquals("no id", jobs.get(1).get("name").asText());
        assertEquals("sometimes", jobs.get(2).get("schedule").get("kind").asText());
    }

    @Test
    void migrateJob_isIdempotent() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", "x");
        node.putObject("schedule").put("everyMs", 1000);
        node.putObject("payload").put("message", "hi").put("provider", "Slack");

        assertTrue(CronStore.migrateJob(node));
        assertEquals("every", node.get("schedule").get("kind").asText());
        assertEquals("agentTurn", node.get("payload").get("kind").asText());
        assertEquals("slack", node.get("payload").get("channel").asText());
        assertEquals("isolated", node.get("sessionTarget").asText());
        assertFalse(CronStore.migrateJob(node));
    }
}
