package com.clawcron.gateway.cron;

import com.clawcron.common.infra.JsonFile;
import com.clawcron.common.infra.StoreLock;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Cron store persistence: load with migration and validation, atomic save.
 * Every read and write holds the {@link StoreLock} for the store path.
 */
@Slf4j
public final class CronStore {

    private CronStore() {
    }

    public static final int VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Loaded store contents.
     *
     * @param jobs       bound jobs, invalid ones marked skipped
     * @param unreadable raw entries that could not be bound, kept for write-back
     * @param migrated   whether anything changed relative to the file
     * @param mtime      file modification time at load, null when missing
     */
    public record Snapshot(int version, List<CronJob> jobs, List<JsonNode> unreadable,
            boolean migrated, FileTime mtime) {

        public static Snapshot empty() {
            return new Snapshot(VERSION, new ArrayList<>(), new ArrayList<>(), false, null);
        }
    }

    /**
     * Load the store. A missing file is an empty store; malformed top-level
     * JSON is an {@link IOException}.
     */
    public static Snapshot load(Path storePath, StoreLock.Options lockOptions) throws IOException {
        try (StoreLock.HeldLock lock = StoreLock.acquire(storePath, lockOptions)) {
            FileTime mtime = JsonFile.modifiedTime(storePath);
            JsonNode root = JsonFile.readTree(storePath);
            if (root == null) {
                log.debug("cron: store not found: {}", storePath);
                return new Snapshot(VERSION, new ArrayList<>(), new ArrayList<>(), false, mtime);
            }

            boolean migrated = false;
            int version = VERSION;
            Map<String, JsonNode> entries = new LinkedHashMap<>();
            List<JsonNode> order = new ArrayList<>();
            if (root.isArray()) {
                // Legacy: bare array of jobs
                root.forEach(order::add);
                migrated = true;
            } else if (root.isObject() && root.get("jobs") != null && root.get("jobs").isArray()) {
                root.get("jobs").forEach(order::add);
                if (root.path("version").isInt()) {
                    version = root.get("version").asInt();
                }
                if (version != VERSION) {
                    migrated = true;
                }
            } else if (root.isObject() && root.get("jobs") != null && root.get("jobs").isObject()) {
                // Legacy: jobs keyed by id
                collectKeyed(root.get("jobs"), entries);
                order.addAll(entries.values());
                migrated = true;
            } else if (root.isObject() && !root.has("jobs") && !root.has("version")) {
                // Legacy: flat map of id to job
                collectKeyed(root, entries);
                order.addAll(entries.values());
                migrated = !order.isEmpty();
            } else {
                throw new IOException("unrecognized cron store format: " + storePath);
            }

            List<CronJob> jobs = new ArrayList<>();
            List<JsonNode> unreadable = new ArrayList<>();
            for (JsonNode raw : order) {
                if (!raw.isObject()) {
                    log.warn("cron: keeping unreadable store entry (not an object)");
                    unreadable.add(raw);
                    continue;
                }
                ObjectNode node = raw.deepCopy();
                boolean changed = migrateJob(node);
                CronJob job = bind(node);
                if (job == null) {
                    unreadable.add(raw);
                    continue;
                }
                changed |= markIfInvalid(job);
                migrated |= changed;
                jobs.add(job);
            }
            log.debug("cron: loaded {} job(s) from {} ({} unreadable)", jobs.size(), storePath, unreadable.size());
            return new Snapshot(VERSION, jobs, unreadable, migrated, mtime);
        }
    }

    /**
     * Atomically write the store and return the new modification time.
     */
    public static FileTime save(Path storePath, List<CronJob> jobs, List<JsonNode> unreadable,
            StoreLock.Options lockOptions) throws IOException {
        try (StoreLock.HeldLock lock = StoreLock.acquire(storePath, lockOptions)) {
            ObjectNode root = MAPPER.createObjectNode();
            root.put("version", VERSION);
            ArrayNode array = root.putArray("jobs");
            for (CronJob job : jobs) {
                array.add(MAPPER.valueToTree(job));
            }
            if (unreadable != null) {
                unreadable.forEach(array::add);
            }
            JsonFile.writeAtomic(storePath, root);
            log.debug("cron: saved {} job(s) to {}", jobs.size(), storePath);
            return JsonFile.modifiedTime(storePath);
        }
    }

    // =========================================================================
    // Migration
    // =========================================================================

    /**
     * Upgrade one raw job entry in place. Idempotent; returns whether anything
     * changed.
     */
    static boolean migrateJob(ObjectNode job) {
        boolean changed = false;

        if (job.get("payload") instanceof ObjectNode payload) {
            String channel = canonicalChannel(payload.get("channel"));
            if (channel == null) {
                channel = canonicalChannel(payload.get("provider"));
            }
            if (payload.has("provider")) {
                payload.remove("provider");
                changed = true;
            }
            if (channel != null) {
                if (!channel.equals(payload.path("channel").asText(null))) {
                    payload.put("channel", channel);
                    changed = true;
                }
            } else if (payload.has("channel")) {
                payload.remove("channel");
                changed = true;
            }
            if (!payload.hasNonNull("kind")) {
                if (payload.path("text").isTextual()) {
                    payload.put("kind", "systemEvent");
                    changed = true;
                } else if (payload.path("message").isTextual()) {
                    payload.put("kind", "agentTurn");
                    changed = true;
                }
            }
        }

        if (job.get("schedule") instanceof ObjectNode schedule && schedule.has("at")) {
            JsonNode at = schedule.get("at");
            if (!schedule.hasNonNull("atMs")) {
                Long atMs = at.isNumber() ? Long.valueOf(at.asLong()) : CronParse.parseAbsoluteTimeMs(at.asText(null));
                if (atMs != null) {
                    schedule.put("atMs", atMs);
                }
            }
            schedule.remove("at");
            if (!schedule.hasNonNull("kind")) {
                schedule.put("kind", "at");
            }
            changed = true;
        }
        if (job.get("schedule") instanceof ObjectNode schedule && !schedule.hasNonNull("kind")) {
            if (schedule.hasNonNull("atMs")) {
                schedule.put("kind", "at");
                changed = true;
            } else if (schedule.hasNonNull("everyMs")) {
                schedule.put("kind", "every");
                changed = true;
            } else if (schedule.path("expr").isTextual()) {
                schedule.put("kind", "cron");
                changed = true;
            }
        }

        if (!job.hasNonNull("sessionTarget")) {
            String kind = job.path("payload").path("kind").asText("");
            if ("systemEvent".equals(kind)) {
                job.put("sessionTarget", "main");
                changed = true;
            } else if ("agentTurn".equals(kind)) {
                job.put("sessionTarget", "isolated");
                changed = true;
            }
        }
        if (!job.hasNonNull("wakeMode")) {
            job.put("wakeMode", "next-heartbeat");
            changed = true;
        }
        if (!job.has("enabled") || !job.get("enabled").isBoolean()) {
            job.put("enabled", true);
            changed = true;
        }
        if (!(job.get("state") instanceof ObjectNode)) {
            job.putObject("state");
            changed = true;
        }
        return changed;
    }

    private static String canonicalChannel(JsonNode raw) {
        if (raw == null || !raw.isTextual()) {
            return null;
        }
        String trimmed = raw.asText().trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Keep jobs that break the session-target/payload pairing, but mark them
     * skipped so they never run. Returns whether the state changed.
     */
    static boolean markIfInvalid(CronJob job) {
        String reason = CronJobs.invalidReason(job);
        if (reason == null) {
            return false;
        }
        CronTypes.CronJobState state = job.getState();
        boolean changed = state.getLastStatus() != CronTypes.RunStatus.SKIPPED
                || !Objects.equals(state.getLastError(), reason)
                || state.getNextRunAtMs() != null
                || state.getRunningAtMs() != null;
        state.setLastStatus(CronTypes.RunStatus.SKIPPED);
        state.setLastError(reason);
        state.setNextRunAtMs(null);
        state.setRunningAtMs(null);
        if (changed) {
            log.warn("cron: job {} is invalid and will not run: {}", job.getId(), reason);
        }
        return changed;
    }

    private static CronJob bind(ObjectNode node) {
        String id = node.path("id").asText("").trim();
        if (id.isEmpty()) {
            log.warn("cron: keeping unreadable store entry (missing id)");
            return null;
        }
        if (!(node.get("schedule") instanceof ObjectNode) || !(node.get("payload") instanceof ObjectNode)) {
            log.warn("cron: keeping unreadable store entry {} (missing schedule or payload)", id);
            return null;
        }
        try {
            CronJob job = MAPPER.treeToValue(node, CronJob.class);
            if (job.getSessionTarget() == null || job.getSchedule().getKind() == null
                    || job.getPayload().getKind() == null) {
                log.warn("cron: keeping unreadable store entry {} (missing kind or sessionTarget)", id);
                return null;
            }
            return job;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("cron: keeping unreadable store entry {}: {}", id, firstLine(e.getMessage()));
            return null;
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }

    private static void collectKeyed(JsonNode object, Map<String, JsonNode> out) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value instanceof ObjectNode job && !job.hasNonNull("id")) {
                ObjectNode withId = job.deepCopy();
                withId.put("id", field.getKey());
                value = withId;
            }
            out.put(field.getKey(), value);
        }
    }
}
