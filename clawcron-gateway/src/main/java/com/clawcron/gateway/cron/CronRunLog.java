package com.clawcron.gateway.cron;

import com.clawcron.common.infra.JsonFile;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-job run history kept as JSON lines under {@code <storeDir>/runs/}.
 */
@Slf4j
public final class CronRunLog {

    private CronRunLog() {
    }

    public static final long MAX_BYTES = 2_000_000;
    public static final int KEEP_LINES = 2_000;
    public static final int DEFAULT_LIMIT = 200;
    public static final int MAX_LIMIT = 5_000;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * One finished run.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        private long ts;
        private String jobId;
        /** Always "finished". */
        private String action;
        private CronTypes.RunStatus status;
        private String error;
        private String summary;
        private Long runAtMs;
        private Long durationMs;
        private Long nextRunAtMs;
    }

    /**
     * Log file for a job.
     *
     * @throws IllegalArgumentException if the id is blank or contains a path
     *                                  separator
     */
    public static Path resolvePath(Path storePath, String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new CronValidationException("invalid cron job id: " + jobId);
        }
        if (jobId.contains("/") || jobId.contains("\\") || jobId.contains("\0") || jobId.equals("..")) {
            throw new CronValidationException("invalid cron job id: " + jobId);
        }
        Path dir = storePath.toAbsolutePath().getParent();
        return dir.resolve("runs").resolve(jobId + ".jsonl");
    }

    /**
     * Append an entry, pruning the file to its newest lines once it grows past
     * {@link #MAX_BYTES}.
     */
    public static synchronized void append(Path logPath, Entry entry) throws IOException {
        Files.createDirectories(logPath.getParent());
        String line = MAPPER.writeValueAsString(entry) + "\n";
        Files.writeString(logPath, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        if (Files.size(logPath) > MAX_BYTES) {
            prune(logPath);
        }
    }

    /**
     * Read the newest {@code limit} entries, oldest first. Lines that are not
     * valid entries are skipped.
     *
     * @param limit null for {@link #DEFAULT_LIMIT}; clamped to 1..{@link #MAX_LIMIT}
     */
    public static synchronized List<Entry> read(Path logPath, Integer limit) throws IOException {
        int max = Math.max(1, Math.min(MAX_LIMIT, limit != null ? limit : DEFAULT_LIMIT));
        List<String> lines;
        try {
            lines = Files.readAllLines(logPath, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return List.of();
        }
        List<Entry> entries = new ArrayList<>();
        for (int i = lines.size() - 1; i >= 0 && entries.size() < max; i--) {
            Entry entry = parseLine(lines.get(i));
            if (entry != null) {
                entries.add(0, entry);
            }
        }
        return entries;
    }

    private static Entry parseLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            Entry entry = MAPPER.readValue(trimmed, Entry.class);
            if (!"finished".equals(entry.getAction()) || entry.getJobId() == null) {
                return null;
            }
            return entry;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("cron: skipping bad run log line: {}", e.getMessage());
            return null;
        }
    }

    private static void prune(Path logPath) throws IOException {
        List<String> lines = Files.readAllLines(logPath, StandardCharsets.UTF_8);
        List<String> kept = new ArrayList<>();
        for (String line : lines.subList(Math.max(0, lines.size() - KEEP_LINES), lines.size())) {
            if (!line.isBlank()) {
                kept.add(line);
            }
        }
        JsonFile.writeAtomic(logPath, String.join("\n", kept) + "\n");
        log.debug("cron: pruned run log {} to {} line(s)", logPath, kept.size());
    }
}
