package com.clawcron.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.UUID;

/**
 * JSON file read and atomic write with owner-only permissions.
 */
@Slf4j
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Read a JSON file as a tree. Returns null if the file does not exist;
     * malformed JSON is reported as an {@link IOException}.
     */
    public static JsonNode readTree(Path path) throws IOException {
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        }
        if (raw.isBlank()) {
            return null;
        }
        return MAPPER.readTree(raw);
    }

    /**
     * Serialize {@code data} and write it atomically.
     */
    public static void writeAtomic(Path path, Object data) throws IOException {
        writeAtomic(path, MAPPER.writeValueAsString(data) + "\n");
    }

    /**
     * Write {@code content} to a temp file next to {@code path} and rename it
     * over the target, so readers see either the old or the new file.
     */
    public static void writeAtomic(Path path, String content) throws IOException {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = dir.resolve(String.format("%s.%d.%s.tmp",
                target.getFileName(), ProcessHandle.current().pid(), UUID.randomUUID()));
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            restrictPermissions(tmp);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Last modification time, or null if the file does not exist.
     */
    public static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return null;
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    private static void restrictPermissions(Path path) throws IOException {
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.debug("posix permissions unsupported for {}", path);
        }
    }
}
