package com.clawcron.common.infra;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cross-process advisory lock over a resource file, recorded on disk as
 * {@code <resource>.lock} containing {@code {"pid":..,"createdAt":".."}}.
 * <p>
 * The lock is keyed by the resource's real path, so callers reaching the
 * same file through different symlinks share one lock. Within a process the
 * lock is shared and reference counted: nested acquisitions return at once and
 * the lock file is removed only when the last holder releases it. Lock files
 * still held when the JVM shuts down are removed through {@link SignalManager}.
 */
@Slf4j
public final class StoreLock {

    public static final long DEFAULT_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_STALE_MS = 30_000;
    private static final long POLL_BASE_MS = 25;
    private static final long POLL_MAX_MS = 500;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Held locks by real resource path. Guarded by {@code StoreLock.class}. */
    private static final Map<Path, Entry> HELD_LOCKS = new HashMap<>();
    private static SignalManager.Registration shutdownRegistration;

    private StoreLock() {
    }

    /** On-disk lock record. */
    public record LockRecord(long pid, String createdAt) {
    }

    /** Acquisition tuning. */
    public record Options(long timeoutMs, long staleMs) {
        public static final Options DEFAULTS = new Options(DEFAULT_TIMEOUT_MS, DEFAULT_STALE_MS);
    }

    /**
     * Thrown when another process keeps the lock past the acquisition timeout.
     */
    public static class LockTimeoutException extends RuntimeException {
        private final Path lockPath;
        private final Long ownerPid;

        public LockTimeoutException(String message, Path lockPath, Long ownerPid) {
            super(message);
            this.lockPath = lockPath;
            this.ownerPid = ownerPid;
        }

        public Path getLockPath() {
            return lockPath;
        }

        public Long getOwnerPid() {
            return ownerPid;
        }
    }

    private static final class Entry {
        final Path resourcePath;
        final Path lockPath;
        int count;

        Entry(Path resourcePath, Path lockPath) {
            this.resourcePath = resourcePath;
            this.lockPath = lockPath;
            this.count = 1;
        }
    }

    /**
     * One holder's reference to a shared lock. Releasing twice is a no-op.
     */
    public static final class HeldLock implements AutoCloseable {
        private final Entry entry;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private HeldLock(Entry entry) {
            this.entry = entry;
        }

        public Path getResourcePath() {
            return entry.resourcePath;
        }

        public Path getLockPath() {
            return entry.lockPath;
        }

        public void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            synchronized (StoreLock.class) {
                entry.count--;
                if (entry.count > 0) {
                    return;
                }
                HELD_LOCKS.remove(entry.resourcePath);
                deleteQuietly(entry.lockPath);
            }
        }

        @Override
        public void close() {
            release();
        }
    }

    public static HeldLock acquire(Path resource) throws IOException {
        return acquire(resource, Options.DEFAULTS);
    }

    public static HeldLock acquire(Path resource, Options options) throws IOException {
        return acquire(resource, options.timeoutMs(), options.staleMs());
    }

    /**
     * Acquire the lock for {@code resource}.
     *
     * @param resource  file the lock guards (need not exist yet)
     * @param timeoutMs how long to poll for a lock held by another process
     * @param staleMs   age after which a lock record is reclaimable
     * @throws LockTimeoutException if the lock stays held past {@code timeoutMs}
     * @throws IOException          if the lock file cannot be created or read
     */
    public static HeldLock acquire(Path resource, long timeoutMs, long staleMs) throws IOException {
        Path realPath = resolveRealPath(resource);
        Path lockPath = lockPathFor(realPath);
        Files.createDirectories(lockPath.getParent());
        registerShutdownCleanup();

        long startedAt = System.nanoTime();
        int attempt = 0;
        while (true) {
            attempt++;
            synchronized (StoreLock.class) {
                Entry existing = HELD_LOCKS.get(realPath);
                if (existing != null) {
                    existing.count++;
                    return new HeldLock(existing);
                }
                if (tryCreate(lockPath)) {
                    Entry entry = new Entry(realPath, lockPath);
                    HELD_LOCKS.put(realPath, entry);
                    return new HeldLock(entry);
                }
                if (reclaimIfStale(lockPath, staleMs)) {
                    continue;
                }
            }

            long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;
            if (elapsedMs >= timeoutMs) {
                LockRecord owner = readRecord(lockPath);
                Long ownerPid = owner != null ? owner.pid() : null;
                throw new LockTimeoutException(String.format(
                        "timeout acquiring lock after %dms (owner pid=%s): %s",
                        timeoutMs, ownerPid != null ? ownerPid : "unknown", lockPath),
                        lockPath, ownerPid);
            }
            try {
                Thread.sleep(Math.min(POLL_MAX_MS, Math.min(POLL_BASE_MS * attempt, timeoutMs - elapsedMs)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted while waiting for lock: " + lockPath);
            }
        }
    }

    /**
     * Resolve the path with symlinks followed. A path that does not exist yet
     * resolves through its nearest existing ancestor.
     */
    public static Path resolveRealPath(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath();
        } catch (NoSuchFileException e) {
            Path parent = absolute.getParent();
            if (parent == null) {
                return absolute;
            }
            return resolveRealPath(parent).resolve(absolute.getFileName());
        }
    }

    public static Path lockPathFor(Path realPath) {
        return realPath.resolveSibling(realPath.getFileName() + ".lock");
    }

    /**
     * Number of in-process holders of the lock for {@code resource}; 0 when
     * not held by this process.
     */
    public static int holdCount(Path resource) throws IOException {
        Path realPath = resolveRealPath(resource);
        synchronized (StoreLock.class) {
            Entry entry = HELD_LOCKS.get(realPath);
            return entry != null ? entry.count : 0;
        }
    }

    /**
     * Read the lock record at {@code lockPath}, or null when missing or
     * unreadable.
     */
    public static LockRecord readRecord(Path lockPath) {
        try {
            String raw = Files.readString(lockPath, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return null;
            }
            return MAPPER.readValue(raw, LockRecord.class);
        } catch (IOException e) {
            return null;
        }
    }

    static void releaseAllForShutdown() {
        synchronized (StoreLock.class) {
            for (Entry entry : HELD_LOCKS.values()) {
                deleteQuietly(entry.lockPath);
            }
            HELD_LOCKS.clear();
        }
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private static boolean tryCreate(Path lockPath) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(new LockRecord(
                ProcessHandle.current().pid(), Instant.now().toString()));
        try (OutputStream out = Files.newOutputStream(lockPath,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            out.write(payload);
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            deleteQuietly(lockPath);
            throw e;
        }
        return true;
    }

    /**
     * Remove the lock file when its owner is dead or its record is older than
     * {@code staleMs}. Returns true when the file was removed and creation
     * should be retried immediately.
     */
    private static boolean reclaimIfStale(Path lockPath, long staleMs) {
        String before = readRaw(lockPath);
        if (before == null || !isStale(lockPath, before, staleMs)) {
            return false;
        }
        // Only reclaim the record judged stale, not one a live process just wrote.
        if (!before.equals(readRaw(lockPath))) {
            return false;
        }
        log.info("reclaiming stale lock: {}", lockPath);
        deleteQuietly(lockPath);
        return true;
    }

    private static boolean isStale(Path lockPath, String raw, long staleMs) {
        long now = System.currentTimeMillis();
        LockRecord record = null;
        try {
            if (!raw.isBlank()) {
                record = MAPPER.readValue(raw, LockRecord.class);
            }
        } catch (IOException e) {
            log.debug("unreadable lock record at {}: {}", lockPath, e.getMessage());
        }
        if (record == null || record.createdAt() == null) {
            return fileAgeMs(lockPath, now) > staleMs;
        }
        if (!isProcessAlive(record.pid())) {
            return true;
        }
        try {
            return now - Instant.parse(record.createdAt()).toEpochMilli() > staleMs;
        } catch (DateTimeParseException e) {
            return fileAgeMs(lockPath, now) > staleMs;
        }
    }

    private static boolean isProcessAlive(long pid) {
        if (pid == ProcessHandle.current().pid()) {
            return true;
        }
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private static long fileAgeMs(Path path, long now) {
        try {
            return now - Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0;
        }
    }

    private static String readRaw(Path lockPath) {
        try {
            return Files.readString(lockPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return null;
        }
    }

    private static void registerShutdownCleanup() {
        synchronized (StoreLock.class) {
            if (shutdownRegistration == null) {
                shutdownRegistration = SignalManager.getInstance()
                        .register("store-locks", StoreLock::releaseAllForShutdown);
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("failed to delete lock file {}: {}", path, e.getMessage());
        }
    }
}
