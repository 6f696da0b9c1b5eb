package com.clawcron.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Collects cleanup callbacks from independent subsystems and runs them once
 * when the process terminates.
 * <p>
 * A single JVM shutdown hook covers normal exit and the termination signals
 * the JVM turns into an orderly shutdown (SIGINT, SIGTERM, SIGHUP). Shutdown
 * hooks are additive, so hooks installed by other libraries keep running, and
 * the cleanup never halts the JVM or re-raises the signal. SIGQUIT only
 * produces a thread dump and leaves the process (and its locks) alive; an
 * abort bypasses every hook, which is what stale-lock reclamation is for.
 */
@Slf4j
public class SignalManager {

    private static final SignalManager INSTANCE = new SignalManager(
            hook -> Runtime.getRuntime().addShutdownHook(hook));

    /**
     * Handle returned by {@link #register}; closing it removes the callback.
     */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final Consumer<Thread> hookInstaller;
    private final Map<Long, Cleanup> cleanups = new LinkedHashMap<>();
    private final AtomicLong nextId = new AtomicLong();
    private final AtomicBoolean hookInstalled = new AtomicBoolean(false);
    private final AtomicBoolean ran = new AtomicBoolean(false);

    private record Cleanup(String name, Runnable action) {
    }

    SignalManager(Consumer<Thread> hookInstaller) {
        this.hookInstaller = hookInstaller;
    }

    public static SignalManager getInstance() {
        return INSTANCE;
    }

    /**
     * Register a cleanup callback. The shutdown hook is installed lazily on the
     * first registration.
     */
    public Registration register(String name, Runnable action) {
        installHookIfNeeded();
        long id = nextId.incrementAndGet();
        synchronized (cleanups) {
            cleanups.put(id, new Cleanup(name, action));
        }
        return () -> {
            synchronized (cleanups) {
                cleanups.remove(id);
            }
        };
    }

    public int size() {
        synchronized (cleanups) {
            return cleanups.size();
        }
    }

    /**
     * Run every registered cleanup once, in registration order. A failing
     * callback is logged and does not prevent the others from running.
     */
    public void runCleanups() {
        if (!ran.compareAndSet(false, true)) {
            return;
        }
        List<Cleanup> snapshot;
        synchronized (cleanups) {
            snapshot = new ArrayList<>(cleanups.values());
        }
        for (Cleanup cleanup : snapshot) {
            try {
                cleanup.action().run();
            } catch (RuntimeException e) {
                log.warn("shutdown cleanup '{}' failed: {}", cleanup.name(), e.getMessage());
            }
        }
    }

    private void installHookIfNeeded() {
        if (hookInstalled.compareAndSet(false, true)) {
            hookInstaller.accept(new Thread(this::runCleanups, "clawcron-shutdown-cleanup"));
        }
    }
}
