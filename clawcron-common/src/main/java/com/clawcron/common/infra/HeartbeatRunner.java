package com.clawcron.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Heartbeat runner: periodically invokes a heartbeat action, and lets callers
 * request an immediate beat either fire-and-forget ({@link #requestNow}) or
 * awaited ({@link #runNow}).
 */
@Slf4j
public class HeartbeatRunner implements AutoCloseable {

    public static final String STATUS_RAN = "ran";
    public static final String STATUS_SKIPPED = "skipped";
    public static final String STATUS_FAILED = "failed";
    public static final String REASON_IN_FLIGHT = "requests-in-flight";

    /**
     * Outcome of one heartbeat.
     *
     * @param status     {@code ran}, {@code skipped} or {@code failed}
     * @param reason     why it was skipped or failed, null when it ran
     * @param durationMs how long the action took
     */
    public record RunResult(String status, String reason, long durationMs) {
        public static RunResult ran(long durationMs) {
            return new RunResult(STATUS_RAN, null, durationMs);
        }

        public static RunResult skipped(String reason) {
            return new RunResult(STATUS_SKIPPED, reason, 0);
        }

        public static RunResult failed(String reason, long durationMs) {
            return new RunResult(STATUS_FAILED, reason, durationMs);
        }
    }

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private volatile long intervalMs;
    private volatile Function<String, RunResult> heartbeatAction;
    private ScheduledFuture<?> scheduledTask;

    /**
     * @param intervalMs      interval between heartbeats in milliseconds
     * @param heartbeatAction action to invoke on each heartbeat (receives the
     *                        reason string)
     */
    public HeartbeatRunner(long intervalMs, Function<String, RunResult> heartbeatAction) {
        this.intervalMs = Math.max(1000, intervalMs);
        this.heartbeatAction = heartbeatAction;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-runner");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("heartbeat runner already running");
            return;
        }
        scheduleNext();
        log.info("heartbeat runner started (interval: {}ms)", intervalMs);
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }
        log.info("heartbeat runner stopped");
    }

    public synchronized void updateInterval(long newIntervalMs) {
        this.intervalMs = Math.max(1000, newIntervalMs);
        if (running.get()) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false);
            }
            scheduleNext();
            log.info("heartbeat interval updated to {}ms", intervalMs);
        }
    }

    /**
     * Request a heartbeat as soon as possible without waiting for it.
     */
    public void requestNow(String reason) {
        try {
            scheduler.execute(() -> runOnce(reason));
        } catch (RejectedExecutionException e) {
            log.warn("heartbeat request '{}' rejected: runner closed", reason);
        }
    }

    /**
     * Run a heartbeat now and complete with its result. When a beat is already
     * executing the future completes at once with
     * {@code skipped/requests-in-flight}, and the caller may retry.
     */
    public CompletableFuture<RunResult> runNow(String reason) {
        if (inFlight.get()) {
            return CompletableFuture.completedFuture(RunResult.skipped(REASON_IN_FLIGHT));
        }
        try {
            return CompletableFuture.supplyAsync(() -> runOnce(reason), scheduler);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(RunResult.skipped("closed"));
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void scheduleNext() {
        scheduledTask = scheduler.schedule(this::tick, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        runOnce("interval");
        synchronized (this) {
            if (running.get()) {
                scheduleNext();
            }
        }
    }

    private RunResult runOnce(String reason) {
        if (!inFlight.compareAndSet(false, true)) {
            return RunResult.skipped(REASON_IN_FLIGHT);
        }
        long started = System.currentTimeMillis();
        try {
            var action = heartbeatAction;
            if (action == null) {
                return RunResult.skipped("no-action");
            }
            RunResult result = action.apply(reason);
            return result != null ? result : RunResult.ran(System.currentTimeMillis() - started);
        } catch (Exception e) {
            log.error("heartbeat action failed: {}", e.getMessage(), e);
            return RunResult.failed(e.getMessage(), System.currentTimeMillis() - started);
        } finally {
            inFlight.set(false);
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
