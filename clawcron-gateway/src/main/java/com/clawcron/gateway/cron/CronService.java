package com.clawcron.gateway.cron;

import com.clawcron.common.infra.HeartbeatRunner;
import com.clawcron.common.infra.JsonFile;
import com.clawcron.common.infra.StoreLock;
import com.clawcron.gateway.cron.CronState.CronEvent;
import com.clawcron.gateway.cron.CronState.CronRemoveResult;
import com.clawcron.gateway.cron.CronState.CronRunMode;
import com.clawcron.gateway.cron.CronState.CronRunResult;
import com.clawcron.gateway.cron.CronState.CronServiceDeps;
import com.clawcron.gateway.cron.CronState.CronStatusSummary;
import com.clawcron.gateway.cron.CronState.IsolatedRunResult;
import com.clawcron.gateway.cron.CronTypes.CronJobCreate;
import com.clawcron.gateway.cron.CronTypes.CronJobPatch;
import com.clawcron.gateway.cron.CronTypes.CronJobState;
import com.clawcron.gateway.cron.CronTypes.RunStatus;
import com.clawcron.gateway.cron.CronTypes.ScheduleKind;
import com.clawcron.gateway.cron.CronTypes.SessionTarget;
import com.clawcron.gateway.cron.CronTypes.WakeMode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Manages cron jobs: CRUD, persistence, scheduling, and execution.
 * <p>
 * All operations are serialized by an in-process lock, and every store access
 * additionally holds the {@link StoreLock} for the store file so that other
 * processes never interleave writes. A job run is split into three phases so
 * that slow collaborators are awaited without holding the file lock: mark the
 * job running and persist, execute, then reload if the store changed and
 * record the outcome.
 */
@Slf4j
public class CronService {

    static final long MAX_TIMER_DELAY_MS = 60_000;
    /** A running marker older than this is treated as left behind by a crash. */
    static final long STUCK_RUN_MS = 2 * 60 * 60_000L;

    private final CronServiceDeps deps;
    private final Path storePath;
    private final StoreLock.Options lockOptions;
    private final LongSupplier clock;
    private final ReentrantLock opLock = new ReentrantLock();
    private final ScheduledExecutorService timer;
    private final Object timerMonitor = new Object();
    private ScheduledFuture<?> timerTask;
    private volatile boolean started;

    // Guarded by opLock
    private List<CronJob> jobs = new ArrayList<>();
    private List<JsonNode> unreadable = new ArrayList<>();
    private FileTime storeMtime;
    private boolean loaded;
    private boolean pendingMigration;
    /** Outcomes whose recording failed, applied on the next store access. */
    private final Map<String, PendingOutcome> pendingOutcomes = new LinkedHashMap<>();

    public CronService(CronServiceDeps deps) {
        this.deps = Objects.requireNonNull(deps, "deps");
        this.storePath = Objects.requireNonNull(deps.getStorePath(), "storePath").toAbsolutePath();
        this.lockOptions = deps.getLockOptions() != null ? deps.getLockOptions() : StoreLock.Options.DEFAULTS;
        this.clock = deps.getNowMs() != null ? deps.getNowMs() : System::currentTimeMillis;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-timer");
            t.setDaemon(true);
            return t;
        });
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Load the store, clear running markers left by a crash, fill in missing
     * next-run times, persist any migration and arm the timer.
     */
    public void start() {
        locked(() -> {
            boolean changed = pendingMigration;
            long now = clock.getAsLong();
            for (CronJob job : jobs) {
                CronJobState state = job.getState();
                if (state.getRunningAtMs() != null) {
                    log.warn("cron: clearing stale running marker for job {}", job.getId());
                    state.setRunningAtMs(null);
                    changed = true;
                }
                if (job.isEnabled() && CronJobs.invalidReason(job) == null && state.getNextRunAtMs() == null) {
                    Long next = CronJobs.computeJobNextRunAtMs(job, now);
                    if (next != null) {
                        state.setNextRunAtMs(next);
                        changed = true;
                    }
                }
            }
            if (changed) {
                persist();
            }
            return null;
        });
        started = true;
        if (deps.isCronEnabled()) {
            armTimer();
            log.info("cron: started with {} job(s), store {}", jobCount(), storePath);
        } else {
            log.info("cron: disabled, timer not armed");
        }
    }

    /**
     * Cancel the timer and shut the executor down. Runs already executing on
     * other threads are not interrupted.
     */
    public void stop() {
        started = false;
        synchronized (timerMonitor) {
            if (timerTask != null) {
                timerTask.cancel(false);
                timerTask = null;
            }
        }
        timer.shutdown();
        log.info("cron: stopped");
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public CronStatusSummary status() {
        return locked(() -> CronStatusSummary.builder()
                .enabled(deps.isCronEnabled())
                .storePath(storePath.toString())
                .jobs(jobs.size())
                .nextWakeAtMs(deps.isCronEnabled() ? nextWakeAtMs() : null)
                .build());
    }

    /**
     * Copies of the jobs ordered by next run.
     */
    public List<CronJob> list(boolean includeDisabled) {
        return locked(() -> jobs.stream()
                .filter(job -> includeDisabled || job.isEnabled())
                .map(CronJobs::copy)
                .sorted(CronJobs.BY_NEXT_RUN)
                .toList());
    }

    /**
     * Run history for a job, oldest first.
     */
    public List<CronRunLog.Entry> runs(String id, Integer limit) {
        Path logPath = CronRunLog.resolvePath(storePath, id);
        try {
            return CronRunLog.read(logPath, limit);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    public CronJob add(CronJobCreate input) {
        return locked(() -> {
            CronJob job = CronJobs.createJob(input, clock.getAsLong());
            jobs.add(job);
            persist();
            log.info("cron: added job {} ({})", job.getId(), job.getName());
            emit(CronEvent.builder()
                    .jobId(job.getId())
                    .action("added")
                    .nextRunAtMs(job.getState().getNextRunAtMs())
                    .build());
            armTimer();
            return CronJobs.copy(job);
        });
    }

    /**
     * @throws CronValidationException for an unknown id or an invalid patch
     */
    public CronJob update(String id, CronJobPatch patch) {
        return locked(() -> {
            int index = indexOf(id);
            if (index < 0) {
                throw new CronValidationException("unknown cron job id: " + id);
            }
            CronJob next = CronJobs.applyPatch(jobs.get(index), patch, clock.getAsLong());
            jobs.set(index, next);
            persist();
            log.info("cron: updated job {}", id);
            emit(CronEvent.builder()
                    .jobId(id)
                    .action("updated")
                    .nextRunAtMs(next.getState().getNextRunAtMs())
                    .build());
            armTimer();
            return CronJobs.copy(next);
        });
    }

    public CronRemoveResult remove(String id) {
        return locked(() -> {
            int index = indexOf(id);
            if (index < 0) {
                return new CronRemoveResult(true, false);
            }
            jobs.remove(index);
            persist();
            log.info("cron: removed job {}", id);
            emit(CronEvent.builder().jobId(id).action("removed").build());
            armTimer();
            return new CronRemoveResult(true, true);
        });
    }

    // =========================================================================
    // Execution
    // =========================================================================

    /**
     * Run a job now. {@code FORCE} ignores the schedule and the enabled flag;
     * {@code DUE} runs only an enabled job whose next run has arrived. Jobs
     * marked invalid at load never run.
     *
     * @throws CronValidationException for an unknown id
     */
    public CronRunResult run(String id, CronRunMode mode) {
        CronRunResult result = executeJob(id, mode != null ? mode : CronRunMode.FORCE, true);
        armTimer();
        return result;
    }

    /**
     * Timer tick: run every due job one at a time, then re-arm.
     */
    void onTimer() {
        try {
            List<String> due = locked(() -> {
                long now = clock.getAsLong();
                if (clearStuckMarkers(now)) {
                    persist();
                }
                return jobs.stream()
                        .filter(job -> CronJobs.isDue(job, now))
                        .sorted(CronJobs.BY_NEXT_RUN)
                        .map(CronJob::getId)
                        .toList();
            });
            for (String id : due) {
                executeJob(id, CronRunMode.DUE, false);
            }
        } catch (RuntimeException e) {
            log.error("cron: timer tick failed: {}", e.getMessage(), e);
        } finally {
            armTimer();
        }
    }

    private CronRunResult executeJob(String id, CronRunMode mode, boolean failOnUnknown) {
        // Phase 1: claim the job
        record Claim(CronJob job, String skipReason) {
        }
        Claim claim = locked(() -> {
            int index = indexOf(id);
            if (index < 0) {
                if (failOnUnknown) {
                    throw new CronValidationException("unknown cron job id: " + id);
                }
                return new Claim(null, "not-found");
            }
            CronJob job = jobs.get(index);
            long now = clock.getAsLong();
            if (CronJobs.invalidReason(job) != null) {
                return new Claim(CronJobs.copy(job), "invalid-job");
            }
            Long runningAtMs = job.getState().getRunningAtMs();
            if (runningAtMs != null && !isStuck(runningAtMs, now)) {
                return new Claim(CronJobs.copy(job), "already-running");
            }
            if (runningAtMs != null) {
                log.warn("cron: job {} has been marked running since {}, running it again", id, runningAtMs);
                job.getState().setRunningAtMs(null);
            }
            if (mode == CronRunMode.DUE && !CronJobs.isDue(job, now)) {
                return new Claim(CronJobs.copy(job), "not-due");
            }
            job.getState().setRunningAtMs(now);
            persist();
            emit(CronEvent.builder().jobId(id).action("started").runAtMs(now).build());
            return new Claim(CronJobs.copy(job), null);
        });
        if (claim.skipReason() != null) {
            log.debug("cron: job {} not run: {}", id, claim.skipReason());
            return CronRunResult.notRun(claim.skipReason(), claim.job());
        }

        // Phase 2: execute without the store lock
        CronJob job = claim.job();
        long startedAt = job.getState().getRunningAtMs();
        Outcome outcome = execute(job);
        long endedAt = clock.getAsLong();

        // Phase 3: record the outcome
        PendingOutcome pending = new PendingOutcome(id, job, outcome, startedAt, endedAt);
        CronJob finished;
        try {
            finished = locked(() -> recordOutcome(pending));
        } catch (RuntimeException e) {
            deferOutcome(pending, e);
            throw e;
        }
        if (outcome.status() == RunStatus.ERROR) {
            log.warn("cron: job {} failed: {}", id, outcome.error());
        } else {
            log.info("cron: job {} finished: {}", id, outcome.status().key());
        }
        return CronRunResult.ran(finished);
    }

    /**
     * A finished run whose outcome has not been written to the store yet.
     */
    private record PendingOutcome(String id, CronJob job, Outcome outcome, long startedAt, long endedAt) {
    }

    /**
     * Apply a finished run to the store, emit its events and append the run
     * log. Caller holds the locks.
     */
    private CronJob recordOutcome(PendingOutcome pending) throws IOException {
        String id = pending.id();
        CronJob job = pending.job();
        Outcome outcome = pending.outcome();
        long startedAt = pending.startedAt();
        long endedAt = pending.endedAt();
        int index = indexOf(id);
        CronJob current = index >= 0 ? jobs.get(index) : null;
        if (current == null) {
            log.info("cron: job {} was removed while running", id);
            job.getState().setRunningAtMs(null);
            applyOutcome(job, outcome, startedAt, endedAt);
        } else {
            boolean deleted = applyOutcome(current, outcome, startedAt, endedAt);
            if (deleted) {
                jobs.remove(index);
            }
            persist();
            if (deleted) {
                emit(CronEvent.builder().jobId(id).action("removed").build());
            }
        }
        CronJob snapshot = CronJobs.copy(current != null ? current : job);
        emit(CronEvent.builder()
                .jobId(id)
                .action("finished")
                .status(outcome.status())
                .error(outcome.error())
                .summary(outcome.summary())
                .runAtMs(startedAt)
                .durationMs(snapshot.getState().getLastDurationMs())
                .nextRunAtMs(snapshot.getState().getNextRunAtMs())
                .build());
        appendRunLog(snapshot, outcome, startedAt, endedAt);
        return snapshot;
    }

    /**
     * Keep an outcome that could not be recorded and release the job's running
     * marker in memory. The store is reloaded and the outcome applied on the
     * next locked access.
     */
    private void deferOutcome(PendingOutcome pending, RuntimeException cause) {
        opLock.lock();
        try {
            pendingOutcomes.put(pending.id(), pending);
            int index = indexOf(pending.id());
            if (index >= 0) {
                jobs.get(index).getState().setRunningAtMs(null);
            }
            loaded = false;
        } finally {
            opLock.unlock();
        }
        log.warn("cron: could not record outcome of job {}, will retry: {}", pending.id(), cause.getMessage());
    }

    private void flushPendingOutcomes() throws IOException {
        if (pendingOutcomes.isEmpty()) {
            return;
        }
        for (PendingOutcome pending : List.copyOf(pendingOutcomes.values())) {
            recordOutcome(pending);
            pendingOutcomes.remove(pending.id());
            log.info("cron: recorded deferred outcome of job {}", pending.id());
        }
    }

    private boolean isStuck(long runningAtMs, long now) {
        return now - runningAtMs > STUCK_RUN_MS;
    }

    private boolean clearStuckMarkers(long now) {
        boolean changed = false;
        for (CronJob job : jobs) {
            Long runningAtMs = job.getState().getRunningAtMs();
            if (runningAtMs != null && isStuck(runningAtMs, now)) {
                log.warn("cron: clearing stuck running marker for job {}", job.getId());
                job.getState().setRunningAtMs(null);
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Record a finished run on {@code job}. Returns true when the job should be
     * deleted.
     */
    private boolean applyOutcome(CronJob job, Outcome outcome, long startedAt, long endedAt) {
        CronJobState state = job.getState();
        state.setRunningAtMs(null);
        state.setLastRunAtMs(startedAt);
        state.setLastStatus(outcome.status());
        state.setLastDurationMs(Math.max(0, endedAt - startedAt));
        state.setLastError(outcome.error());
        job.setUpdatedAtMs(endedAt);

        if (job.getSchedule().getKind() == ScheduleKind.AT && outcome.status() == RunStatus.OK) {
            if (Boolean.TRUE.equals(job.getDeleteAfterRun())) {
                return true;
            }
            job.setEnabled(false);
            state.setNextRunAtMs(null);
        } else if (job.isEnabled()) {
            state.setNextRunAtMs(CronJobs.computeJobNextRunAtMs(job, endedAt));
        } else {
            state.setNextRunAtMs(null);
        }
        return false;
    }

    private record Outcome(RunStatus status, String error, String summary) {
        static Outcome ok(String summary) {
            return new Outcome(RunStatus.OK, null, summary);
        }
    }

    private Outcome execute(CronJob job) {
        try {
            return job.getSessionTarget() == SessionTarget.MAIN ? executeMain(job) : executeIsolated(job);
        } catch (RuntimeException e) {
            return new Outcome(RunStatus.ERROR, errorMessage(e), null);
        }
    }

    private Outcome executeMain(CronJob job) {
        String text = job.getPayload().getText();
        String reason = "cron:" + job.getId();
        deps.getSystemEvents().enqueue(text, job.getAgentId());
        if (job.getWakeMode() != WakeMode.NOW) {
            return Outcome.ok(text);
        }
        if (deps.getHeartbeatRunOnce() == null) {
            requestHeartbeat(reason);
            return Outcome.ok(text);
        }
        HeartbeatRunner.RunResult heartbeat = awaitHeartbeat(reason);
        return switch (heartbeat.status()) {
            case HeartbeatRunner.STATUS_SKIPPED -> new Outcome(RunStatus.SKIPPED, heartbeat.reason(), text);
            case HeartbeatRunner.STATUS_FAILED -> new Outcome(RunStatus.ERROR,
                    heartbeat.reason() != null ? heartbeat.reason() : "heartbeat failed", text);
            default -> Outcome.ok(text);
        };
    }

    /**
     * Run a heartbeat and wait for it, retrying while another beat is in flight.
     * Falls back to a fire-and-forget request once the wait limit passes.
     */
    private HeartbeatRunner.RunResult awaitHeartbeat(String reason) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(deps.getHeartbeatMaxWaitMs());
        while (true) {
            HeartbeatRunner.RunResult result = join(deps.getHeartbeatRunOnce().run(reason));
            boolean busy = result != null
                    && HeartbeatRunner.STATUS_SKIPPED.equals(result.status())
                    && HeartbeatRunner.REASON_IN_FLIGHT.equals(result.reason());
            if (result != null && !busy) {
                return result;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("cron: heartbeat still busy after {}ms, requesting asynchronously", deps.getHeartbeatMaxWaitMs());
                requestHeartbeat(reason);
                return HeartbeatRunner.RunResult.ran(0);
            }
            try {
                Thread.sleep(deps.getHeartbeatRetryMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while waiting for heartbeat", e);
            }
        }
    }

    private Outcome executeIsolated(CronJob job) {
        String reason = "cron:" + job.getId();
        IsolatedRunResult result;
        try {
            result = join(deps.getIsolatedAgentRunner().run(job, job.getPayload().getMessage()));
        } catch (RuntimeException e) {
            String error = errorMessage(e);
            postToMain(job, CronPostToMain.errorMessage(job, error), reason);
            return new Outcome(RunStatus.ERROR, error, null);
        }
        if (result == null) {
            result = new IsolatedRunResult(RunStatus.OK, null, null, null);
        }
        String message = CronPostToMain.resolveMessage(job, result, deps.getHeartbeatAckMaxChars());
        if (message != null) {
            postToMain(job, message, reason);
        }
        RunStatus status = result.status() != null ? result.status() : RunStatus.OK;
        String error = status == RunStatus.ERROR
                ? (result.error() != null ? result.error() : "isolated run failed")
                : null;
        return new Outcome(status, error, result.summary());
    }

    private void postToMain(CronJob job, String message, String reason) {
        deps.getSystemEvents().enqueue(message, job.getAgentId());
        if (job.getWakeMode() == WakeMode.NOW) {
            requestHeartbeat(reason);
        }
    }

    private void requestHeartbeat(String reason) {
        if (deps.getHeartbeatRequester() != null) {
            deps.getHeartbeatRequester().requestNow(reason);
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        if (future == null) {
            return null;
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for collaborator", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new CompletionException(cause);
        }
    }

    private static String errorMessage(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private void appendRunLog(CronJob job, Outcome outcome, long startedAt, long endedAt) {
        try {
            CronRunLog.append(CronRunLog.resolvePath(storePath, job.getId()), CronRunLog.Entry.builder()
                    .ts(endedAt)
                    .jobId(job.getId())
                    .action("finished")
                    .status(outcome.status())
                    .error(outcome.error())
                    .summary(outcome.summary())
                    .runAtMs(startedAt)
                    .durationMs(Math.max(0, endedAt - startedAt))
                    .nextRunAtMs(job.getState().getNextRunAtMs())
                    .build());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("cron: failed to append run log for job {}: {}", job.getId(), e.getMessage());
        }
    }

    // =========================================================================
    // Timer
    // =========================================================================

    private void armTimer() {
        if (!started || !deps.isCronEnabled()) {
            return;
        }
        Long next = locked(this::nextWakeAtMs);
        long delay = next == null
                ? MAX_TIMER_DELAY_MS
                : Math.max(0, Math.min(MAX_TIMER_DELAY_MS, next - clock.getAsLong()));
        synchronized (timerMonitor) {
            if (!started || timer.isShutdown()) {
                return;
            }
            if (timerTask != null) {
                timerTask.cancel(false);
            }
            timerTask = timer.schedule(this::onTimer, delay, TimeUnit.MILLISECONDS);
        }
    }

    private Long nextWakeAtMs() {
        return jobs.stream()
                .filter(job -> job.isEnabled() && CronJobs.invalidReason(job) == null)
                .map(job -> job.getState().getNextRunAtMs())
                .filter(Objects::nonNull)
                .min(Long::compare)
                .orElse(null);
    }

    // =========================================================================
    // Store access
    // =========================================================================

    @FunctionalInterface
    private interface StoreAction<T> {
        T run() throws IOException;
    }

    /**
     * Run {@code action} holding the service lock and the store file lock, with
     * the in-memory jobs reloaded if the file changed.
     */
    private <T> T locked(StoreAction<T> action) {
        opLock.lock();
        try (StoreLock.HeldLock lock = StoreLock.acquire(storePath, lockOptions)) {
            ensureLoaded();
            flushPendingOutcomes();
            return action.run();
        } catch (IOException e) {
            loaded = false;
            throw new UncheckedIOException("cron store failure: " + storePath, e);
        } finally {
            opLock.unlock();
        }
    }

    private void ensureLoaded() throws IOException {
        FileTime mtime = JsonFile.modifiedTime(storePath);
        if (loaded && Objects.equals(mtime, storeMtime)) {
            return;
        }
        CronStore.Snapshot snapshot = CronStore.load(storePath, lockOptions);
        jobs = new ArrayList<>(snapshot.jobs());
        unreadable = new ArrayList<>(snapshot.unreadable());
        storeMtime = snapshot.mtime();
        pendingMigration = snapshot.migrated();
        loaded = true;
        if (snapshot.migrated() && started) {
            persist();
        }
    }

    private void persist() throws IOException {
        storeMtime = CronStore.save(storePath, jobs, unreadable, lockOptions);
        pendingMigration = false;
    }

    private int indexOf(String id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < jobs.size(); i++) {
            if (id.equals(jobs.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    private int jobCount() {
        return locked(() -> jobs.size());
    }

    private void emit(CronEvent event) {
        var listener = deps.getOnEvent();
        if (listener == null) {
            return;
        }
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("cron: event listener failed for {} {}: {}", event.getAction(), event.getJobId(), e.getMessage());
        }
    }

    Path getStorePath() {
        return storePath;
    }
}
