package com.clawcron.gateway.cron;

import com.clawcron.common.infra.HeartbeatRunner;
import com.clawcron.common.infra.StoreLock;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Cron service state types: events, collaborators and results.
 */
public final class CronState {

    private CronState() {
    }

    // =========================================================================
    // Event types
    // =========================================================================

    /**
     * Cron lifecycle event.
     */
    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronEvent {
        private String jobId;
        /** "added" | "updated" | "removed" | "started" | "finished" */
        private String action;
        private Long runAtMs;
        private Long durationMs;
        private CronTypes.RunStatus status;
        private String error;
        private String summary;
        private Long nextRunAtMs;
    }

    // =========================================================================
    // Collaborators
    // =========================================================================

    /** Queues text for an agent's main session. */
    @FunctionalInterface
    public interface SystemEventSink {
        void enqueue(String text, String agentId);
    }

    /** Asks the heartbeat loop to run soon; does not wait. */
    @FunctionalInterface
    public interface HeartbeatRequester {
        void requestNow(String reason);
    }

    /** Runs one heartbeat and completes with its outcome. */
    @FunctionalInterface
    public interface HeartbeatRunOnce {
        CompletableFuture<HeartbeatRunner.RunResult> run(String reason);
    }

    /** Runs an agent turn in a fresh session for an isolated job. */
    @FunctionalInterface
    public interface IsolatedAgentRunner {
        CompletableFuture<IsolatedRunResult> run(CronJob job, String message);
    }

    /**
     * Outcome of an isolated agent turn.
     *
     * @param status     ok, error or skipped
     * @param summary    short description of what happened
     * @param outputText the agent's last output
     * @param error      failure message for error results
     */
    public record IsolatedRunResult(CronTypes.RunStatus status, String summary, String outputText, String error) {
        public static IsolatedRunResult ok(String summary) {
            return new IsolatedRunResult(CronTypes.RunStatus.OK, summary, null, null);
        }

        public static IsolatedRunResult error(String summary, String error) {
            return new IsolatedRunResult(CronTypes.RunStatus.ERROR, summary, null, error);
        }
    }

    // =========================================================================
    // Dependencies
    // =========================================================================

    /**
     * Dependencies for cron service initialization.
     */
    @Data
    @Builder
    public static class CronServiceDeps {
        private Path storePath;
        /** Whether the timer runs; RPC operations work either way. */
        private boolean cronEnabled;
        /** Clock; defaults to the system clock. */
        private LongSupplier nowMs;
        private SystemEventSink systemEvents;
        private HeartbeatRequester heartbeatRequester;
        /** Optional; without it "now" wakes are fire-and-forget. */
        private HeartbeatRunOnce heartbeatRunOnce;
        private IsolatedAgentRunner isolatedAgentRunner;
        private Consumer<CronEvent> onEvent;
        @Builder.Default
        private StoreLock.Options lockOptions = StoreLock.Options.DEFAULTS;
        /** Null for the default of 300. */
        private Integer heartbeatAckMaxChars;
        @Builder.Default
        private long heartbeatRetryMs = 250;
        @Builder.Default
        private long heartbeatMaxWaitMs = 120_000;
    }

    // =========================================================================
    // Result types
    // =========================================================================

    /**
     * Result of {@code run}: whether the job executed and, if not, why.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CronRunResult(boolean ok, boolean ran, String reason, CronJob job) {
        public static CronRunResult ran(CronJob job) {
            return new CronRunResult(true, true, null, job);
        }

        public static CronRunResult notRun(String reason, CronJob job) {
            return new CronRunResult(true, false, reason, job);
        }
    }

    /** Result of removing a cron job. */
    public record CronRemoveResult(boolean ok, boolean removed) {
    }

    // =========================================================================
    // Enums
    // =========================================================================

    public enum CronRunMode {
        DUE, FORCE;

        public static CronRunMode fromKey(String key) {
            if (key == null || key.isBlank() || "force".equalsIgnoreCase(key.trim()))
                return FORCE;
            if ("due".equalsIgnoreCase(key.trim()))
                return DUE;
            throw new CronValidationException("invalid cron.run mode: " + key);
        }
    }

    // =========================================================================
    // Status
    // =========================================================================

    /**
     * Cron status summary for diagnostics.
     */
    @Data
    @Builder
    public static class CronStatusSummary {
        private boolean enabled;
        private String storePath;
        private int jobs;
        private Long nextWakeAtMs;
    }
}
