package com.clawcron.common.config;

import lombok.Data;

/**
 * Root configuration type, bound from {@code clawcron.json}.
 */
@Data
public class ClawCronConfig {

    /** Cron/scheduling settings. */
    private CronConfig cron;

    /** Heartbeat loop settings. */
    private HeartbeatConfig heartbeat;

    // --- Nested config types ---

    @Data
    public static class CronConfig {
        private boolean enabled = true;
        /** Store file; defaults to {@code <stateDir>/cron/jobs.json}. */
        private String store;
        private LockConfig lock;
        /** Longest text that may accompany HEARTBEAT_OK and still be suppressed. */
        private Integer heartbeatAckMaxChars;
    }

    @Data
    public static class LockConfig {
        private long timeoutMs = 10_000;
        private long staleMs = 30_000;
    }

    @Data
    public static class HeartbeatConfig {
        private long everyMs = 30 * 60_000L;
    }
}
