package com.clawcron.gateway.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cron job type definitions: schedule variants, typed payloads, isolation
 * settings, run state and the create/patch DTOs.
 * <p>
 * Variants are tagged by a {@code kind} enum; fields that do not belong to the
 * active kind stay null and are omitted from JSON.
 */
public final class CronTypes {

    private CronTypes() {
    }

    private static <E extends Enum<E>> E byKey(Class<E> type, String key, String label) {
        if (key != null) {
            for (E value : type.getEnumConstants()) {
                if (value.toString().equalsIgnoreCase(key.trim())) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("unknown " + label + ": " + key);
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    public enum ScheduleKind {
        AT("at"), EVERY("every"), CRON("cron");

        private final String key;

        ScheduleKind(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }

        @JsonCreator
        public static ScheduleKind fromKey(String key) {
            return byKey(ScheduleKind.class, key, "schedule.kind");
        }

        @Override
        public String toString() {
            return key;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronSchedule {
        private ScheduleKind kind;
        /** Epoch ms for "at" schedules. */
        private Long atMs;
        /** Interval in milliseconds for "every" schedules. */
        private Long everyMs;
        /** Anchor timestamp in ms for "every" schedules; defaults to the job's creation time. */
        private Long anchorMs;
        /** Five-field cron expression for "cron" schedules (e.g. "0 9 * * 1-5"). */
        private String expr;
        /** IANA time zone for "cron" schedules. */
        private String tz;

        public static CronSchedule at(long atMs) {
            return builder().kind(ScheduleKind.AT).atMs(atMs).build();
        }

        public static CronSchedule every(long everyMs, Long anchorMs) {
            return builder().kind(ScheduleKind.EVERY).everyMs(everyMs).anchorMs(anchorMs).build();
        }

        public static CronSchedule cron(String expr, String tz) {
            return builder().kind(ScheduleKind.CRON).expr(expr).tz(tz).build();
        }
    }

    // =========================================================================
    // Session/wake modes
    // =========================================================================

    public enum SessionTarget {
        MAIN("main"), ISOLATED("isolated");

        private final String key;

        SessionTarget(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }

        @JsonCreator
        public static SessionTarget fromKey(String key) {
            return byKey(SessionTarget.class, key, "sessionTarget");
        }

        @Override
        public String toString() {
            return key;
        }
    }

    public enum WakeMode {
        NEXT_HEARTBEAT("next-heartbeat"), NOW("now");

        private final String key;

        WakeMode(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }

        @JsonCreator
        public static WakeMode fromKey(String key) {
            return byKey(WakeMode.class, key, "wakeMode");
        }

        @Override
        public String toString() {
            return key;
        }
    }

    // =========================================================================
    // Payload
    // =========================================================================

    public enum PayloadKind {
        SYSTEM_EVENT("systemEvent"), AGENT_TURN("agentTurn");

        private final String key;

        PayloadKind(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }

        @JsonCreator
        public static PayloadKind fromKey(String key) {
            return byKey(PayloadKind.class, key, "payload.kind");
        }

        @Override
        public String toString() {
            return key;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronPayload {
        private PayloadKind kind;
        /** Text for systemEvent payloads. */
        private String text;
        /** Prompt for agentTurn payloads. */
        private String message;
        private String model;
        private String thinking;
        private Integer timeoutSeconds;
        private Boolean deliver;
        private String channel;
        private String to;
        private Boolean bestEffortDeliver;

        public static CronPayload systemEvent(String text) {
            return builder().kind(PayloadKind.SYSTEM_EVENT).text(text).build();
        }

        public static CronPayload agentTurn(String message) {
            return builder().kind(PayloadKind.AGENT_TURN).message(message).build();
        }
    }

    // =========================================================================
    // Isolation
    // =========================================================================

    public enum PostToMainMode {
        SUMMARY("summary"), FULL("full");

        private final String key;

        PostToMainMode(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }

        @JsonCreator
        public static PostToMainMode fromKey(String key) {
            return byKey(PostToMainMode.class, key, "isolation.postToMainMode");
        }

        @Override
        public String toString() {
            return key;
        }
    }

    /**
     * How an isolated run reports back to the main session.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronIsolation {
        /** Defaults to "Cron". */
        private String postToMainPrefix;
        /** Defaults to summary. */
        private PostToMainMode postToMainMode;
        /** Output cap in full mode; defaults to 8000. */
        private Integer postToMainMaxChars;
    }

    // =========================================================================
    // Job state
    // =========================================================================

    public enum RunStatus {
        OK("ok"), ERROR("error"), SKIPPED("skipped");

        private final String key;

        RunStatus(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }

        @JsonCreator
        public static RunStatus fromKey(String key) {
            return byKey(RunStatus.class, key, "status");
        }

        @Override
        public String toString() {
            return key;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronJobState {
        private Long nextRunAtMs;
        private Long runningAtMs;
        private Long lastRunAtMs;
        private RunStatus lastStatus;
        private String lastError;
        private Long lastDurationMs;
    }

    // =========================================================================
    // Create/Patch DTOs
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobCreate {
        private String agentId;
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronIsolation isolation;
    }

    /**
     * Partial update. Null fields are left unchanged; {@code clearAgentId}
     * records an explicit {@code agentId: null}.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobPatch {
        private String agentId;
        @JsonIgnore
        private boolean clearAgentId;
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronIsolation isolation;
    }
}
