package com.clawcron.gateway.cron;

import com.clawcron.gateway.cron.CronTypes.CronIsolation;
import com.clawcron.gateway.cron.CronTypes.CronJobCreate;
import com.clawcron.gateway.cron.CronTypes.CronJobPatch;
import com.clawcron.gateway.cron.CronTypes.CronJobState;
import com.clawcron.gateway.cron.CronTypes.CronPayload;
import com.clawcron.gateway.cron.CronTypes.PayloadKind;
import com.clawcron.gateway.cron.CronTypes.ScheduleKind;
import com.clawcron.gateway.cron.CronTypes.SessionTarget;
import com.clawcron.gateway.cron.CronTypes.WakeMode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Comparator;
import java.util.UUID;

/**
 * Job construction, patching and validation rules shared by the service and
 * the store.
 */
public final class CronJobs {

    private CronJobs() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Orders jobs by next run; jobs without one sort last. */
    public static final Comparator<CronJob> BY_NEXT_RUN = Comparator.comparing(
            (CronJob job) -> job.getState() != null ? job.getState().getNextRunAtMs() : null,
            Comparator.nullsLast(Comparator.naturalOrder()));

    // =========================================================================
    // Create / patch
    // =========================================================================

    /**
     * Build a new job from validated input, with its first next-run computed.
     *
     * @throws CronValidationException if the input is incomplete or inconsistent
     */
    public static CronJob createJob(CronJobCreate input, long nowMs) {
        if (input == null) {
            throw new CronValidationException("invalid cron job: missing params");
        }
        if (input.getName() == null || input.getName().isBlank()) {
            throw new CronValidationException("cron job name is required");
        }
        if (input.getSessionTarget() == null) {
            throw new CronValidationException("sessionTarget is required (main or isolated)");
        }
        CronSchedules.validate(input.getSchedule());
        validatePayload(input.getPayload(), "cron");
        assertSupportedJobSpec(input.getSessionTarget(), input.getPayload());
        validateIsolation(input.getIsolation());

        CronJob job = CronJob.builder()
                .id(UUID.randomUUID().toString())
                .agentId(CronNormalize.normalizeAgentId(input.getAgentId()))
                .name(input.getName().trim())
                .description(input.getDescription())
                .enabled(input.getEnabled() == null || input.getEnabled())
                .deleteAfterRun(input.getDeleteAfterRun())
                .createdAtMs(nowMs)
                .updatedAtMs(nowMs)
                .schedule(input.getSchedule())
                .sessionTarget(input.getSessionTarget())
                .wakeMode(input.getWakeMode() != null ? input.getWakeMode() : WakeMode.NEXT_HEARTBEAT)
                .payload(input.getPayload())
                .isolation(input.getIsolation())
                .state(new CronJobState())
                .build();
        job.getState().setNextRunAtMs(job.isEnabled() ? computeJobNextRunAtMs(job, nowMs) : null);
        return job;
    }

    /**
     * Apply a patch to a copy of {@code job}. The original is not modified.
     *
     * @throws CronValidationException if the patched job would be invalid
     */
    public static CronJob applyPatch(CronJob job, CronJobPatch patch, long nowMs) {
        if (patch == null) {
            throw new CronValidationException("invalid cron patch: missing patch");
        }
        CronJob next = copy(job);
        if (patch.getName() != null) {
            if (patch.getName().isBlank()) {
                throw new CronValidationException("cron job name is required");
            }
            next.setName(patch.getName().trim());
        }
        if (patch.getDescription() != null) {
            next.setDescription(patch.getDescription());
        }
        if (patch.isClearAgentId()) {
            next.setAgentId(null);
        } else if (patch.getAgentId() != null) {
            next.setAgentId(CronNormalize.normalizeAgentId(patch.getAgentId()));
        }
        if (patch.getDeleteAfterRun() != null) {
            next.setDeleteAfterRun(patch.getDeleteAfterRun());
        }
        if (patch.getSessionTarget() != null) {
            next.setSessionTarget(patch.getSessionTarget());
        }
        if (patch.getWakeMode() != null) {
            next.setWakeMode(patch.getWakeMode());
        }
        if (patch.getPayload() != null) {
            next.setPayload(mergePayload(next.getPayload(), patch.getPayload()));
        }
        if (patch.getIsolation() != null) {
            next.setIsolation(patch.getIsolation());
        }
        boolean scheduleChanged = patch.getSchedule() != null;
        if (scheduleChanged) {
            next.setSchedule(patch.getSchedule());
        }
        boolean enabledChanged = patch.getEnabled() != null && patch.getEnabled() != job.isEnabled();
        if (patch.getEnabled() != null) {
            next.setEnabled(patch.getEnabled());
        }

        CronSchedules.validate(next.getSchedule());
        validatePayload(next.getPayload(), "cron.update");
        assertSupportedJobSpec(next.getSessionTarget(), next.getPayload());
        validateIsolation(next.getIsolation());

        next.setUpdatedAtMs(nowMs);
        if (!next.isEnabled()) {
            next.getState().setNextRunAtMs(null);
        } else if (scheduleChanged) {
            Long lastRun = next.getSchedule().getKind() == ScheduleKind.AT ? null : next.getState().getLastRunAtMs();
            next.getState().setNextRunAtMs(CronSchedules.computeNextRunAtMs(
                    next.getSchedule(), nowMs, lastRun, next.getCreatedAtMs()));
        } else if (enabledChanged || next.getState().getNextRunAtMs() == null) {
            // Covers jobs repaired after being marked invalid at load
            next.getState().setNextRunAtMs(computeJobNextRunAtMs(next, nowMs));
        }
        return next;
    }

    /**
     * Merge a payload patch. Fields of the same kind are merged over the
     * existing payload; switching kind requires a complete payload.
     */
    static CronPayload mergePayload(CronPayload existing, CronPayload patch) {
        PayloadKind kind = patch.getKind() != null ? patch.getKind()
                : existing != null ? existing.getKind() : null;
        if (kind == null) {
            throw new CronValidationException("cron.update payload.kind is required");
        }
        if (existing == null || existing.getKind() != kind) {
            if (kind == PayloadKind.SYSTEM_EVENT && isBlank(patch.getText())) {
                throw new CronValidationException("cron.update payload.kind=\"systemEvent\" requires text");
            }
            if (kind == PayloadKind.AGENT_TURN && isBlank(patch.getMessage())) {
                throw new CronValidationException("cron.update payload.kind=\"agentTurn\" requires message");
            }
            CronPayload replaced = copyPayload(patch);
            replaced.setKind(kind);
            return replaced;
        }
        CronPayload merged = copyPayload(existing);
        if (kind == PayloadKind.SYSTEM_EVENT) {
            if (patch.getText() != null)
                merged.setText(patch.getText());
            return merged;
        }
        if (patch.getMessage() != null)
            merged.setMessage(patch.getMessage());
        if (patch.getModel() != null)
            merged.setModel(patch.getModel());
        if (patch.getThinking() != null)
            merged.setThinking(patch.getThinking());
        if (patch.getTimeoutSeconds() != null)
            merged.setTimeoutSeconds(patch.getTimeoutSeconds());
        if (patch.getDeliver() != null)
            merged.setDeliver(patch.getDeliver());
        if (patch.getChannel() != null)
            merged.setChannel(patch.getChannel());
        if (patch.getTo() != null)
            merged.setTo(patch.getTo());
        if (patch.getBestEffortDeliver() != null)
            merged.setBestEffortDeliver(patch.getBestEffortDeliver());
        return merged;
    }

    // =========================================================================
    // Validation
    // =========================================================================

    /**
     * Enforce the session-target/payload pairing for add and update.
     */
    public static void assertSupportedJobSpec(SessionTarget target, CronPayload payload) {
        PayloadKind kind = payload != null ? payload.getKind() : null;
        if (target == SessionTarget.MAIN && kind != PayloadKind.SYSTEM_EVENT) {
            throw new CronValidationException("main cron jobs require payload.kind=\"systemEvent\"");
        }
        if (target == SessionTarget.ISOLATED && kind != PayloadKind.AGENT_TURN) {
            throw new CronValidationException("isolated cron jobs require payload.kind=\"agentTurn\"");
        }
    }

    /**
     * Reason a persisted job must not run, or null if it is runnable.
     */
    public static String invalidReason(CronJob job) {
        PayloadKind kind = job.getPayload() != null ? job.getPayload().getKind() : null;
        if (job.getSessionTarget() == SessionTarget.MAIN && kind != PayloadKind.SYSTEM_EVENT) {
            return "main job requires payload.kind=\"systemEvent\"";
        }
        if (job.getSessionTarget() == SessionTarget.ISOLATED && kind != PayloadKind.AGENT_TURN) {
            return "isolated job requires payload.kind=\"agentTurn\"";
        }
        return null;
    }

    private static void validatePayload(CronPayload payload, String context) {
        if (payload == null || payload.getKind() == null) {
            throw new CronValidationException("payload.kind is required (systemEvent or agentTurn)");
        }
        if (payload.getKind() == PayloadKind.SYSTEM_EVENT && isBlank(payload.getText())) {
            throw new CronValidationException(context + " payload.kind=\"systemEvent\" requires text");
        }
        if (payload.getKind() == PayloadKind.AGENT_TURN && isBlank(payload.getMessage())) {
            throw new CronValidationException(context + " payload.kind=\"agentTurn\" requires message");
        }
        if (payload.getTimeoutSeconds() != null && payload.getTimeoutSeconds() <= 0) {
            throw new CronValidationException("payload.timeoutSeconds must be positive");
        }
    }

    private static void validateIsolation(CronIsolation isolation) {
        if (isolation != null && isolation.getPostToMainMaxChars() != null
                && isolation.getPostToMainMaxChars() <= 0) {
            throw new CronValidationException("isolation.postToMainMaxChars must be positive");
        }
    }

    // =========================================================================
    // Scheduling helpers
    // =========================================================================

    public static Long computeJobNextRunAtMs(CronJob job, long nowMs) {
        return CronSchedules.computeNextRunAtMs(job.getSchedule(), nowMs,
                job.getState() != null ? job.getState().getLastRunAtMs() : null, job.getCreatedAtMs());
    }

    /**
     * True when the job is enabled, valid, not running and its next run has
     * arrived.
     */
    public static boolean isDue(CronJob job, long nowMs) {
        CronJobState state = job.getState();
        return job.isEnabled()
                && invalidReason(job) == null
                && state.getRunningAtMs() == null
                && state.getNextRunAtMs() != null
                && nowMs >= state.getNextRunAtMs();
    }

    public static CronJob copy(CronJob job) {
        return MAPPER.convertValue(job, CronJob.class);
    }

    private static CronPayload copyPayload(CronPayload payload) {
        return MAPPER.convertValue(payload, CronPayload.class);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
