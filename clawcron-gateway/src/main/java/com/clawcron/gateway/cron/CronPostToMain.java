package com.clawcron.gateway.cron;

import com.clawcron.common.infra.HeartbeatToken;
import com.clawcron.gateway.cron.CronState.IsolatedRunResult;
import com.clawcron.gateway.cron.CronTypes.CronIsolation;
import com.clawcron.gateway.cron.CronTypes.PostToMainMode;
import com.clawcron.gateway.cron.CronTypes.RunStatus;

/**
 * Builds the system event an isolated job posts back to the main session.
 */
public final class CronPostToMain {

    private CronPostToMain() {
    }

    public static final String DEFAULT_PREFIX = "Cron";
    public static final int DEFAULT_MAX_CHARS = 8_000;

    /**
     * Text to post for an isolated run, or null when nothing should be posted
     * (an ok result that only acknowledges the heartbeat, or no content).
     */
    public static String resolveMessage(CronJob job, IsolatedRunResult result, Integer ackMaxChars) {
        RunStatus status = result.status() != null ? result.status() : RunStatus.OK;
        String prefix = prefix(job);
        if (status != RunStatus.OK) {
            String body = firstNonBlank(result.summary(), result.outputText(), result.error(), status.key());
            return prefix + " (" + status.key() + "): " + body.trim();
        }

        String body = mode(job) == PostToMainMode.FULL
                ? truncate(firstNonBlank(result.outputText(), result.summary()), maxChars(job))
                : firstNonBlank(result.summary(), result.outputText());
        if (body == null || body.isBlank()) {
            return null;
        }
        HeartbeatToken.StripResult stripped = HeartbeatToken.strip(body, ackMaxChars);
        if (stripped.shouldSkip()) {
            return null;
        }
        return prefix + ": " + body.trim();
    }

    /**
     * Text to post when the isolated runner itself failed.
     */
    public static String errorMessage(CronJob job, String error) {
        return prefix(job) + " (error): " + (error != null && !error.isBlank() ? error : "unknown error");
    }

    private static String prefix(CronJob job) {
        CronIsolation isolation = job.getIsolation();
        String prefix = isolation != null ? isolation.getPostToMainPrefix() : null;
        return prefix != null && !prefix.isBlank() ? prefix.trim() : DEFAULT_PREFIX;
    }

    private static PostToMainMode mode(CronJob job) {
        CronIsolation isolation = job.getIsolation();
        return isolation != null && isolation.getPostToMainMode() != null
                ? isolation.getPostToMainMode()
                : PostToMainMode.SUMMARY;
    }

    private static int maxChars(CronJob job) {
        CronIsolation isolation = job.getIsolation();
        Integer max = isolation != null ? isolation.getPostToMainMaxChars() : null;
        return max != null && max > 0 ? max : DEFAULT_MAX_CHARS;
    }

    static String truncate(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "…";
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank())
                return v;
        }
        return null;
    }
}
