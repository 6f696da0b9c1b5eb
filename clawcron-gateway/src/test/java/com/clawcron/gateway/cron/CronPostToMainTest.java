package com.clawcron.gateway.cron;

import com.clawcron.gateway.cron.CronState.IsolatedRunResult;
import com.clawcron.gateway.cron.CronTypes.CronIsolation;
import com.clawcron.gateway.cron.CronTypes.CronPayload;
import com.clawcron.gateway.cron.CronTypes.PostToMainMode;
import com.clawcron.gateway.cron.CronTypes.RunStatus;
import com.clawcron.gateway.cron.CronTypes.SessionTarget;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CronPostToMain}.
 */
class CronPostToMainTest {

    private static CronJob isolated(CronIsolation isolation) {
        return CronJob.builder()
                .id("iso")
                .name("iso")
                .sessionTarget(SessionTarget.ISOLATED)
                .payload(CronPayload.agentTurn("go"))
                .isolation(isolation)
                .build();
    }

    @Test
    void okSummary_isPrefixed() {
        assertEquals("Cron: done",
                CronPostToMain.resolveMessage(isolated(null), IsolatedRunResult.ok("done"), null));
    }

    @Test
    void errorResult_usesSummaryOrOutput() {
        var result = new IsolatedRunResult(RunStatus.ERROR, null, "last output", "boom");
        assertEquals("Cron (error): last output", CronPostToMain.resolveMessage(isolated(null), result, null));

        var withSummary = IsolatedRunResult.error("it broke", "boom");
        assertEquals("Cron (error): it broke", CronPostToMain.resolveMessage(isolated(null), withSummary, null));
    }

    @Test
    void skippedResult_fallsBackToStatus() {
        var result = new IsolatedRunResult(RunStatus.SKIPPED, null, null, null);
        assertEquals("Cron (skipped): skipped", CronPostToMain.resolveMessage(isolated(null), result, null));
    }

    @Test
    void heartbeatAckOnly_isSuppressed() {
        assertNull(CronPostToMain.resolveMessage(isolated(null), IsolatedRunResult.ok("HEARTBEAT_OK"), null));
        assertNull(CronPostToMain.resolveMessage(isolated(null), IsolatedRunResult.ok("HEARTBEAT_OK all good"), null));
    }

    @Test
    void heartbeatTokenWithLongContent_isPosted() {
        String summary = "HEARTBEAT_OK " + "a".repeat(400);
        assertEquals("Cron: " + summary,
                CronPostToMain.resolveMessage(isolated(null), IsolatedRunResult.ok(summary), null));
    }

    @Test
    void ackMaxChars_controlsSuppression() {
        String summary = "HEARTBEAT_OK " + "a".repeat(50);
        assertNotNull(CronPostToMain.resolveMessage(isolated(null), IsolatedRunResult.ok(summary), 10));
        assertNull(CronPostToMain.resolveMessage(isolated(null), IsolatedRunResult.ok(summary), 100));
    }

    @Test
    void blankOk_postsNothing() {
        assertNull(CronPostToMain.resolveMessage(isolated(null), IsolatedRunResult.ok("  "), null));
    }

    @Test
    void customPrefix() {
        CronIsolation isolation = CronIsolation.builder().postToMainPrefix("Digest").build();
        assertEquals("Digest: done",
                CronPostToMain.resolveMessage(isolated(isolation), IsolatedRunResult.ok("done"), null));
    }

    @Test
    void fullMode_prefersOutputAndTruncates() {
        CronIsolation isolation = CronIsolation.builder()
                .postToMainMode(PostToMainMode.FULL)
                .postToMainMaxChars(5)
                .build();
        var result = new IsolatedRunResult(RunStatus.OK, "short", "0123456789", null);
        assertEquals("Cron: 01234…", CronPostToMain.resolveMessage(isolated(isolation), result, null));
    }

    @Test
    void summaryMode_prefersSummary() {
        var result = new IsolatedRunResult(RunStatus.OK, "short", "long output", null);
        assertEquals("Cron: short", CronPostToMain.resolveMessage(isolated(null), result, null));
    }

    @Test
    void errorMessage_format() {
        assertEquals("Cron (error): runner exploded", CronPostToMain.errorMessage(isolated(null), "runner exploded"));
        assertEquals("Cron (error): unknown error", CronPostToMain.errorMessage(isolated(null), null));
    }
}
