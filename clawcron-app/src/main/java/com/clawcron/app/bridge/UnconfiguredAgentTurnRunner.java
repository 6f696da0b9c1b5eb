package com.clawcron.app.bridge;

import com.clawcron.gateway.cron.CronJob;
import com.clawcron.gateway.cron.CronState.IsolatedAgentRunner;
import com.clawcron.gateway.cron.CronState.IsolatedRunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Isolated agent runner used until an agent runtime is plugged in; every
 * isolated job finishes with an error.
 */
@Slf4j
@Component
public class UnconfiguredAgentTurnRunner implements IsolatedAgentRunner {

    public static final String ERROR = "isolated agent runtime is not configured";

    @Override
    public CompletableFuture<IsolatedRunResult> run(CronJob job, String message) {
        log.warn("cron: isolated job {} cannot run: {}", job.getId(), ERROR);
        return CompletableFuture.completedFuture(IsolatedRunResult.error(null, ERROR));
    }
}
