package com.clawcron.app.bridge;

import com.clawcron.common.config.ClawCronConfig;
import com.clawcron.common.config.ConfigService;
import com.clawcron.common.infra.HeartbeatRunner;
import com.clawcron.gateway.cron.CronState.HeartbeatRequester;
import com.clawcron.gateway.cron.CronState.HeartbeatRunOnce;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Heartbeat loop for the cron service. Each beat drains the system event
 * queue; without an agent runtime attached the drained events are logged.
 */
@Slf4j
@Component
public class HeartbeatBridge implements HeartbeatRequester, HeartbeatRunOnce {

    private final SystemEventQueue systemEvents;
    private final HeartbeatRunner runner;
    private volatile Map<String, List<SystemEventQueue.SystemEvent>> lastDelivered = Map.of();

    public HeartbeatBridge(SystemEventQueue systemEvents, ConfigService configService) {
        this.systemEvents = systemEvents;
        ClawCronConfig config = configService.loadConfig();
        long everyMs = config.getHeartbeat() != null
                ? config.getHeartbeat().getEveryMs()
                : new ClawCronConfig.HeartbeatConfig().getEveryMs();
        this.runner = new HeartbeatRunner(everyMs, this::beat);
    }

    @PostConstruct
    public void start() {
        runner.start();
    }

    @PreDestroy
    public void stop() {
        runner.close();
    }

    @Override
    public void requestNow(String reason) {
        runner.requestNow(reason);
    }

    @Override
    public CompletableFuture<HeartbeatRunner.RunResult> run(String reason) {
        return runner.runNow(reason);
    }

    /**
     * Events handed out by the most recent beat, keyed by agent.
     */
    public Map<String, List<SystemEventQueue.SystemEvent>> getLastDelivered() {
        return lastDelivered;
    }

    private HeartbeatRunner.RunResult beat(String reason) {
        long started = System.currentTimeMillis();
        Map<String, List<SystemEventQueue.SystemEvent>> drained = systemEvents.drainAll();
        if (drained.isEmpty()) {
            return HeartbeatRunner.RunResult.skipped("no-events");
        }
        lastDelivered = drained;
        drained.forEach((agentId, events) ->
                log.info("heartbeat ({}): {} system event(s) for agent {}", reason, events.size(), agentId));
        return HeartbeatRunner.RunResult.ran(System.currentTimeMillis() - started);
    }
}
