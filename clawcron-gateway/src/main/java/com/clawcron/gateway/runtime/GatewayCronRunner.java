package com.clawcron.gateway.runtime;

import com.clawcron.common.config.ClawCronConfig;
import com.clawcron.common.config.ConfigPaths;
import com.clawcron.common.infra.SignalManager;
import com.clawcron.common.infra.StoreLock;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState.CronEvent;
import com.clawcron.gateway.cron.CronState.CronServiceDeps;
import com.clawcron.gateway.cron.CronState.HeartbeatRequester;
import com.clawcron.gateway.cron.CronState.HeartbeatRunOnce;
import com.clawcron.gateway.cron.CronState.IsolatedAgentRunner;
import com.clawcron.gateway.cron.CronState.SystemEventSink;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Builds and configures the gateway-level cron service.
 *
 * <p>
 * Resolves the store path and lock settings from config, wires the
 * collaborators, fans cron events out to listeners, and ties the service to
 * the process lifecycle.
 */
@Slf4j
public class GatewayCronRunner {

    /**
     * Collaborators the cron service calls into.
     */
    @Getter
    @Builder
    public static class Collaborators {
        private final SystemEventSink systemEvents;
        private final HeartbeatRequester heartbeatRequester;
        private final HeartbeatRunOnce heartbeatRunOnce;
        private final IsolatedAgentRunner isolatedAgentRunner;
    }

    private final CronService cronService;
    private final boolean cronEnabled;
    private final Path storePath;
    private final List<Consumer<CronEvent>> listeners = new CopyOnWriteArrayList<>();
    private SignalManager.Registration cleanup;

    public GatewayCronRunner(ClawCronConfig config, Path stateDir, Map<String, String> env,
            Collaborators collaborators) {
        ClawCronConfig.CronConfig cron = config != null && config.getCron() != null
                ? config.getCron()
                : new ClawCronConfig.CronConfig();
        this.cronEnabled = cron.isEnabled() && !ConfigPaths.isCronSkipped(env);
        this.storePath = ConfigPaths.resolveCronStorePath(config, stateDir);

        StoreLock.Options lockOptions = cron.getLock() != null
                ? new StoreLock.Options(cron.getLock().getTimeoutMs(), cron.getLock().getStaleMs())
                : StoreLock.Options.DEFAULTS;

        this.cronService = new CronService(CronServiceDeps.builder()
                .storePath(storePath)
                .cronEnabled(cronEnabled)
                .systemEvents(collaborators.getSystemEvents())
                .heartbeatRequester(collaborators.getHeartbeatRequester())
                .heartbeatRunOnce(collaborators.getHeartbeatRunOnce())
                .isolatedAgentRunner(collaborators.getIsolatedAgentRunner())
                .onEvent(this::onCronEvent)
                .lockOptions(lockOptions)
                .heartbeatAckMaxChars(cron.getHeartbeatAckMaxChars())
                .build());
    }

    /**
     * Start the cron service. The store is loaded either way; the timer is
     * armed only when cron is enabled.
     */
    public void start() {
        if (!cronEnabled) {
            log.info("cron: disabled by config or {}", ConfigPaths.ENV_SKIP_CRON);
        }
        cronService.start();
        cleanup = SignalManager.getInstance().register("cron-service", cronService::stop);
    }

    /**
     * Stop the cron service.
     */
    public void stop() {
        if (cleanup != null) {
            cleanup.close();
            cleanup = null;
        }
        cronService.stop();
    }

    public void addListener(Consumer<CronEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Fan a cron event out to registered listeners.
     */
    void onCronEvent(CronEvent event) {
        log.debug("cron: event {} job={} status={}", event.getAction(), event.getJobId(),
                event.getStatus() != null ? event.getStatus().key() : null);
        for (Consumer<CronEvent> listener : listeners) {
            listener.accept(event);
        }
    }

    public boolean isCronEnabled() {
        return cronEnabled;
    }

    public Path getStorePath() {
        return storePath;
    }

    public CronService getCronService() {
        return cronService;
    }
}
