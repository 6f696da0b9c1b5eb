package com.clawcron.gateway;

import com.clawcron.common.config.ConfigPaths;
import com.clawcron.common.config.ConfigService;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState.HeartbeatRequester;
import com.clawcron.gateway.cron.CronState.HeartbeatRunOnce;
import com.clawcron.gateway.cron.CronState.IsolatedAgentRunner;
import com.clawcron.gateway.cron.CronState.SystemEventSink;
import com.clawcron.gateway.rpc.GatewayMethodRouter;
import com.clawcron.gateway.runtime.GatewayCronRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for Gateway beans.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${clawcron.state.dir:}")
    private String stateDir;
    @Value("${clawcron.config.path:}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        Path resolved = configPath.isBlank()
                ? ConfigPaths.resolveConfigPath(System.getenv(), resolveStateDir())
                : ConfigPaths.resolveUserPath(configPath, System.getProperty("user.home"));
        return new ConfigService(resolved);
    }

    @Bean
    public GatewayMethodRouter gatewayMethodRouter() {
        return new GatewayMethodRouter();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public GatewayCronRunner gatewayCronRunner(ConfigService configService,
            SystemEventSink systemEventSink,
            HeartbeatRequester heartbeatRequester,
            ObjectProvider<HeartbeatRunOnce> heartbeatRunOnce,
            IsolatedAgentRunner isolatedAgentRunner) {
        return new GatewayCronRunner(configService.loadConfig(), resolveStateDir(), System.getenv(),
                GatewayCronRunner.Collaborators.builder()
                        .systemEvents(systemEventSink)
                        .heartbeatRequester(heartbeatRequester)
                        .heartbeatRunOnce(heartbeatRunOnce.getIfAvailable())
                        .isolatedAgentRunner(isolatedAgentRunner)
                        .build());
    }

    @Bean
    public CronService cronService(GatewayCronRunner gatewayCronRunner) {
        return gatewayCronRunner.getCronService();
    }

    private Path resolveStateDir() {
        if (stateDir.isBlank()) {
            return ConfigPaths.resolveStateDir();
        }
        return ConfigPaths.resolveUserPath(stateDir, System.getProperty("user.home"));
    }
}
