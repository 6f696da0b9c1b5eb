package com.clawcron.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the ClawCron configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, ClawCronConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ClawCronConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ClawCronConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private ClawCronConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.debug("config file not found: {}, using defaults", configPath);
            return applyDefaults(new ClawCronConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            ClawCronConfig config = objectMapper.readValue(raw, ClawCronConfig.class);
            log.info("config loaded from: {}", configPath);
            return applyDefaults(config != null ? config : new ClawCronConfig());
        } catch (IOException e) {
            log.error("failed to load config from: {}", configPath, e);
            return applyDefaults(new ClawCronConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName, defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    ClawCronConfig applyDefaults(ClawCronConfig config) {
        if (config.getCron() == null) {
            config.setCron(new ClawCronConfig.CronConfig());
        }
        if (config.getCron().getLock() == null) {
            config.getCron().setLock(new ClawCronConfig.LockConfig());
        }
        if (config.getHeartbeat() == null) {
            config.setHeartbeat(new ClawCronConfig.HeartbeatConfig());
        }
        return config;
    }
}
