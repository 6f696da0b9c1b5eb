package com.clawcron.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory, config file and cron store.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    // =========================================================================
    // Directory / file name constants
    // =========================================================================

    private static final String STATE_DIRNAME = ".clawcron";
    private static final String CONFIG_FILENAME = "clawcron.json";
    private static final String CRON_DIRNAME = "cron";
    private static final String CRON_STORE_FILENAME = "jobs.json";

    public static final String ENV_STATE_DIR = "CLAWCRON_STATE_DIR";
    public static final String ENV_CONFIG_PATH = "CLAWCRON_CONFIG_PATH";
    public static final String ENV_SKIP_CRON = "CLAWCRON_SKIP_CRON";

    // =========================================================================
    // State directory
    // =========================================================================

    /**
     * State directory for mutable data (cron store, run logs).
     * Can be overridden via CLAWCRON_STATE_DIR.
     * Default: ~/.clawcron
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, ENV_STATE_DIR);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    // =========================================================================
    // Config file / cron store
    // =========================================================================

    public static Path resolveConfigPath() {
        return resolveConfigPath(System.getenv(), resolveStateDir());
    }

    public static Path resolveConfigPath(Map<String, String> env, Path stateDir) {
        String override = envTrimmed(env, ENV_CONFIG_PATH);
        if (override != null) {
            return resolveUserPath(override, homeDir());
        }
        return stateDir.resolve(CONFIG_FILENAME);
    }

    /**
     * Cron store path: {@code cron.store} from config when set, else
     * {@code <stateDir>/cron/jobs.json}.
     */
    public static Path resolveCronStorePath(ClawCronConfig config, Path stateDir) {
        if (config != null && config.getCron() != null) {
            String configured = config.getCron().getStore();
            if (configured != null && !configured.isBlank()) {
                return resolveUserPath(configured, homeDir());
            }
        }
        return stateDir.resolve(CRON_DIRNAME).resolve(CRON_STORE_FILENAME);
    }

    /**
     * True when CLAWCRON_SKIP_CRON=1 asks the process not to arm the cron timer.
     */
    public static boolean isCronSkipped(Map<String, String> env) {
        return "1".equals(envTrimmed(env, ENV_SKIP_CRON));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    public static Path resolveUserPath(String input, String homedir) {
        if (input == null)
            return Path.of("");
        String trimmed = input.trim();
        if (trimmed.isEmpty())
            return Path.of("");
        if (trimmed.equals("~") || trimmed.startsWith("~/")) {
            return Path.of(homedir + trimmed.substring(1)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String val = env.get(key);
        return val != null && !val.trim().isEmpty() ? val.trim() : null;
    }
}
