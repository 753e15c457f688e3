package com.browsermcp.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Loads {@link BridgeConfig} from an optional JSON file, then applies environment overrides.
 *
 * <p>Lookup order for the file: {@code BROWSERMCP_CONFIG}, then {@code ~/.browsermcp/config.json}.
 * A missing file is not an error. A malformed file or env value is logged and ignored.
 */
@Slf4j
public class BridgeConfigLoader {

    public static final String ENV_CONFIG_PATH = "BROWSERMCP_CONFIG";
    public static final String ENV_HTTP_PORT = "BROWSERMCP_HTTP_PORT";
    public static final String ENV_WS_PORT = "BROWSERMCP_WS_PORT";
    public static final String ENV_HOST = "BROWSERMCP_HOST";
    public static final String ENV_CALL_TIMEOUT_MS = "BROWSERMCP_CALL_TIMEOUT_MS";
    public static final String ENV_MAX_RETRIES = "BROWSERMCP_MAX_RETRIES";
    public static final String ENV_RETRY_DELAY_MS = "BROWSERMCP_RETRY_DELAY_MS";

    private static final String STATE_DIRNAME = ".browsermcp";
    private static final String CONFIG_FILENAME = "config.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Map<String, String> env;
    private final String homeDir;

    public BridgeConfigLoader() {
        this(System.getenv(), System.getProperty("user.home"));
    }

    public BridgeConfigLoader(Map<String, String> env, String homeDir) {
        this.env = env;
        this.homeDir = homeDir;
    }

    public BridgeConfig load() {
        BridgeConfig config = readFile(resolveConfigPath());
        applyEnvOverrides(config);
        return config;
    }

    public Path resolveConfigPath() {
        String override = envTrimmed(ENV_CONFIG_PATH);
        if (override != null) {
            if (override.startsWith("~")) {
                override = homeDir + override.substring(1);
            }
            return Path.of(override);
        }
        return Path.of(homeDir, STATE_DIRNAME, CONFIG_FILENAME);
    }

    BridgeConfig readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return BridgeConfig.defaults();
        }
        try {
            BridgeConfig parsed = objectMapper.readValue(Files.readString(path), BridgeConfig.class);
            log.debug("Loaded config from {}", path);
            return parsed != null ? parsed : BridgeConfig.defaults();
        } catch (IOException e) {
            log.warn("Ignoring unreadable config file {}: {}", path, e.getMessage());
            return BridgeConfig.defaults();
        }
    }

    void applyEnvOverrides(BridgeConfig config) {
        applyInt(ENV_HTTP_PORT, config::setHttpPort);
        applyInt(ENV_WS_PORT, config::setWsPort);
        applyInt(ENV_MAX_RETRIES, config::setMaxRetries);
        applyLong(ENV_CALL_TIMEOUT_MS, config::setCallTimeoutMs);
        applyLong(ENV_RETRY_DELAY_MS, config::setRetryDelayMs);
        String host = envTrimmed(ENV_HOST);
        if (host != null) {
            config.setHost(host);
        }
    }

    private void applyInt(String key, Consumer<Integer> setter) {
        String raw = envTrimmed(key);
        if (raw == null) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", key, raw);
        }
    }

    private void applyLong(String key, Consumer<Long> setter) {
        String raw = envTrimmed(key);
        if (raw == null) {
            return;
        }
        try {
            setter.accept(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", key, raw);
        }
    }

    private String envTrimmed(String key) {
        String value = env.get(key);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
