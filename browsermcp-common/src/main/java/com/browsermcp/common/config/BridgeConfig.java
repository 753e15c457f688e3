package com.browsermcp.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolved bridge configuration.
 *
 * <p>Constructed once per process by {@link BridgeConfigLoader} and handed to every
 * component that needs it. Values map 1:1 to keys of {@code ~/.browsermcp/config.json}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BridgeConfig {

    public static final int DEFAULT_HTTP_PORT = 9008;
    public static final int DEFAULT_WS_PORT = 9009;
    public static final String DEFAULT_HOST = "127.0.0.1";

    /** Front door (HTTP) port. */
    @Builder.Default
    private int httpPort = DEFAULT_HTTP_PORT;

    /** Extension WebSocket port. */
    @Builder.Default
    private int wsPort = DEFAULT_WS_PORT;

    @Builder.Default
    private String host = DEFAULT_HOST;

    // ---- Correlator ----

    @Builder.Default
    private long callTimeoutMs = 30_000;

    // ---- Instance detection ----

    @Builder.Default
    private long healthTimeoutMs = 2_000;

    @Builder.Default
    private long probeTimeoutMs = 1_000;

    // ---- Lifecycle ----

    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private long retryDelayMs = 5_000;

    @Builder.Default
    private int maxStateHistory = 100;

    @Builder.Default
    private long connectedCheckIntervalMs = 5_000;

    @Builder.Default
    private long shutdownTimeoutMs = 15_000;

    // ---- Port eviction ----

    @Builder.Default
    private long portEvictionGraceMs = 1_000;

    @Builder.Default
    private long portFreeWaitMs = 5_000;

    public static BridgeConfig defaults() {
        return BridgeConfig.builder().build();
    }

    public String httpBaseUrl() {
        return "http://" + host + ":" + httpPort;
    }
}
