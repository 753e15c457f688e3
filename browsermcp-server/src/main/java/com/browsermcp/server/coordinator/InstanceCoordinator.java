package com.browsermcp.server.coordinator;

import com.browsermcp.common.config.BridgeConfig;
import com.browsermcp.common.infra.PortProbe;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Finds out whether a bridge is already running on this machine.
 *
 * <p>Both well-known ports are probed concurrently with connect attempts. When the front
 * door port answers, a short {@code GET /health} decides health: any status below 500 counts.
 */
@Slf4j
public class InstanceCoordinator {

    private final BridgeConfig config;
    private final PortProbe probe;
    private final OkHttpClient http;

    public InstanceCoordinator(BridgeConfig config) {
        this(config, new PortProbe(config.getProbeTimeoutMs()), new OkHttpClient.Builder()
                .connectTimeout(config.getHealthTimeoutMs(), TimeUnit.MILLISECONDS)
                .callTimeout(config.getHealthTimeoutMs(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build());
    }

    public InstanceCoordinator(BridgeConfig config, PortProbe probe, OkHttpClient http) {
        this.config = config;
        this.probe = probe;
        this.http = http;
    }

    public DetectionResult detect() {
        String host = config.getHost();
        CompletableFuture<Boolean> httpProbe = CompletableFuture.supplyAsync(
                () -> probe.isListening(host, config.getHttpPort()));
        CompletableFuture<Boolean> wsProbe = CompletableFuture.supplyAsync(
                () -> probe.isListening(host, config.getWsPort()));

        boolean httpListening = httpProbe.join();
        boolean wsListening = wsProbe.join();
        boolean healthy = httpListening && checkHealth();

        DetectionResult result = DetectionResult.builder()
                .exists(httpListening || wsListening)
                .healthy(healthy)
                .httpListening(httpListening)
                .wsListening(wsListening)
                .ports(new DetectionResult.Ports(config.getHttpPort(), config.getWsPort()))
                .build();
        log.debug("Instance detection: {}", result);
        return result;
    }

    /**
     * Poll {@link #detect()} until a healthy instance shows up.
     *
     * @return true if one appeared within {@code maxWaitMs}
     */
    public boolean waitForInstance(long maxWaitMs, long intervalMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + maxWaitMs;
        while (true) {
            if (detect().shouldForward()) {
                return true;
            }
            if (System.currentTimeMillis() + intervalMs > deadline) {
                return false;
            }
            Thread.sleep(intervalMs);
        }
    }

    boolean checkHealth() {
        Request request = new Request.Builder()
                .url(config.httpBaseUrl() + "/health")
                .get()
                .build();
        try (Response response = http.newCall(request).execute()) {
            int code = response.code();
            log.debug("Health check answered {}", code);
            return code < 500;
        } catch (IOException e) {
            log.debug("Health check failed: {}", e.getMessage());
            return false;
        }
    }
}
