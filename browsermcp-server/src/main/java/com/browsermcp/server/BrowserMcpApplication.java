package com.browsermcp.server;

import com.browsermcp.common.config.BridgeConfig;
import com.browsermcp.common.config.BridgeConfigLoader;
import com.browsermcp.common.infra.ProcessPortEvictor;
import com.browsermcp.common.logging.LogFiles;
import com.browsermcp.server.coordinator.DetectionResult;
import com.browsermcp.server.coordinator.InstanceCoordinator;
import com.browsermcp.server.lifecycle.LifecycleStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point.
 *
 * <p>Detects a running bridge first. When a healthy one answers, this process only serves
 * the stdio protocol and forwards tool calls to it over HTTP; otherwise it becomes the
 * active bridge and owns both ports.
 */
public final class BrowserMcpApplication {

    private static final long STARTING_PEER_POLL_MS = 250;

    private BrowserMcpApplication() {
    }

    public static void main(String[] args) {
        // must precede the first logger so logback picks up the file location
        LogFiles.install();
        Logger log = LoggerFactory.getLogger(BrowserMcpApplication.class);

        BridgeConfig config = new BridgeConfigLoader().load();
        log.info("Starting {} {} (log file {})", ServerInfo.NAME, ServerInfo.VERSION, LogFiles.describeCurrent());

        DetectionResult detection = detect(config, log);
        BridgeProcess process = BridgeProcess.create(config, detection,
                new ProcessPortEvictor(config.getPortEvictionGraceMs()), System.in, System.out);
        LifecycleStateMachine lifecycle = process.lifecycle();

        // a signal leaves System.exit in main blocked behind this hook, so the hook decides the status
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            lifecycle.requestShutdown("signal");
            try {
                lifecycle.awaitTermination(config.getShutdownTimeoutMs() + 1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            int code = lifecycle.getExitCode();
            process.reportExit(code, System.err);
            Runtime.getRuntime().halt(code);
        }, "browsermcp-shutdown-hook"));
        Thread.setDefaultUncaughtExceptionHandler((thread, error) -> {
            log.error("Uncaught exception in {}", thread.getName(), error);
            lifecycle.requestShutdown("uncaught exception");
        });

        int code = process.run();
        process.reportExit(code, System.err);
        System.exit(code);
    }

    /**
     * Look for a running bridge. A front door that answers the port but not yet
     * {@code /health} may still be starting, so it gets {@code portFreeWaitMs} to become healthy.
     */
    private static DetectionResult detect(BridgeConfig config, Logger log) {
        InstanceCoordinator coordinator = new InstanceCoordinator(config);
        DetectionResult detection = coordinator.detect();
        if (!detection.isHttpListening() || detection.isHealthy()) {
            return detection;
        }
        log.info("Front door on port {} is not healthy yet, waiting up to {}ms",
                config.getHttpPort(), config.getPortFreeWaitMs());
        try {
            if (coordinator.waitForInstance(config.getPortFreeWaitMs(), STARTING_PEER_POLL_MS)) {
                return coordinator.detect();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return detection;
    }
}
