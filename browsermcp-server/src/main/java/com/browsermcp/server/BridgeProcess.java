package com.browsermcp.server;

import com.browsermcp.common.config.BridgeConfig;
import com.browsermcp.common.infra.PortEvictor;
import com.browsermcp.common.infra.PortProbe;
import com.browsermcp.common.logging.LogFiles;
import com.browsermcp.relay.ConnectionManager;
import com.browsermcp.server.coordinator.DetectionResult;
import com.browsermcp.server.coordinator.ForwardingToolExecutor;
import com.browsermcp.server.lifecycle.LifecycleStateMachine;
import com.browsermcp.server.mcp.McpStdioServer;
import com.browsermcp.tools.ResourceRegistry;
import com.browsermcp.tools.ToolCallBridge;
import com.browsermcp.tools.ToolExecutor;
import com.browsermcp.tools.ToolRegistry;
import com.browsermcp.tools.builtin.BrowserTools;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One bridge process, wired for either mode.
 *
 * <p>Active: every server creation starts a {@link BridgeServer} that owns both ports, and
 * stdio tool calls run through the local {@link ToolCallBridge}. Forwarding: server creation
 * opens nothing, and stdio tool calls are reissued against the healthy bridge's front door.
 */
@Slf4j
final class BridgeProcess {

    private final BridgeConfig config;
    private final boolean forwarding;
    private final PortEvictor evictor;
    private final ConnectionManager connections;
    private final ToolCallBridge bridge;
    private final McpStdioServer stdio;
    private final LifecycleStateMachine lifecycle;
    private final AtomicBoolean exitReported = new AtomicBoolean();

    private volatile BridgeServer activeServer;

    private BridgeProcess(BridgeConfig config, boolean forwarding, PortEvictor evictor,
                          InputStream in, OutputStream out) {
        this.config = config;
        this.forwarding = forwarding;
        this.evictor = evictor;

        ToolRegistry tools = new ToolRegistry(BrowserTools.all());
        ResourceRegistry resources = ResourceRegistry.empty();
        ToolExecutor executor;
        if (forwarding) {
            this.connections = null;
            this.bridge = null;
            executor = new ForwardingToolExecutor(config.httpBaseUrl(), config.getCallTimeoutMs());
        } else {
            this.connections = new ConnectionManager(config.getCallTimeoutMs());
            this.bridge = new ToolCallBridge(tools, resources, connections);
            executor = bridge;
        }
        this.stdio = new McpStdioServer(tools, resources, executor, in, out);
        this.lifecycle = new LifecycleStateMachine(config, this::createServer, this::attachTransport);

        if (!forwarding) {
            lifecycle.setServerHealthCheck(server -> !(server instanceof BridgeServer b) || b.isRunning());
        }
        stdio.setOnInputClosed(() -> lifecycle.requestShutdown("stdin closed"));
        stdio.setOnWriteFailure(lifecycle::reportError);
    }

    static BridgeProcess create(BridgeConfig config, DetectionResult detection, PortEvictor evictor,
                                InputStream in, OutputStream out) {
        if (detection.shouldForward()) {
            log.info("Healthy bridge found on port {}, forwarding tool calls", config.getHttpPort());
        } else if (detection.isExists()) {
            log.warn("Bridge on ports {}/{} is not healthy, taking over",
                    config.getHttpPort(), config.getWsPort());
        }
        return new BridgeProcess(config, detection.shouldForward(), evictor, in, out);
    }

    private AutoCloseable createServer() throws InterruptedException {
        if (forwarding) {
            return () -> log.debug("forwarder stopped");
        }
        BridgeServer server = new BridgeServer(config, connections, bridge, evictor,
                new PortProbe(config.getProbeTimeoutMs()));
        server.setOnUnexpectedStop(lifecycle::reportError);
        server.start();
        activeServer = server;
        return server;
    }

    private AutoCloseable attachTransport(AutoCloseable server) {
        stdio.start();
        return () -> log.debug("stdio transport detached");
    }

    /**
     * Run the lifecycle to completion and release process-scoped resources.
     *
     * @return process exit code
     */
    int run() {
        int code = lifecycle.run();
        stdio.close();
        if (connections != null) {
            connections.close();
        }
        return code;
    }

    /** Point at the log file once, on a non-zero exit. */
    void reportExit(int code, PrintStream err) {
        if (code != 0 && exitReported.compareAndSet(false, true)) {
            err.println("Full logs available at: " + LogFiles.describeCurrent());
        }
    }

    boolean isForwarding() {
        return forwarding;
    }

    LifecycleStateMachine lifecycle() {
        return lifecycle;
    }

    BridgeServer activeServer() {
        return activeServer;
    }
}
