package com.browsermcp.server;

import com.browsermcp.common.config.BridgeConfig;
import com.browsermcp.common.infra.PortEvictor;
import com.browsermcp.common.infra.PortProbe;
import com.browsermcp.relay.ConnectionManager;
import com.browsermcp.relay.ExtensionSocketListener;
import com.browsermcp.server.frontdoor.FrontDoorServer;
import com.browsermcp.tools.ToolCallBridge;
import io.netty.channel.ChannelFuture;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The listening half of an active bridge: extension socket listener plus HTTP front door.
 *
 * <p>Either listening channel closing before {@link #close()} is reported to the
 * {@code onUnexpectedStop} callback.
 */
@Slf4j
public class BridgeServer implements AutoCloseable {

    private final ConnectionManager connections;
    private final ExtensionSocketListener listener;
    private final FrontDoorServer frontDoor;
    private final AtomicBoolean closing = new AtomicBoolean();

    private volatile Consumer<Throwable> onUnexpectedStop = error -> {
    };

    public BridgeServer(BridgeConfig config, ConnectionManager connections, ToolCallBridge bridge,
                        PortEvictor evictor, PortProbe probe) {
        this.connections = connections;
        this.listener = new ExtensionSocketListener(config.getHost(), config.getWsPort(), connections,
                evictor, probe, config.getPortFreeWaitMs());
        this.frontDoor = new FrontDoorServer(config.getHost(), config.getHttpPort(), config.getWsPort(),
                bridge, connections);
    }

    public void setOnUnexpectedStop(Consumer<Throwable> onUnexpectedStop) {
        this.onUnexpectedStop = onUnexpectedStop;
    }

    /**
     * Start the socket listener, then the front door. A front door failure stops the listener.
     */
    public void start() throws InterruptedException {
        listener.start();
        try {
            frontDoor.start();
        } catch (RuntimeException | InterruptedException e) {
            listener.close();
            throw e;
        }
        watch(listener.closeFuture(), "extension listener");
        watch(frontDoor.closeFuture(), "front door");
        log.info("Bridge ready: http port {}, extension port {}", getHttpPort(), getWsPort());
    }

    private void watch(ChannelFuture closed, String what) {
        closed.addListener(future -> {
            if (!closing.get()) {
                log.error("{} channel closed unexpectedly", what);
                onUnexpectedStop.accept(new IllegalStateException(what + " channel closed"));
            }
        });
    }

    public int getHttpPort() {
        return frontDoor.getBoundPort();
    }

    public int getWsPort() {
        return listener.getBoundPort();
    }

    public boolean isRunning() {
        return listener.isRunning() && frontDoor.isRunning();
    }

    FrontDoorServer frontDoor() {
        return frontDoor;
    }

    @Override
    public void close() {
        closing.set(true);
        frontDoor.close();
        listener.close();
        connections.disconnect();
    }
}
