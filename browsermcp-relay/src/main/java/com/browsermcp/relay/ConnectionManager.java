package com.browsermcp.relay;

import com.browsermcp.common.errors.NotConnectedException;
import com.browsermcp.common.errors.TransportException;
import com.browsermcp.common.infra.Futures;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Owns the single current extension socket.
 *
 * <p>{@link #attach} is the only place the slot is assigned. It fails the previous socket's
 * pending calls and closes it before the new socket becomes current. Reads
 * ({@link #hasConnection}, {@link #call}) may come from any thread.
 */
@Slf4j
public class ConnectionManager implements ExtensionClient, AutoCloseable {

    private final long defaultTimeoutMs;
    private final ScheduledExecutorService timer;
    private final Object lock = new Object();

    private volatile MessageCorrelator current;

    public ConnectionManager(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "browsermcp-call-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public boolean hasConnection() {
        MessageCorrelator correlator = current;
        return correlator != null && correlator.getSocket().isOpen();
    }

    @Override
    public CompletableFuture<JsonNode> call(String type, Object payload) {
        return call(type, payload, defaultTimeoutMs);
    }

    /**
     * Send a request over the current socket.
     *
     * <p>Fails with {@link NotConnectedException} without writing anything when no socket is
     * attached. Transport failures are not retried.
     */
    public CompletableFuture<JsonNode> call(String type, Object payload, long timeoutMs) {
        MessageCorrelator correlator = current;
        if (correlator == null || !correlator.getSocket().isOpen()) {
            return Futures.failed(new NotConnectedException());
        }
        return correlator.call(type, payload, timeoutMs);
    }

    /**
     * Make {@code socket} the current connection, replacing any previous one.
     *
     * @return the correlator that inbound frames for {@code socket} must be fed into
     */
    public MessageCorrelator attach(ExtensionSocket socket) {
        synchronized (lock) {
            MessageCorrelator previous = current;
            if (previous != null) {
                retire(previous, "WebSocket connection replaced by a new connection");
                log.info("Replacing existing extension connection");
            }
            MessageCorrelator correlator = new MessageCorrelator(socket, timer);
            current = correlator;
            log.info("Browser extension connected");
            return correlator;
        }
    }

    /**
     * Forget {@code socket} after it closed. No-op when it is no longer current.
     */
    public void detach(ExtensionSocket socket) {
        synchronized (lock) {
            MessageCorrelator correlator = current;
            if (correlator == null || correlator.getSocket() != socket) {
                return;
            }
            current = null;
            correlator.onClose();
            log.info("Browser extension disconnected");
        }
    }

    /**
     * Close the current socket, if any, failing its pending calls.
     */
    public void disconnect() {
        synchronized (lock) {
            MessageCorrelator correlator = current;
            current = null;
            if (correlator != null) {
                retire(correlator, "WebSocket connection closed");
            }
        }
    }

    public int pendingCount() {
        MessageCorrelator correlator = current;
        return correlator != null ? correlator.pendingCount() : 0;
    }

    @Override
    public void close() {
        disconnect();
        timer.shutdownNow();
    }

    private void retire(MessageCorrelator correlator, String reason) {
        correlator.failAll(new TransportException(reason));
        try {
            correlator.getSocket().close();
        } catch (RuntimeException e) {
            log.debug("Ignoring error while closing extension socket: {}", e.getMessage());
        }
    }
}
