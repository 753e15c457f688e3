package com.browsermcp.server.lifecycle;

import com.browsermcp.common.config.BridgeConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Drives the bridge through creation, connection, retry, reconnect and shutdown.
 *
 * <p>{@link #run()} executes the whole lifecycle on the calling thread and returns the
 * process exit code. Other threads interact only through {@link #requestShutdown(String)}
 * and {@link #reportError(Throwable)}, which wake the loop out of any pause.
 *
 * <ul>
 *   <li>Server creation is attempted {@code maxRetries + 1} times before {@code FAILED}.</li>
 *   <li>Connection failures past {@code maxRetries} rebuild everything via {@code RESTARTING}.</li>
 *   <li>An error while {@code CONNECTED} resets the retry budget and rebuilds via {@code RECONNECTING}.</li>
 *   <li>Shutdown cleanup is capped at {@code shutdownTimeoutMs}.</li>
 * </ul>
 */
@Slf4j
public class LifecycleStateMachine {

    private static final int RECENT_HISTORY = 10;

    /** Builds the listening side of the bridge. */
    @FunctionalInterface
    public interface ServerFactory {
        AutoCloseable create() throws Exception;
    }

    /** Attaches the outward protocol transport to a created server. */
    @FunctionalInterface
    public interface TransportConnector {
        AutoCloseable connect(AutoCloseable server) throws Exception;
    }

    private final BridgeConfig config;
    private final ServerFactory serverFactory;
    private final TransportConnector connector;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final Deque<TransitionRecord> history = new ArrayDeque<>();

    private volatile LifecycleState state = LifecycleState.INITIALIZING;
    private volatile int retryCount;
    private volatile String shutdownReason;
    private volatile Throwable pendingError;
    private volatile AutoCloseable server;
    private volatile AutoCloseable transport;
    private volatile int exitCode = 1;
    private volatile Predicate<AutoCloseable> serverHealth = s -> true;

    public LifecycleStateMachine(BridgeConfig config, ServerFactory serverFactory, TransportConnector connector) {
        this.config = config;
        this.serverFactory = serverFactory;
        this.connector = connector;
    }

    /**
     * Check applied to the live server on every {@code CONNECTED} tick. A failing check
     * is handled like a reported error.
     */
    public void setServerHealthCheck(Predicate<AutoCloseable> serverHealth) {
        this.serverHealth = serverHealth;
    }

    /**
     * Run until {@code SHUTDOWN} or {@code FAILED}.
     *
     * @return 0 after a clean shutdown, 1 otherwise
     */
    public int run() {
        try {
            transition(LifecycleState.CREATING_SERVER, context());
            while (!state.isTerminal()) {
                if (shutdownRequested.get() && state != LifecycleState.SHUTTING_DOWN) {
                    transition(LifecycleState.SHUTTING_DOWN, context("reason", shutdownReason));
                }
                step();
            }
            if (state == LifecycleState.FAILED) {
                cleanupQuietly();
                exitCode = 1;
            }
            return exitCode;
        } finally {
            terminated.countDown();
        }
    }

    private void step() {
        switch (state) {
            case CREATING_SERVER -> createServer();
            case RETRYING_SERVER_CREATION -> {
                pause(config.getRetryDelayMs());
                if (!shutdownRequested.get()) {
                    transition(LifecycleState.CREATING_SERVER, context("attempt", retryCount + 1));
                }
            }
            case CONNECTING -> connectTransport();
            case RETRYING_CONNECTION -> {
                if (retryCount > config.getMaxRetries()) {
                    transition(LifecycleState.RESTARTING, context("retryCount", retryCount));
                } else {
                    pause(config.getRetryDelayMs());
                    if (!shutdownRequested.get()) {
                        transition(LifecycleState.CONNECTING, context("attempt", retryCount + 1));
                    }
                }
            }
            case CONNECTED -> awaitWhileConnected();
            case RECONNECTING -> {
                cleanupQuietly();
                transition(LifecycleState.CREATING_SERVER, context());
            }
            case RESTARTING -> {
                cleanupQuietly();
                retryCount = 0;
                transition(LifecycleState.CREATING_SERVER, context());
            }
            case SHUTTING_DOWN -> shutDown();
            default -> throw new IllegalStateException("No action for state " + state);
        }
    }

    private void createServer() {
        try {
            server = serverFactory.create();
            transition(LifecycleState.CONNECTING, context());
        } catch (Exception e) {
            log.error("Server creation failed (attempt {}/{})", retryCount + 1, config.getMaxRetries() + 1, e);
            if (retryCount < config.getMaxRetries()) {
                retryCount++;
                transition(LifecycleState.RETRYING_SERVER_CREATION, context("error", e.getMessage()));
            } else {
                transition(LifecycleState.FAILED, context("error", e.getMessage()));
            }
        }
    }

    private void connectTransport() {
        AutoCloseable current = server;
        if (current == null) {
            transition(LifecycleState.FAILED, context("error", "no server to connect"));
            return;
        }
        try {
            transport = connector.connect(current);
            transition(LifecycleState.CONNECTED, context());
        } catch (Exception e) {
            log.error("Transport connection failed", e);
            retryCount++;
            transition(LifecycleState.RETRYING_CONNECTION, context("error", e.getMessage()));
        }
    }

    private void awaitWhileConnected() {
        lock.lock();
        try {
            if (!shutdownRequested.get() && pendingError == null) {
                wake.await(config.getConnectedCheckIntervalMs(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestShutdown("interrupted");
        } finally {
            lock.unlock();
        }

        Throwable error = pendingError;
        pendingError = null;
        AutoCloseable current = server;
        if (error == null && current != null && !shutdownRequested.get() && !serverHealth.test(current)) {
            error = new IllegalStateException("server stopped unexpectedly");
        }
        if (error != null && !shutdownRequested.get()) {
            retryCount = 0;
            transition(LifecycleState.RECONNECTING, context("error", String.valueOf(error.getMessage())));
        }
    }

    private void shutDown() {
        int code = 0;
        CompletableFuture<Void> cleanup = CompletableFuture.runAsync(() -> {
            try {
                cleanup();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, task -> {
            Thread thread = new Thread(task, "browsermcp-cleanup");
            thread.setDaemon(true);
            thread.start();
        });
        try {
            cleanup.get(config.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("Cleanup did not finish within {}ms", config.getShutdownTimeoutMs());
            code = 1;
        } catch (ExecutionException e) {
            log.error("Cleanup failed", e.getCause());
            code = 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            code = 1;
        }
        exitCode = code;
        transition(LifecycleState.SHUTDOWN, context("exitCode", code));
    }

    /**
     * Close the transport, then the server. Both are attempted; the first failure is rethrown.
     */
    private void cleanup() throws Exception {
        Exception failure = null;
        AutoCloseable t = transport;
        transport = null;
        if (t != null) {
            try {
                t.close();
            } catch (Exception e) {
                failure = e;
            }
        }
        AutoCloseable s = server;
        server = null;
        if (s != null) {
            try {
                s.close();
            } catch (Exception e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void cleanupQuietly() {
        try {
            cleanup();
        } catch (Exception e) {
            log.warn("Cleanup error: {}", e.getMessage());
        }
    }

    private void pause(long millis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        lock.lock();
        try {
            long remaining;
            while (!shutdownRequested.get() && (remaining = deadline - System.nanoTime()) > 0) {
                wake.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestShutdown("interrupted");
        } finally {
            lock.unlock();
        }
    }

    private void transition(LifecycleState next, Map<String, Object> context) {
        LifecycleState previous = state;
        if (!previous.canTransitionTo(next)) {
            log.warn("Transition {} -> {} is not a defined edge", previous, next);
        }
        if (next == LifecycleState.CONNECTED) {
            retryCount = 0;
        }
        state = next;

        TransitionRecord record = new TransitionRecord(previous, next, Instant.now(),
                Collections.unmodifiableMap(context), retryCount);
        synchronized (history) {
            history.addLast(record);
            while (history.size() > config.getMaxStateHistory()) {
                history.removeFirst();
            }
        }
        log.info("Lifecycle {} -> {} (retry {}/{}) {}", previous, next, retryCount, config.getMaxRetries(), context);
    }

    private static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    // ---- external triggers ----

    /**
     * Ask the loop to shut down. Only the first request counts.
     */
    public void requestShutdown(String reason) {
        if (!shutdownRequested.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress, ignoring: {}", reason);
            return;
        }
        shutdownReason = reason;
        log.info("Shutdown requested: {}", reason);
        signal();
    }

    /**
     * Report a failure of the running bridge. Acts only while {@code CONNECTED}.
     */
    public void reportError(Throwable error) {
        if (state != LifecycleState.CONNECTED) {
            log.warn("Error reported in state {}: {}", state, error.getMessage());
            return;
        }
        pendingError = error;
        signal();
    }

    private void signal() {
        lock.lock();
        try {
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        return terminated.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    // ---- diagnostics ----

    public LifecycleState getState() {
        return state;
    }

    /**
     * Exit code decided by the last run: 0 after a clean shutdown, 1 until then and after any failure.
     */
    public int getExitCode() {
        return exitCode;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public boolean isShuttingDown() {
        return shutdownRequested.get();
    }

    public List<TransitionRecord> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public StateInfo getStateInfo() {
        List<TransitionRecord> all = getHistory();
        List<TransitionRecord> recent = all.subList(Math.max(0, all.size() - RECENT_HISTORY), all.size());
        return new StateInfo(state, retryCount, config.getMaxRetries(), shutdownRequested.get(),
                server != null, transport != null, List.copyOf(recent));
    }
}
