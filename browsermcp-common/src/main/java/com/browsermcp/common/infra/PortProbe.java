package com.browsermcp.common.infra;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Port probes.
 *
 * <p>{@link #isListening} answers "does something accept connections here" and is what
 * instance detection uses. {@link #isBindable} answers "could this process bind here" and is
 * what the socket listener polls while a stale holder is going away.
 */
public class PortProbe {

    private final int connectTimeoutMs;

    public PortProbe(long connectTimeoutMs) {
        this.connectTimeoutMs = (int) Math.max(1, connectTimeoutMs);
    }

    public boolean isListening(String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public boolean isBindable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Poll {@link #isBindable} every 100ms until it succeeds or {@code maxWaitMs} elapses.
     */
    public boolean awaitBindable(int port, long maxWaitMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + maxWaitMs;
        while (!isBindable(port)) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            Thread.sleep(100);
        }
        return true;
    }
}
