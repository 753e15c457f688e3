package com.browsermcp.common.infra;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

class PortProbeTest {

    private final PortProbe probe = new PortProbe(500);

    @Test
    void isListening_trueWhileServerSocketOpen() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
            assertTrue(probe.isListening("127.0.0.1", port));
            assertFalse(probe.isBindable(port));
        }
        assertFalse(probe.isListening("127.0.0.1", port));
    }

    @Test
    void awaitBindable_returnsImmediatelyForFreePort() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0)) {
            port = server.getLocalPort();
        }
        assertTrue(probe.awaitBindable(port, 1_000));
    }

    @Test
    void awaitBindable_givesUpAfterDeadline() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            long start = System.currentTimeMillis();
            assertFalse(probe.awaitBindable(server.getLocalPort(), 300));
            assertTrue(System.currentTimeMillis() - start >= 300);
        }
    }
}
