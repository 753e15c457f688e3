package com.browsermcp.relay;

import com.browsermcp.common.errors.NotConnectedException;
import com.browsermcp.common.errors.TransportException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

    private final ConnectionManager manager = new ConnectionManager(5_000);

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> future.get(2, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void withoutSocket_callFailsWithNotConnected() {
        assertFalse(manager.hasConnection());

        CompletableFuture<JsonNode> future = manager.call("getUrl", null);

        Throwable cause = failureOf(future);
        assertInstanceOf(NotConnectedException.class, cause);
        assertEquals(NotConnectedException.MESSAGE, cause.getMessage());
    }

    @Test
    void closedSocket_countsAsNotConnected_andIsNotWritten() {
        StubExtensionSocket socket = new StubExtensionSocket();
        manager.attach(socket);
        socket.open = false;

        assertFalse(manager.hasConnection());
        assertInstanceOf(NotConnectedException.class, failureOf(manager.call("getUrl", null)));
        assertTrue(socket.sent.isEmpty());
    }

    @Test
    void callRoutesThroughCurrentSocket() throws Exception {
        StubExtensionSocket socket = new StubExtensionSocket();
        MessageCorrelator correlator = manager.attach(socket);

        CompletableFuture<JsonNode> future = manager.call("getTitle", null);
        String id = socket.sentMessage(0).get("id").asText();
        correlator.onMessage(StubExtensionSocket.response(id, "\"t\""));

        assertTrue(manager.hasConnection());
        assertEquals("t", future.get(1, TimeUnit.SECONDS).asText());
    }

    @Test
    void replacement_failsAllOutstandingCalls_beforeNewSocketIsCurrent() {
        StubExtensionSocket first = new StubExtensionSocket();
        manager.attach(first);
        List<CompletableFuture<JsonNode>> outstanding = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            outstanding.add(manager.call("browser_snapshot", null));
        }
        assertEquals(5, manager.pendingCount());

        StubExtensionSocket second = new StubExtensionSocket();
        manager.attach(second);

        for (CompletableFuture<JsonNode> future : outstanding) {
            assertInstanceOf(TransportException.class, failureOf(future));
        }
        assertEquals(0, manager.pendingCount());
        assertEquals(1, first.closeCount);
        assertEquals(0, second.closeCount);
        assertTrue(manager.hasConnection());
    }

    @Test
    void replacement_swallowsCloseErrors() {
        StubExtensionSocket first = new StubExtensionSocket();
        first.failOnClose = true;
        manager.attach(first);

        StubExtensionSocket second = new StubExtensionSocket();
        assertDoesNotThrow(() -> manager.attach(second));

        manager.call("getUrl", null);
        assertEquals(1, second.sent.size());
        assertTrue(first.sent.isEmpty());
    }

    @Test
    void detachOfStaleSocket_leavesCurrentAlone() {
        StubExtensionSocket first = new StubExtensionSocket();
        manager.attach(first);
        StubExtensionSocket second = new StubExtensionSocket();
        manager.attach(second);

        manager.detach(first);
        assertTrue(manager.hasConnection());

        manager.detach(second);
        assertFalse(manager.hasConnection());
    }

    @Test
    void disconnect_closesSocketAndFailsPending() {
        StubExtensionSocket socket = new StubExtensionSocket();
        manager.attach(socket);
        CompletableFuture<JsonNode> future = manager.call("getUrl", null);

        manager.disconnect();

        assertInstanceOf(TransportException.class, failureOf(future));
        assertEquals(1, socket.closeCount);
        assertFalse(manager.hasConnection());
    }
}
