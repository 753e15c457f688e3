package com.browsermcp.server;

import com.browsermcp.common.config.BridgeConfig;
import com.browsermcp.common.infra.PortEvictor;
import com.browsermcp.common.infra.PortProbe;
import com.browsermcp.relay.RelayTypes;
import com.browsermcp.server.coordinator.DetectionResult;
import com.browsermcp.server.coordinator.InstanceCoordinator;
import com.browsermcp.server.lifecycle.LifecycleStateMachine;
import com.browsermcp.server.lifecycle.TransitionRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static com.browsermcp.server.lifecycle.LifecycleState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole processes in both modes, with piped stdio and an OkHttp WebSocket playing the extension.
 */
class BridgeProcessTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final OkHttpClient http = new OkHttpClient.Builder()
            .readTimeout(10, TimeUnit.SECONDS)
            .build();
    private final List<String> extensionCalls = new CopyOnWriteArrayList<>();
    private final List<Launched> launched = new ArrayList<>();

    private record Launched(BridgeProcess process, PipedOutputStream stdin, LineCollector stdout,
                            CompletableFuture<Integer> exit) {

        void send(String line) throws IOException {
            stdin.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        }
    }

    @AfterEach
    void tearDown() throws Exception {
        for (Launched each : launched) {
            each.process().lifecycle().requestShutdown("test teardown");
            each.exit().get(10, TimeUnit.SECONDS);
            each.stdin().close();
        }
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }

    private static BridgeConfig config(int httpPort, int wsPort) {
        return BridgeConfig.defaults().toBuilder()
                .httpPort(httpPort)
                .wsPort(wsPort)
                .retryDelayMs(50)
                .connectedCheckIntervalMs(50)
                .shutdownTimeoutMs(2_000)
                .callTimeoutMs(5_000)
                .build();
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private Launched launch(BridgeConfig config, DetectionResult detection) throws IOException {
        PipedOutputStream stdin = new PipedOutputStream();
        LineCollector stdout = new LineCollector();
        BridgeProcess process = BridgeProcess.create(config, detection, PortEvictor.NOOP,
                new PipedInputStream(stdin), stdout);
        Launched each = new Launched(process, stdin, stdout, CompletableFuture.supplyAsync(process::run));
        launched.add(each);
        return each;
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    private static void awaitConnected(Launched each) throws InterruptedException {
        await(() -> each.process().lifecycle().getState() == CONNECTED);
    }

    /** Answers every request with a null result. */
    private void connectExtension(BridgeServer server) throws Exception {
        http.newWebSocket(new Request.Builder()
                .url("ws://127.0.0.1:" + server.getWsPort() + "/")
                .build(), new WebSocketListener() {
            @Override
            public void onMessage(WebSocket webSocket, String text) {
                try {
                    JsonNode request = mapper.readTree(text);
                    extensionCalls.add(request.get("type").asText());
                    webSocket.send(mapper.writeValueAsString(RelayTypes.ResponseMessage.success(
                            request.get("id").asText(), NullNode.getInstance())));
                } catch (Exception e) {
                    webSocket.close(1011, e.getMessage());
                }
            }
        });
        await(() -> extensionConnected(server.getHttpPort()));
    }

    private boolean extensionConnected(int httpPort) {
        Request request = new Request.Builder()
                .url("http://127.0.0.1:" + httpPort + "/health")
                .build();
        try (Response response = http.newCall(request).execute()) {
            return mapper.readTree(response.body().string()).path("extensionConnected").asBoolean();
        } catch (IOException e) {
            return false;
        }
    }

    @Test
    void forwarderOpensNoListener() throws Exception {
        int httpPort = freePort();
        int wsPort = freePort();
        DetectionResult healthyPeer = DetectionResult.builder()
                .exists(true)
                .healthy(true)
                .httpListening(true)
                .wsListening(true)
                .build();

        Launched forwarder = launch(config(httpPort, wsPort), healthyPeer);
        awaitConnected(forwarder);

        assertTrue(forwarder.process().isForwarding());
        assertNull(forwarder.process().activeServer());
        PortProbe portCheck = new PortProbe(300);
        assertFalse(portCheck.isListening("127.0.0.1", httpPort));
        assertFalse(portCheck.isListening("127.0.0.1", wsPort));
    }

    @Test
    void stdioToolCallIsForwardedToActiveBridge() throws Exception {
        Launched active = launch(config(0, 0), new DetectionResult());
        awaitConnected(active);
        assertFalse(active.process().isForwarding());
        BridgeServer server = active.process().activeServer();
        connectExtension(server);

        BridgeConfig peer = config(server.getHttpPort(), server.getWsPort());
        DetectionResult detection = new InstanceCoordinator(peer).detect();
        assertTrue(detection.shouldForward());
        Launched forwarder = launch(peer, detection);
        awaitConnected(forwarder);

        forwarder.send("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"browser_wait\",\"arguments\":{\"time\":1}}}");

        JsonNode response = mapper.readTree(forwarder.stdout().next(10_000));
        assertEquals(7, response.get("id").asInt());
        assertEquals("Waited for 1 seconds", response.at("/result/content/0/text").asText());
        assertFalse(response.at("/result/isError").asBoolean());
        assertEquals(List.of("browser_wait"), extensionCalls);
    }

    @Test
    void frontDoorLossRebuildsActiveBridge() throws Exception {
        // health polling is slow here, so only the channel-close report can trigger the rebuild
        BridgeConfig slowHealth = config(0, 0).toBuilder()
                .connectedCheckIntervalMs(60_000)
                .build();
        Launched active = launch(slowHealth, new DetectionResult());
        awaitConnected(active);
        LifecycleStateMachine lifecycle = active.process().lifecycle();
        BridgeServer first = active.process().activeServer();

        first.frontDoor().close();

        await(() -> lifecycle.getState() == CONNECTED && active.process().activeServer() != first);
        Optional<TransitionRecord> reconnect = lifecycle.getHistory().stream()
                .filter(r -> r.from() == CONNECTED && r.to() == RECONNECTING)
                .findFirst();
        assertTrue(reconnect.isPresent());
        assertEquals("front door channel closed", reconnect.get().context().get("error"));
        assertFalse(first.isRunning());
        assertTrue(active.process().activeServer().isRunning());
    }
}
