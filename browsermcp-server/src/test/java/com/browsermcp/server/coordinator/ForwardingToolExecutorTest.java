package com.browsermcp.server.coordinator;

import com.browsermcp.tools.CallToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ForwardingToolExecutorTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private MockWebServer remote;
    private ForwardingToolExecutor forwarder;

    @BeforeEach
    void setUp() throws IOException {
        remote = new MockWebServer();
        remote.start();
        forwarder = new ForwardingToolExecutor(remote.url("/").toString(), 5_000);
    }

    @AfterEach
    void tearDown() throws IOException {
        remote.shutdown();
    }

    private CallToolResult forward(String name, String argumentsJson) throws Exception {
        JsonNode arguments = argumentsJson != null ? mapper.readTree(argumentsJson) : null;
        return forwarder.execute(name, arguments).get(5, TimeUnit.SECONDS);
    }

    @Test
    void successfulCall_returnsRemoteResult() throws Exception {
        remote.enqueue(new MockResponse().setResponseCode(200).setBody(
                "{\"success\":true,\"tool\":\"browser_wait\","
                        + "\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"Waited for 1 seconds\"}]}}"));

        CallToolResult result = forward("browser_wait", "{\"time\":1}");

        assertFalse(result.isErrorResult());
        assertEquals("Waited for 1 seconds", result.firstText());

        RecordedRequest request = remote.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("POST", request.getMethod());
        assertEquals("/tool", request.getPath());
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("browser_wait", body.get("name").asText());
        assertEquals(1, body.at("/arguments/time").asInt());
    }

    @Test
    void missingArguments_sentAsEmptyObject() throws Exception {
        remote.enqueue(new MockResponse().setResponseCode(200).setBody("{\"success\":true,\"result\":{\"content\":[]}}"));

        forward("browser_snapshot", null);

        JsonNode body = mapper.readTree(remote.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8());
        assertTrue(body.get("arguments").isObject());
        assertEquals(0, body.get("arguments").size());
    }

    @Test
    void executionError_relaysRemoteFailure() throws Exception {
        remote.enqueue(new MockResponse().setResponseCode(500).setBody(
                "{\"success\":false,\"error\":\"Tool Execution Error\",\"message\":\"boom\",\"tool\":\"browser_click\","
                        + "\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"boom\"}],\"isError\":true}}"));

        CallToolResult result = forward("browser_click", "{\"element\":\"x\",\"ref\":\"r1\"}");

        assertTrue(result.isErrorResult());
        assertEquals("boom", result.firstText());
    }

    @Test
    void badRequest_usesRemoteMessage() throws Exception {
        remote.enqueue(new MockResponse().setResponseCode(400).setBody(
                "{\"success\":false,\"error\":\"Bad Request\",\"message\":\"Tool name is required and must be a string\"}"));

        CallToolResult result = forward("", "{}");

        assertTrue(result.isErrorResult());
        assertEquals("Tool name is required and must be a string", result.firstText());
    }

    @Test
    void unreachableRemote_isCommunicationError() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        ForwardingToolExecutor nowhere = new ForwardingToolExecutor("http://127.0.0.1:" + closedPort, 1_000);

        CallToolResult result = nowhere.execute("browser_wait", mapper.readTree("{\"time\":1}"))
                .get(10, TimeUnit.SECONDS);

        assertTrue(result.isErrorResult());
        assertTrue(result.firstText().startsWith("Proxy communication error: "));
    }

    @Nested
    class Interpret {

        @Test
        void statusWithoutBody() {
            CallToolResult result = ForwardingToolExecutor.interpret("browser_wait", 502, "");

            assertTrue(result.isErrorResult());
            assertEquals("Proxy request failed with status 502", result.firstText());
        }

        @Test
        void nonJsonBody() {
            CallToolResult result = ForwardingToolExecutor.interpret("browser_wait", 502, "Bad Gateway");

            assertTrue(result.isErrorResult());
            assertEquals("Proxy request failed with status 502: Bad Gateway", result.firstText());
        }

        @Test
        void relayedResultIsAlwaysMarkedAsError() {
            CallToolResult result = ForwardingToolExecutor.interpret("browser_wait", 500,
                    "{\"success\":false,\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"late\"}]}}");

            assertTrue(result.isErrorResult());
            assertEquals("late", result.firstText());
        }
    }
}
