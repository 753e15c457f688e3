package com.browsermcp.server.coordinator;

import com.browsermcp.tools.CallToolResult;
import com.browsermcp.tools.ToolExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Thin forwarder: reissues every tool call as {@code POST /tool} against the bridge that
 * already owns the extension connection.
 *
 * <p>Never fails the future. A rejected call relays the remote structured result when the
 * body carries one; an unreachable front door becomes
 * {@code "Proxy communication error: ..."}.
 */
@Slf4j
public class ForwardingToolExecutor implements ToolExecutor {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final MediaType JSON = MediaType.parse("application/json");

    private final String toolUrl;
    private final OkHttpClient client;

    public ForwardingToolExecutor(String baseUrl, long callTimeoutMs) {
        // remote call budget plus the round trip
        this(baseUrl, new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(callTimeoutMs * 2 + 5_000, TimeUnit.MILLISECONDS)
                .build());
    }

    public ForwardingToolExecutor(String baseUrl, OkHttpClient client) {
        this.toolUrl = stripTrailingSlash(baseUrl) + "/tool";
        this.client = client;
    }

    @Override
    public CompletableFuture<CallToolResult> execute(String name, JsonNode arguments) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("name", name);
        body.set("arguments", arguments != null && !arguments.isNull() ? arguments : MAPPER.createObjectNode());

        Request request;
        try {
            request = new Request.Builder()
                    .url(toolUrl)
                    .post(RequestBody.create(MAPPER.writeValueAsString(body), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    CallToolResult.error("Proxy communication error: " + e.getOriginalMessage()));
        }

        CompletableFuture<CallToolResult> future = new CompletableFuture<>();
        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("Forwarding {} failed: {}", name, e.getMessage());
                future.complete(CallToolResult.error("Proxy communication error: " + e.getMessage()));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    future.complete(interpret(name, response.code(), readBody(response)));
                } catch (IOException e) {
                    future.complete(CallToolResult.error("Proxy communication error: " + e.getMessage()));
                } catch (RuntimeException e) {
                    log.warn("Unexpected forwarding failure for {}", name, e);
                    future.complete(CallToolResult.error("Proxy communication error: " + e.getMessage()));
                }
            }
        });
        return future;
    }

    static CallToolResult interpret(String name, int status, String body) {
        JsonNode json;
        try {
            json = body.isBlank() ? MAPPER.createObjectNode() : MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return CallToolResult.error("Proxy request failed with status " + status + ": " + body);
        }

        JsonNode result = json.get("result");
        if (status == 200 && json.path("success").asBoolean(false)) {
            return toResult(result);
        }

        if (result != null && result.isObject() && result.has("content")) {
            CallToolResult relayed = toResult(result);
            relayed.setIsError(true);
            return relayed;
        }
        String message = json.path("message").asText(null);
        log.debug("Remote bridge rejected {} with status {}", name, status);
        return CallToolResult.error(message != null
                ? message
                : "Proxy request failed with status " + status);
    }

    private static CallToolResult toResult(JsonNode node) {
        if (node == null || node.isNull()) {
            return CallToolResult.of(List.of());
        }
        try {
            return MAPPER.treeToValue(node, CallToolResult.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CallToolResult.error("Proxy returned an unreadable result: " + e.getMessage());
        }
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
