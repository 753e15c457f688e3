package com.browsermcp.tools;

import com.browsermcp.relay.ExtensionClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Captures the page's URL, title and accessibility snapshot, in that order, and renders them
 * as one text part.
 */
public final class AriaSnapshot {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AriaSnapshot() {
    }

    public static CompletableFuture<CallToolResult> capture(ExtensionClient client) {
        return client.call("getUrl", null).thenCompose(url ->
                client.call("getTitle", null).thenCompose(title ->
                        client.call("browser_snapshot", MAPPER.createObjectNode())
                                .thenApply(snapshot -> CallToolResult.text(render(url, title, snapshot)))));
    }

    /**
     * Run {@code action}, then capture a snapshot and prepend {@code status} as its own text part.
     */
    public static CompletableFuture<CallToolResult> afterAction(ExtensionClient client,
                                                                CompletableFuture<JsonNode> action,
                                                                String status) {
        return action.thenCompose(ignored -> capture(client)).thenApply(snapshot -> {
            if (status == null) {
                return snapshot;
            }
            List<Content> parts = new ArrayList<>();
            parts.add(Content.text(status));
            parts.addAll(snapshot.getContent());
            return CallToolResult.of(parts);
        });
    }

    static String render(JsonNode url, JsonNode title, JsonNode snapshot) {
        return "- Page URL: " + ToolArgs.valueText(url) + "\n"
                + "- Page Title: " + ToolArgs.valueText(title) + "\n"
                + "- Page Snapshot\n"
                + "```yaml\n"
                + ToolArgs.valueText(snapshot) + "\n"
                + "```\n";
    }
}
