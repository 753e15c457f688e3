package com.browsermcp.tools.builtin;

import com.browsermcp.relay.ExtensionClient;
import com.browsermcp.tools.BrowserTool;
import com.browsermcp.tools.CallToolResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * {@link BrowserTool} assembled from its parts.
 */
final class DefaultBrowserTool implements BrowserTool {

    @FunctionalInterface
    interface Handler {
        CompletableFuture<CallToolResult> handle(ExtensionClient client, JsonNode args);
    }

    private final String name;
    private final String description;
    private final JsonNode inputSchema;
    private final Handler handler;

    DefaultBrowserTool(String name, String description, JsonNode inputSchema, Handler handler) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
        this.handler = handler;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public JsonNode getInputSchema() {
        return inputSchema;
    }

    @Override
    public CompletableFuture<CallToolResult> execute(ExtensionClient client, JsonNode arguments) {
        return handler.handle(client, arguments);
    }
}
