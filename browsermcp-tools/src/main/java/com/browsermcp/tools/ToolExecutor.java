package com.browsermcp.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Executes a tool by name. The local {@link ToolCallBridge} and the thin forwarder both
 * implement this, so the stdio server does not care which one it talks to.
 *
 * <p>Implementations complete normally with an error-flagged {@link CallToolResult} instead
 * of failing the future.
 */
public interface ToolExecutor {

    CompletableFuture<CallToolResult> execute(String name, JsonNode arguments);
}
