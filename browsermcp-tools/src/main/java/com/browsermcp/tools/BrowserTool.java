package com.browsermcp.tools;

import com.browsermcp.relay.ExtensionClient;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * A browser verb exposed to protocol clients.
 *
 * <p>Every tool has a name, description, JSON Schema for its arguments, and an asynchronous
 * execute method that issues one or more calls to the extension.
 */
public interface BrowserTool {

    String getName();

    String getDescription();

    JsonNode getInputSchema();

    /**
     * Run the tool. Argument validation failures may be thrown directly as
     * {@link com.browsermcp.common.errors.HandlerException}; the bridge catches both thrown
     * and failed-future errors.
     */
    CompletableFuture<CallToolResult> execute(ExtensionClient client, JsonNode arguments);

    default ToolDefinition toDefinition() {
        return new ToolDefinition(getName(), getDescription(), getInputSchema());
    }
}
