package com.browsermcp.tools;

import com.browsermcp.common.errors.ToolNotFoundException;
import com.browsermcp.common.infra.Futures;
import com.browsermcp.relay.ExtensionClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves a tool name against the {@link ToolRegistry} and runs it against the extension.
 *
 * <p>Every outcome is a {@link CallToolResult}: unknown names, argument errors and failed
 * extension calls all come back with {@code isError=true}. The meta-name
 * {@value #LIST_TOOLS} answers the tool listing without touching the extension.
 */
@Slf4j
public class ToolCallBridge implements ToolExecutor {

    public static final String LIST_TOOLS = "__list_tools__";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ToolRegistry registry;
    private final ResourceRegistry resources;
    private final ExtensionClient client;

    public ToolCallBridge(ToolRegistry registry, ResourceRegistry resources, ExtensionClient client) {
        this.registry = registry;
        this.resources = resources;
        this.client = client;
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public ResourceRegistry getResources() {
        return resources;
    }

    public List<ToolDefinition> listTools() {
        return registry.definitions();
    }

    @Override
    public CompletableFuture<CallToolResult> execute(String name, JsonNode arguments) {
        if (LIST_TOOLS.equals(name)) {
            return CompletableFuture.completedFuture(listingResult());
        }

        Optional<BrowserTool> tool = registry.resolve(name);
        if (tool.isEmpty()) {
            ToolNotFoundException notFound = new ToolNotFoundException(name, registry.names());
            log.warn(notFound.getMessage());
            return CompletableFuture.completedFuture(CallToolResult.error(notFound.getMessage()));
        }

        JsonNode args = arguments != null && !arguments.isNull() ? arguments : MAPPER.createObjectNode();
        String resolvedName = tool.get().getName();
        log.debug("Executing tool {} (requested as {})", resolvedName, name);

        CompletableFuture<CallToolResult> running;
        try {
            running = tool.get().execute(client, args);
        } catch (RuntimeException e) {
            running = Futures.failed(e);
        }
        return running.handle((result, error) -> {
            if (error == null) {
                return result;
            }
            String message = Futures.describe(error);
            log.warn("Tool {} failed: {}", resolvedName, message);
            return CallToolResult.error(message);
        });
    }

    private CallToolResult listingResult() {
        try {
            return CallToolResult.text(MAPPER.writeValueAsString(listTools()));
        } catch (JsonProcessingException e) {
            return CallToolResult.error("Failed to list tools: " + e.getOriginalMessage());
        }
    }
}
