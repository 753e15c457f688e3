package com.browsermcp.tools;

import com.browsermcp.relay.ExtensionClient;
import com.browsermcp.tools.builtin.BrowserTools;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static BrowserTool named(String name) {
        return new BrowserTool() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String getDescription() {
                return name + " tool";
            }

            @Override
            public JsonNode getInputSchema() {
                return JsonSchemas.empty();
            }

            @Override
            public CompletableFuture<CallToolResult> execute(ExtensionClient client, JsonNode arguments) {
                return CompletableFuture.completedFuture(CallToolResult.text(name));
            }
        };
    }

    @Test
    void aliasesOf_prefixedName() {
        assertEquals(List.of("wait", "browser_browser_wait", "mcp__browsermcp__browser_wait"),
                ToolRegistry.aliasesOf("browser_wait"));
    }

    @Test
    void aliasesOf_unprefixedName_isEmpty() {
        assertTrue(ToolRegistry.aliasesOf("snapshot").isEmpty());
        assertTrue(ToolRegistry.aliasesOf("browser_").isEmpty());
    }

    @Test
    void resolve_exactThenAliases() {
        ToolRegistry registry = new ToolRegistry(List.of(named("browser_click")));

        BrowserTool tool = registry.resolve("browser_click").orElseThrow();
        assertSame(tool, registry.resolve("click").orElseThrow());
        assertSame(tool, registry.resolve("browser_browser_click").orElseThrow());
        assertSame(tool, registry.resolve("mcp__browsermcp__browser_click").orElseThrow());
        assertTrue(registry.resolve("mcp__browsermcp__click").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
    }

    @Test
    void alias_neverShadowsExplicitRegistration() {
        BrowserTool explicitWait = named("wait");
        ToolRegistry registry = new ToolRegistry(List.of(named("browser_wait"), explicitWait));

        assertSame(explicitWait, registry.resolve("wait").orElseThrow());
        assertEquals("browser_wait", registry.resolve("browser_browser_wait").orElseThrow().getName());
    }

    @Test
    void duplicateNames_areRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ToolRegistry(List.of(named("browser_wait"), named("browser_wait"))));
    }

    @Test
    void builtinSet_listsThirteenToolsInOrder() {
        ToolRegistry registry = new ToolRegistry(BrowserTools.all());

        assertEquals(13, registry.size());
        assertEquals("browser_navigate", registry.names().get(0));
        assertEquals("browser_screenshot", registry.names().get(12));
        ToolDefinition wait = registry.definitions().stream()
                .filter(d -> d.getName().equals("browser_wait")).findFirst().orElseThrow();
        assertEquals("Wait for a specified time in seconds", wait.getDescription());
        assertEquals("number", wait.getInputSchema().get("properties").get("time").get("type").asText());
        assertEquals("time", wait.getInputSchema().get("required").get(0).asText());
        assertFalse(wait.getInputSchema().get("additionalProperties").asBoolean());
    }

    @Test
    void definitions_serializeNameDescriptionSchema() throws Exception {
        ToolRegistry registry = new ToolRegistry(List.of(named("browser_go_back")));
        JsonNode json = new ObjectMapper().valueToTree(registry.definitions().get(0));

        assertEquals("browser_go_back", json.get("name").asText());
        assertEquals("object", json.get("inputSchema").get("type").asText());
        assertEquals(JsonSchemas.DRAFT_07, json.get("inputSchema").get("$schema").asText());
    }
}
