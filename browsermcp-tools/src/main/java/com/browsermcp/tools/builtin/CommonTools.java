package com.browsermcp.tools.builtin;

import com.browsermcp.tools.AriaSnapshot;
import com.browsermcp.tools.BrowserTool;
import com.browsermcp.tools.CallToolResult;
import com.browsermcp.tools.JsonSchemas;
import com.browsermcp.tools.ToolArgs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Navigation, timing and keyboard tools.
 */
public final class CommonTools {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CommonTools() {
    }

    public static BrowserTool navigate() {
        return new DefaultBrowserTool("browser_navigate", "Navigate to a URL",
                JsonSchemas.object().string("url", "The URL to navigate to").build(),
                (client, args) -> {
                    String url = ToolArgs.requireString(args, "url");
                    ObjectNode payload = MAPPER.createObjectNode().put("url", url);
                    return AriaSnapshot.afterAction(client, client.call("browser_navigate", payload), null);
                });
    }

    public static BrowserTool goBack() {
        return new DefaultBrowserTool("browser_go_back", "Go back to the previous page",
                JsonSchemas.empty(),
                (client, args) -> AriaSnapshot.afterAction(client,
                        client.call("browser_go_back", MAPPER.createObjectNode()), null));
    }

    public static BrowserTool goForward() {
        return new DefaultBrowserTool("browser_go_forward", "Go forward to the next page",
                JsonSchemas.empty(),
                (client, args) -> AriaSnapshot.afterAction(client,
                        client.call("browser_go_forward", MAPPER.createObjectNode()), null));
    }

    public static BrowserTool pressKey() {
        return new DefaultBrowserTool("browser_press_key", "Press a key on the keyboard",
                JsonSchemas.object().string("key", "Name of the key to press or a character to "
                        + "generate, such as `ArrowLeft` or `a`").build(),
                (client, args) -> {
                    String key = ToolArgs.requireString(args, "key");
                    return client.call("browser_press_key", MAPPER.createObjectNode().put("key", key))
                            .thenApply(ignored -> CallToolResult.text("Pressed key " + key));
                });
    }

    public static BrowserTool waitFor() {
        return new DefaultBrowserTool("browser_wait", "Wait for a specified time in seconds",
                JsonSchemas.object().number("time", "The time to wait in seconds").build(),
                (client, args) -> {
                    JsonNode time = ToolArgs.requireNumber(args, "time");
                    ObjectNode payload = MAPPER.createObjectNode();
                    payload.set("time", time);
                    return client.call("browser_wait", payload)
                            .thenApply(ignored -> CallToolResult.text(
                                    "Waited for " + ToolArgs.numberText(time) + " seconds"));
                });
    }
}
