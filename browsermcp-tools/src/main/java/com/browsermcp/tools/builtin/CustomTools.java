package com.browsermcp.tools.builtin;

import com.browsermcp.common.errors.HandlerException;
import com.browsermcp.tools.BrowserTool;
import com.browsermcp.tools.CallToolResult;
import com.browsermcp.tools.Content;
import com.browsermcp.tools.JsonSchemas;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.StringJoiner;

/**
 * Console log and screenshot tools.
 */
public final class CustomTools {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CustomTools() {
    }

    public static BrowserTool getConsoleLogs() {
        return new DefaultBrowserTool("browser_get_console_logs", "Get the console logs from the browser",
                JsonSchemas.empty(),
                (client, args) -> client.call("browser_get_console_logs", MAPPER.createObjectNode())
                        .thenApply(CustomTools::renderConsoleLogs));
    }

    public static BrowserTool screenshot() {
        return new DefaultBrowserTool("browser_screenshot", "Take a screenshot of the current page",
                JsonSchemas.empty(),
                (client, args) -> client.call("browser_screenshot", MAPPER.createObjectNode())
                        .thenApply(data -> CallToolResult.of(List.of(
                                Content.image(data.asText(), "image/png")))));
    }

    static CallToolResult renderConsoleLogs(JsonNode logs) {
        if (!logs.isArray()) {
            throw new HandlerException("Expected an array of console log entries, got "
                    + logs.getNodeType().name().toLowerCase());
        }
        // one compact JSON document per entry
        StringJoiner text = new StringJoiner("\n");
        for (JsonNode entry : logs) {
            text.add(entry.toString());
        }
        return CallToolResult.text(text.toString());
    }
}
