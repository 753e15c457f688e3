package com.browsermcp.tools.builtin;

import com.browsermcp.tools.AriaSnapshot;
import com.browsermcp.tools.BrowserTool;
import com.browsermcp.tools.JsonSchemas;
import com.browsermcp.tools.ToolArgs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Element interaction tools. Each acts on a {@code ref} from a previous snapshot and
 * answers with a fresh snapshot.
 */
public final class SnapshotTools {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String ELEMENT_DESCRIPTION = "Human-readable element description used "
            + "to obtain permission to interact with the element";
    private static final String REF_DESCRIPTION = "Exact target element reference from the page snapshot";

    private SnapshotTools() {
    }

    public static BrowserTool snapshot() {
        return new DefaultBrowserTool("browser_snapshot",
                "Capture accessibility snapshot of the current page. "
                        + "Use this for getting references to elements to interact with.",
                JsonSchemas.empty(),
                (client, args) -> AriaSnapshot.capture(client));
    }

    public static BrowserTool click() {
        return new DefaultBrowserTool("browser_click", "Perform click on a web page",
                elementSchema().build(),
                (client, args) -> {
                    ObjectNode payload = elementPayload(args);
                    return AriaSnapshot.afterAction(client, client.call("browser_click", payload),
                            "Clicked \"" + payload.get("element").asText() + "\"");
                });
    }

    public static BrowserTool drag() {
        return new DefaultBrowserTool("browser_drag", "Perform drag and drop between two elements",
                JsonSchemas.object()
                        .string("startElement", "Human-readable source element description used "
                                + "to obtain the permission to interact with the element")
                        .string("startRef", "Exact source element reference from the page snapshot")
                        .string("endElement", "Human-readable target element description used "
                                + "to obtain the permission to interact with the element")
                        .string("endRef", REF_DESCRIPTION)
                        .build(),
                (client, args) -> {
                    String startElement = ToolArgs.requireString(args, "startElement");
                    String endElement = ToolArgs.requireString(args, "endElement");
                    ObjectNode payload = MAPPER.createObjectNode()
                            .put("startElement", startElement)
                            .put("startRef", ToolArgs.requireString(args, "startRef"))
                            .put("endElement", endElement)
                            .put("endRef", ToolArgs.requireString(args, "endRef"));
                    return AriaSnapshot.afterAction(client, client.call("browser_drag", payload),
                            "Dragged \"" + startElement + "\" to \"" + endElement + "\"");
                });
    }

    public static BrowserTool hover() {
        return new DefaultBrowserTool("browser_hover", "Hover over element on page",
                elementSchema().build(),
                (client, args) -> {
                    ObjectNode payload = elementPayload(args);
                    return AriaSnapshot.afterAction(client, client.call("browser_hover", payload),
                            "Hovered over \"" + payload.get("element").asText() + "\"");
                });
    }

    public static BrowserTool type() {
        return new DefaultBrowserTool("browser_type", "Type text into editable element",
                elementSchema()
                        .string("text", "Text to type into the element")
                        .bool("submit", "Whether to submit entered text (press Enter after)")
                        .build(),
                (client, args) -> {
                    ObjectNode payload = elementPayload(args);
                    String text = ToolArgs.requireString(args, "text");
                    payload.put("text", text);
                    payload.put("submit", ToolArgs.requireBoolean(args, "submit"));
                    return AriaSnapshot.afterAction(client, client.call("browser_type", payload),
                            "Typed \"" + text + "\" into \"" + payload.get("element").asText() + "\"");
                });
    }

    public static BrowserTool selectOption() {
        return new DefaultBrowserTool("browser_select_option", "Select an option in a dropdown",
                elementSchema()
                        .stringArray("values", "Array of values to select in the dropdown. "
                                + "This can be a single value or multiple values.")
                        .build(),
                (client, args) -> {
                    ObjectNode payload = elementPayload(args);
                    List<String> values = ToolArgs.requireStringArray(args, "values");
                    ArrayNode array = payload.putArray("values");
                    values.forEach(array::add);
                    return AriaSnapshot.afterAction(client, client.call("browser_select_option", payload),
                            "Selected option in \"" + payload.get("element").asText() + "\"");
                });
    }

    private static JsonSchemas.ObjectSchemaBuilder elementSchema() {
        return JsonSchemas.object()
                .string("element", ELEMENT_DESCRIPTION)
                .string("ref", REF_DESCRIPTION);
    }

    private static ObjectNode elementPayload(JsonNode args) {
        return MAPPER.createObjectNode()
                .put("element", ToolArgs.requireString(args, "element"))
                .put("ref", ToolArgs.requireString(args, "ref"));
    }
}
