package com.browsermcp.server.frontdoor;

import com.browsermcp.common.errors.InvalidRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Validated body of {@code POST /tool}.
 */
record ToolCallRequest(String name, JsonNode arguments) {

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Parse and validate a request body. An empty body counts as {@code {}}.
     *
     * @throws InvalidRequestException on malformed JSON, a non-object body, a missing or
     *                                 non-string name, or non-object arguments
     */
    static ToolCallRequest parse(String body) {
        JsonNode node;
        if (body == null || body.isBlank()) {
            node = mapper.createObjectNode();
        } else {
            try {
                node = mapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new InvalidRequestException("Invalid JSON: " + e.getOriginalMessage());
            }
        }

        if (node == null || !node.isObject()) {
            throw new InvalidRequestException("Request body must be a JSON object");
        }
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual() || name.asText().isEmpty()) {
            throw new InvalidRequestException("Tool name is required and must be a string");
        }
        JsonNode arguments = node.get("arguments");
        if (arguments == null || arguments.isNull()) {
            arguments = mapper.createObjectNode();
        } else if (!arguments.isObject()) {
            throw new InvalidRequestException("Tool arguments must be an object if provided");
        }
        return new ToolCallRequest(name.asText(), arguments);
    }
}
