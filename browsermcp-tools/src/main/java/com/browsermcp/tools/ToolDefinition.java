package com.browsermcp.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Listing entry for a tool: {@code {name, description, inputSchema}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"name", "description", "inputSchema"})
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolDefinition {
    private String name;
    private String description;
    private JsonNode inputSchema;
}
