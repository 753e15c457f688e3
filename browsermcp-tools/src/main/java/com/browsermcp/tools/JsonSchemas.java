package com.browsermcp.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds draft-07 input schemas. Every declared property is required and unknown
 * properties are disallowed.
 */
public final class JsonSchemas {

    public static final String DRAFT_07 = "http://json-schema.org/draft-07/schema#";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonSchemas() {
    }

    public static ObjectSchemaBuilder object() {
        return new ObjectSchemaBuilder();
    }

    /** Schema for a tool that takes no arguments. */
    public static ObjectNode empty() {
        return object().build();
    }

    public static final class ObjectSchemaBuilder {

        private final ObjectNode properties = MAPPER.createObjectNode();
        private final ArrayNode required = MAPPER.createArrayNode();

        private ObjectSchemaBuilder() {
        }

        public ObjectSchemaBuilder string(String name, String description) {
            return property(name, "string", description);
        }

        public ObjectSchemaBuilder number(String name, String description) {
            return property(name, "number", description);
        }

        public ObjectSchemaBuilder bool(String name, String description) {
            return property(name, "boolean", description);
        }

        public ObjectSchemaBuilder stringArray(String name, String description) {
            ObjectNode prop = properties.putObject(name);
            prop.put("type", "array");
            prop.putObject("items").put("type", "string");
            prop.put("description", description);
            required.add(name);
            return this;
        }

        private ObjectSchemaBuilder property(String name, String type, String description) {
            ObjectNode prop = properties.putObject(name);
            prop.put("type", type);
            prop.put("description", description);
            required.add(name);
            return this;
        }

        public ObjectNode build() {
            ObjectNode schema = MAPPER.createObjectNode();
            schema.put("type", "object");
            schema.set("properties", properties.deepCopy());
            if (!required.isEmpty()) {
                schema.set("required", required.deepCopy());
            }
            schema.put("additionalProperties", false);
            schema.put("$schema", DRAFT_07);
            return schema;
        }
    }
}
