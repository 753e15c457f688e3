package com.browsermcp.tools;

import com.browsermcp.common.errors.HandlerException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Strict readers for tool arguments. Missing or mistyped values raise {@link HandlerException}.
 */
public final class ToolArgs {

    private ToolArgs() {
    }

    public static String requireString(JsonNode args, String key) {
        JsonNode node = require(args, key);
        if (!node.isTextual()) {
            throw mistyped(key, "string", node);
        }
        return node.asText();
    }

    /** Numeric argument, returned as the original node so integral values stay integral. */
    public static JsonNode requireNumber(JsonNode args, String key) {
        JsonNode node = require(args, key);
        if (!node.isNumber()) {
            throw mistyped(key, "number", node);
        }
        return node;
    }

    public static boolean requireBoolean(JsonNode args, String key) {
        JsonNode node = require(args, key);
        if (!node.isBoolean()) {
            throw mistyped(key, "boolean", node);
        }
        return node.booleanValue();
    }

    public static List<String> requireStringArray(JsonNode args, String key) {
        JsonNode node = require(args, key);
        if (!node.isArray()) {
            throw mistyped(key, "array", node);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw mistyped(key + "[]", "string", item);
            }
            values.add(item.asText());
        }
        return values;
    }

    /**
     * Render a number the way a person writes it: {@code 1} not {@code 1.0}.
     */
    public static String numberText(JsonNode number) {
        double value = number.doubleValue();
        if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return number.isIntegralNumber() ? number.asText() : String.valueOf(value);
    }

    /** Plain text of an extension result value: strings unquoted, everything else as JSON. */
    public static String valueText(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return "";
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    private static JsonNode require(JsonNode args, String key) {
        JsonNode node = args != null ? args.get(key) : null;
        if (node == null || node.isNull()) {
            throw new HandlerException("Invalid arguments: \"" + key + "\" is required");
        }
        return node;
    }

    private static HandlerException mistyped(String key, String expected, JsonNode actual) {
        return new HandlerException("Invalid arguments: \"" + key + "\" must be a " + expected
                + ", got " + actual.getNodeType().name().toLowerCase());
    }
}
