package com.browsermcp.relay;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Call surface tool handlers see. Implemented by {@link ConnectionManager}.
 */
public interface ExtensionClient {

    boolean hasConnection();

    /** Call with the configured default timeout. */
    CompletableFuture<JsonNode> call(String type, Object payload);
}
