package com.browsermcp.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 messages exchanged with the stdio client.
 *
 * <p>Ids are kept as raw {@link JsonNode} so numeric and string ids echo back unchanged.
 */
public final class JsonRpcMessage {

    private JsonRpcMessage() {
    }

    public static final String VERSION = "2.0";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Request {
        private String jsonrpc;
        private String method;
        private JsonNode params;
        private JsonNode id;

        /** Notifications carry no id and expect no response. */
        public boolean isNotification() {
            return id == null || id.isNull();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Response {
        private String jsonrpc;
        private Object result;
        private RpcError error;
        private JsonNode id;

        public static Response success(JsonNode id, Object result) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .result(result)
                    .id(id)
                    .build();
        }

        public static Response error(JsonNode id, int code, String message) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .error(new RpcError(code, message, null))
                    .id(id)
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RpcError {
        private int code;
        private String message;
        private Object data;
    }

    // Standard error codes
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
}
