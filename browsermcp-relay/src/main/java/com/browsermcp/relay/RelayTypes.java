package com.browsermcp.relay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire envelopes exchanged with the browser extension.
 *
 * <p>Protocol overview:
 * <ul>
 *   <li>Bridge → Extension: {@link RequestMessage} {@code {id, type, payload}}</li>
 *   <li>Extension → Bridge: {@link ResponseMessage} of type {@value #MESSAGE_RESPONSE_TYPE}
 *       carrying {@code {requestId, result}} or {@code {requestId, error}}</li>
 * </ul>
 * Inbound messages of any other type are ignored by the correlator.
 */
public final class RelayTypes {

    private RelayTypes() {
    }

    public static final String MESSAGE_RESPONSE_TYPE = "messageResponse";

    // ==================== Bridge → Extension ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RequestMessage {
        private String id;
        private String type;
        private Object payload;

        public static RequestMessage create(String id, String type, Object payload) {
            return RequestMessage.builder()
                    .id(id)
                    .type(type)
                    .payload(payload)
                    .build();
        }
    }

    // ==================== Extension → Bridge ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponseMessage {
        private String type;
        private ResponsePayload payload;

        public static ResponseMessage success(String requestId, JsonNode result) {
            return new ResponseMessage(MESSAGE_RESPONSE_TYPE,
                    new ResponsePayload(requestId, result, null));
        }

        public static ResponseMessage failure(String requestId, String error) {
            return new ResponseMessage(MESSAGE_RESPONSE_TYPE,
                    new ResponsePayload(requestId, null, error));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponsePayload {
        private String requestId;
        private JsonNode result;
        private String error;
    }
}
