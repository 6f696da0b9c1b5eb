package com.clawcron.gateway.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RPC request/response shapes.
 *
 * <p>
 * A request names a method and carries optional JSON params; the response is
 * either {@code {ok:true, payload}} or {@code {ok:false, error:{code, message}}}.
 */
public final class RpcTypes {

    private RpcTypes() {
    }

    // ── Error Codes ──────────────────────────────────────────────

    public static final class ErrorCodes {
        public static final String INVALID_REQUEST = "INVALID_REQUEST";
        public static final String UNAVAILABLE = "UNAVAILABLE";
        public static final String NOT_FOUND = "NOT_FOUND";
        public static final String INTERNAL = "INTERNAL";

        private ErrorCodes() {
        }
    }

    // ── Error Shape ──────────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorShape {
        private String code;
        private String message;
        private Boolean retryable;

        public static ErrorShape of(String code, String message) {
            return new ErrorShape(code, message, null);
        }
    }

    // ── Request ──────────────────────────────────────────────────

    /** {@code {method, params?}} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RpcRequest {
        private String method;
        private JsonNode params;

        public boolean isValid() {
            return method != null && !method.isBlank();
        }
    }

    // ── Response ─────────────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RpcResponse {
        private boolean ok;
        private Object payload;
        private ErrorShape error;

        public static RpcResponse success(Object payload) {
            return new RpcResponse(true, payload, null);
        }

        public static RpcResponse failure(ErrorShape error) {
            return new RpcResponse(false, null, error);
        }

        public static RpcResponse failure(String code, String message) {
            return failure(ErrorShape.of(code, message));
        }
    }
}
