package com.clawcron.gateway.rpc;

import com.clawcron.common.infra.StoreLock;
import com.clawcron.gateway.rpc.RpcTypes.ErrorCodes;
import com.clawcron.gateway.rpc.RpcTypes.ErrorShape;
import com.clawcron.gateway.rpc.RpcTypes.RpcRequest;
import com.clawcron.gateway.rpc.RpcTypes.RpcResponse;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Routes RPC method calls to registered handlers.
 */
@Slf4j
public class GatewayMethodRouter {

    @FunctionalInterface
    public interface MethodHandler {
        CompletableFuture<Object> handle(JsonNode params);
    }

    private final Map<String, MethodHandler> methodHandlers = new ConcurrentHashMap<>();

    /**
     * Register a handler for a method, replacing any previous one.
     */
    public void registerMethod(String method, MethodHandler handler) {
        methodHandlers.put(method, handler);
        log.debug("Registered method handler: {}", method);
    }

    /**
     * Dispatch a request to the appropriate handler. Unknown methods and
     * handlers that throw complete exceptionally.
     */
    public CompletableFuture<Object> dispatch(String method, JsonNode params) {
        MethodHandler handler = methodHandlers.get(method);
        if (handler == null) {
            return CompletableFuture.failedFuture(
                    new UnsupportedOperationException("Method not found: " + method));
        }

        try {
            return handler.handle(params);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Dispatch and fold the outcome into a response; never completes
     * exceptionally.
     */
    public CompletableFuture<RpcResponse> invoke(RpcRequest request) {
        if (request == null || !request.isValid()) {
            return CompletableFuture.completedFuture(
                    RpcResponse.failure(ErrorCodes.INVALID_REQUEST, "invalid request: method is required"));
        }
        String method = request.getMethod();
        return dispatch(method, request.getParams())
                .thenApply(RpcResponse::success)
                .exceptionally(ex -> {
                    ErrorShape error = toErrorShape(ex);
                    if (ErrorCodes.INTERNAL.equals(error.getCode())) {
                        log.error("method {} failed: {}", method, error.getMessage(), unwrap(ex));
                    } else {
                        log.debug("method {} rejected: {} {}", method, error.getCode(), error.getMessage());
                    }
                    return RpcResponse.failure(error);
                });
    }

    /**
     * Map a handler failure to a protocol error.
     */
    public static ErrorShape toErrorShape(Throwable ex) {
        Throwable cause = unwrap(ex);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (cause instanceof UnsupportedOperationException) {
            return ErrorShape.of(ErrorCodes.NOT_FOUND, message);
        }
        if (cause instanceof StoreLock.LockTimeoutException) {
            return new ErrorShape(ErrorCodes.UNAVAILABLE, message, true);
        }
        if (cause instanceof IllegalArgumentException) {
            return ErrorShape.of(ErrorCodes.INVALID_REQUEST, message);
        }
        return ErrorShape.of(ErrorCodes.INTERNAL, message);
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * List registered method names, sorted.
     */
    public Set<String> getRegisteredMethods() {
        return Collections.unmodifiableSet(new TreeSet<>(methodHandlers.keySet()));
    }
}
