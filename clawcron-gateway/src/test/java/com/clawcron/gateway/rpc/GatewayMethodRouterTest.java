package com.clawcron.gateway.rpc;

import com.clawcron.common.infra.StoreLock;
import com.clawcron.gateway.cron.CronValidationException;
import com.clawcron.gateway.rpc.RpcTypes.ErrorCodes;
import com.clawcron.gateway.rpc.RpcTypes.RpcRequest;
import com.clawcron.gateway.rpc.RpcTypes.RpcResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class GatewayMethodRouterTest {

    private final GatewayMethodRouter router = new GatewayMethodRouter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void dispatch_callsRegisteredHandler() throws Exception {
        router.registerMethod("echo", params -> CompletableFuture.completedFuture(params.get("value").asText()));

        Object result = router.dispatch("echo", mapper.readTree("{\"value\":\"hi\"}")).get();

        assertEquals("hi", result);
    }

    @Test
    void dispatch_unknownMethod_failsWithNotFound() {
        var future = router.dispatch("nope", null);
        var e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(UnsupportedOperationException.class, e.getCause());
        assertEquals("Method not found: nope", e.getCause().getMessage());
    }

    @Test
    void dispatch_handlerThrowing_failsFuture() {
        router.registerMethod("bad", params -> {
            throw new CronValidationException("cron job name is required");
        });
        assertTrue(router.dispatch("bad", null).isCompletedExceptionally());
    }

    @Test
    void invoke_wrapsSuccess() {
        router.registerMethod("ping", params -> CompletableFuture.completedFuture(Map.of("pong", true)));

        RpcResponse response = router.invoke(new RpcRequest("ping", null)).join();

        assertTrue(response.isOk());
        assertEquals(Map.of("pong", true), response.getPayload());
        assertNull(response.getError());
    }

    @Test
    void invoke_missingMethod_isInvalidRequest() {
        RpcResponse response = router.invoke(new RpcRequest(" ", null)).join();
        assertFalse(response.isOk());
        assertEquals(ErrorCodes.INVALID_REQUEST, response.getError().getCode());
    }

    @Test
    void invoke_mapsFailuresToCodes() {
        router.registerMethod("invalid", params -> {
            throw new CronValidationException("unknown cron job id: x");
        });
        router.registerMethod("locked", params -> CompletableFuture.failedFuture(
                new StoreLock.LockTimeoutException("timeout", Path.of("/tmp/x.lock"), 42L)));
        router.registerMethod("broken", params -> CompletableFuture.supplyAsync(() -> {
            throw new UncheckedIOException(new IOException("disk full"));
        }));

        RpcResponse invalid = router.invoke(new RpcRequest("invalid", null)).join();
        assertEquals(ErrorCodes.INVALID_REQUEST, invalid.getError().getCode());
        assertEquals("unknown cron job id: x", invalid.getError().getMessage());

        RpcResponse locked = router.invoke(new RpcRequest("locked", null)).join();
        assertEquals(ErrorCodes.UNAVAILABLE, locked.getError().getCode());
        assertEquals(Boolean.TRUE, locked.getError().getRetryable());

        RpcResponse broken = router.invoke(new RpcRequest("broken", null)).join();
        assertEquals(ErrorCodes.INTERNAL, broken.getError().getCode());

        RpcResponse missing = router.invoke(new RpcRequest("missing", null)).join();
        assertEquals(ErrorCodes.NOT_FOUND, missing.getError().getCode());
    }

    @Test
    void registeredMethods_areSorted() {
        router.registerMethod("b", params -> CompletableFuture.completedFuture(null));
        router.registerMethod("a", params -> CompletableFuture.completedFuture(null));
        assertEquals(Set.of("a", "b"), router.getRegisteredMethods());
        assertEquals("a", router.getRegisteredMethods().iterator().next());
    }
}
