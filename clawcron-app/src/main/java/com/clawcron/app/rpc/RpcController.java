package com.clawcron.app.rpc;

import com.clawcron.gateway.rpc.GatewayMethodRouter;
import com.clawcron.gateway.rpc.RpcTypes.ErrorCodes;
import com.clawcron.gateway.rpc.RpcTypes.RpcRequest;
import com.clawcron.gateway.rpc.RpcTypes.RpcResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP transport for gateway RPC methods: {@code POST /rpc} with
 * {@code {method, params}}.
 */
@Slf4j
@RestController
public class RpcController {

    private final GatewayMethodRouter methodRouter;

    public RpcController(GatewayMethodRouter methodRouter) {
        this.methodRouter = methodRouter;
    }

    @PostMapping(value = "/rpc", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<RpcResponse>> call(@RequestBody RpcRequest request) {
        log.debug("rpc:in method={}", request.getMethod());
        return methodRouter.invoke(request)
                .thenApply(response -> ResponseEntity.status(statusFor(response)).body(response));
    }

    @GetMapping("/rpc/methods")
    public Map<String, Set<String>> methods() {
        return Map.of("methods", methodRouter.getRegisteredMethods());
    }

    static HttpStatus statusFor(RpcResponse response) {
        if (response.isOk() || response.getError() == null) {
            return HttpStatus.OK;
        }
        return switch (response.getError().getCode()) {
            case ErrorCodes.INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case ErrorCodes.NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ErrorCodes.UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
