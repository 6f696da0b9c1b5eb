package com.clawcron.gateway.methods;

import com.clawcron.gateway.cron.CronNormalize;
import com.clawcron.gateway.cron.CronService;
import com.clawcron.gateway.cron.CronState.CronRunMode;
import com.clawcron.gateway.cron.CronValidationException;
import com.clawcron.gateway.rpc.GatewayMethodRouter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RPC methods for cron job management: cron.status, cron.list, cron.add,
 * cron.update, cron.remove, cron.run, cron.runs.
 */
@Slf4j
@Component
public class CronMethodRegistrar {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final GatewayMethodRouter methodRouter;
    private final CronService cronService;
    private final ObjectMapper objectMapper;
    /** Runs may wait minutes on a heartbeat, so they get their own threads. */
    private final ExecutorService runExecutor;

    public CronMethodRegistrar(
            GatewayMethodRouter methodRouter,
            CronService cronService,
            ObjectMapper objectMapper) {
        this.methodRouter = methodRouter;
        this.cronService = cronService;
        this.objectMapper = objectMapper;
        AtomicInteger counter = new AtomicInteger();
        this.runExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cron-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void registerMethods() {
        methodRouter.registerMethod("cron.status", this::handleStatus);
        methodRouter.registerMethod("cron.list", this::handleList);
        methodRouter.registerMethod("cron.add", this::handleAdd);
        methodRouter.registerMethod("cron.update", this::handleUpdate);
        methodRouter.registerMethod("cron.remove", this::handleRemove);
        methodRouter.registerMethod("cron.run", this::handleRun);
        methodRouter.registerMethod("cron.runs", this::handleRuns);
    }

    @PreDestroy
    public void shutdown() {
        runExecutor.shutdown();
    }

    private CompletableFuture<Object> handleStatus(JsonNode params) {
        return CompletableFuture.completedFuture(cronService.status());
    }

    private CompletableFuture<Object> handleList(JsonNode params) {
        boolean includeDisabled = params != null && params.path("includeDisabled").asBoolean(false);
        return CompletableFuture.completedFuture(Map.of("jobs", cronService.list(includeDisabled)));
    }

    private CompletableFuture<Object> handleAdd(JsonNode params) {
        var create = CronNormalize.parseCreate(toMap(params, "invalid cron.add params"));
        return CompletableFuture.completedFuture(cronService.add(create));
    }

    private CompletableFuture<Object> handleUpdate(JsonNode params) {
        String id = requireId(params, "cron.update");
        JsonNode patchNode = params.get("patch");
        if (patchNode == null || !patchNode.isObject()) {
            throw new CronValidationException("invalid cron.update params: patch is required");
        }
        var patch = CronNormalize.parsePatch(toMap(patchNode, "invalid cron.update params"));
        return CompletableFuture.completedFuture(cronService.update(id, patch));
    }

    private CompletableFuture<Object> handleRemove(JsonNode params) {
        String id = requireId(params, "cron.remove");
        return CompletableFuture.completedFuture(cronService.remove(id));
    }

    private CompletableFuture<Object> handleRun(JsonNode params) {
        String id = requireId(params, "cron.run");
        JsonNode mode = params.get("mode");
        CronRunMode runMode = CronRunMode.fromKey(mode != null && mode.isTextual() ? mode.asText() : null);
        return CompletableFuture.supplyAsync(() -> cronService.run(id, runMode), runExecutor);
    }

    private CompletableFuture<Object> handleRuns(JsonNode params) {
        String id = requireId(params, "cron.runs");
        JsonNode limitNode = params.get("limit");
        Integer limit = limitNode != null && limitNode.canConvertToInt() ? limitNode.asInt() : null;
        return CompletableFuture.completedFuture(Map.of("entries", cronService.runs(id, limit)));
    }

    private String requireId(JsonNode params, String method) {
        String id = null;
        if (params != null) {
            JsonNode raw = params.hasNonNull("id") ? params.get("id") : params.get("jobId");
            if (raw != null && raw.isTextual() && !raw.asText().isBlank()) {
                id = raw.asText().trim();
            }
        }
        if (id == null) {
            throw new CronValidationException("invalid " + method + " params: missing id");
        }
        return id;
    }

    private Map<String, Object> toMap(JsonNode node, String error) {
        if (node == null || !node.isObject()) {
            throw new CronValidationException(error + ": expected an object");
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }
}
