package com.clawcron.app.bridge;

import com.clawcron.gateway.cron.CronState.SystemEventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory queue of system events per agent, drained by the heartbeat.
 * Keeps at most {@link #MAX_EVENTS} per agent and drops a text identical to
 * the one queued just before it.
 */
@Slf4j
@Component
public class SystemEventQueue implements SystemEventSink {

    public static final String DEFAULT_AGENT_ID = "main";
    public static final int MAX_EVENTS = 20;

    public record SystemEvent(String text, long ts) {
    }

    private final Map<String, Deque<SystemEvent>> queues = new ConcurrentHashMap<>();

    @Override
    public void enqueue(String text, String agentId) {
        if (text == null || text.isBlank()) {
            return;
        }
        String key = resolveKey(agentId);
        Deque<SystemEvent> queue = queues.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (queue) {
            SystemEvent last = queue.peekLast();
            if (last != null && last.text().equals(text)) {
                return;
            }
            queue.addLast(new SystemEvent(text, System.currentTimeMillis()));
            while (queue.size() > MAX_EVENTS) {
                queue.removeFirst();
            }
        }
        log.debug("system event queued for {}: {} chars", key, text.length());
    }

    /**
     * Remove and return all queued events for an agent, oldest first.
     */
    public List<SystemEvent> drain(String agentId) {
        Deque<SystemEvent> queue = queues.get(resolveKey(agentId));
        if (queue == null) {
            return List.of();
        }
        synchronized (queue) {
            List<SystemEvent> out = new ArrayList<>(queue);
            queue.clear();
            return out;
        }
    }

    /**
     * Remove and return queued events for every agent.
     */
    public Map<String, List<SystemEvent>> drainAll() {
        Map<String, List<SystemEvent>> out = new TreeMap<>();
        for (String key : queues.keySet()) {
            List<SystemEvent> drained = drain(key);
            if (!drained.isEmpty()) {
                out.put(key, drained);
            }
        }
        return out;
    }

    public List<String> peek(String agentId) {
        Deque<SystemEvent> queue = queues.get(resolveKey(agentId));
        if (queue == null) {
            return List.of();
        }
        synchronized (queue) {
            return queue.stream().map(SystemEvent::text).toList();
        }
    }

    private static String resolveKey(String agentId) {
        return agentId == null || agentId.isBlank() ? DEFAULT_AGENT_ID : agentId.trim();
    }
}
