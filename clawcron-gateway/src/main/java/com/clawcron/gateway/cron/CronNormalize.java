package com.clawcron.gateway.cron;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Cron job input normalization: coerces raw request maps into well-typed
 * create/patch objects.
 */
public final class CronNormalize {

    private CronNormalize() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Normalize a raw schedule map: infer the kind and convert {@code at}
     * (ISO-8601 or epoch string) to {@code atMs}.
     */
    public static Map<String, Object> coerceSchedule(Map<String, Object> schedule) {
        Map<String, Object> next = new LinkedHashMap<>(schedule);

        Object atMsRaw = schedule.get("atMs");
        Object atRaw = schedule.get("at");
        Long parsedAtMs = null;
        if (atMsRaw instanceof Number n) {
            parsedAtMs = n.longValue();
        } else if (atMsRaw instanceof String s) {
            parsedAtMs = CronParse.parseAbsoluteTimeMs(s);
        } else if (atRaw instanceof String s) {
            parsedAtMs = CronParse.parseAbsoluteTimeMs(s);
        } else if (atRaw instanceof Number n) {
            parsedAtMs = n.longValue();
        }

        if (!(schedule.get("kind") instanceof String)) {
            if (atMsRaw != null || atRaw != null) {
                next.put("kind", "at");
            } else if (schedule.get("everyMs") != null) {
                next.put("kind", "every");
            } else if (schedule.get("expr") instanceof String) {
                next.put("kind", "cron");
            }
        }

        if (parsedAtMs != null) {
            next.put("atMs", parsedAtMs);
        } else if (atMsRaw instanceof String) {
            next.remove("atMs");
        }
        next.remove("at");

        if (schedule.get("expr") instanceof String expr) {
            next.put("expr", expr.trim());
        }
        if (schedule.get("tz") instanceof String tz) {
            String trimmed = tz.trim();
            if (trimmed.isEmpty())
                next.remove("tz");
            else
                next.put("tz", trimmed);
        }
        return next;
    }

    /**
     * Normalize a raw payload map: infer the kind from {@code text} or
     * {@code message}, fold the legacy {@code provider} into {@code channel}
     * and lower-case the channel.
     */
    public static Map<String, Object> coercePayload(Map<String, Object> payload) {
        Map<String, Object> next = new LinkedHashMap<>(payload);

        if (!(payload.get("kind") instanceof String)) {
            if (payload.get("text") instanceof String) {
                next.put("kind", "systemEvent");
            } else if (payload.get("message") instanceof String) {
                next.put("kind", "agentTurn");
            }
        }

        String channel = normalizeChannel(payload.get("channel"));
        if (channel == null) {
            channel = normalizeChannel(payload.get("provider"));
        }
        next.remove("provider");
        if (channel != null)
            next.put("channel", channel);
        else
            next.remove("channel");

        if (payload.get("to") instanceof String to) {
            String trimmed = to.trim();
            if (trimmed.isEmpty())
                next.remove("to");
            else
                next.put("to", trimmed);
        }
        return next;
    }

    static String normalizeChannel(Object raw) {
        if (!(raw instanceof String s)) {
            return null;
        }
        String trimmed = s.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Normalize a cron job create map: coerce schedule/payload and apply
     * defaults.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> normalizeCronJobCreate(Map<String, Object> raw) {
        if (raw == null)
            return null;
        Map<String, Object> next = coerceCommon(unwrapJob(raw));

        if (!next.containsKey("wakeMode") || next.get("wakeMode") == null) {
            next.put("wakeMode", "next-heartbeat");
        }
        if (!(next.get("enabled") instanceof Boolean)) {
            next.put("enabled", true);
        }
        if (next.get("sessionTarget") == null && next.get("payload") instanceof Map<?, ?> payload) {
            Object kind = ((Map<String, Object>) payload).get("kind");
            if ("systemEvent".equals(kind)) {
                next.put("sessionTarget", "main");
            } else if ("agentTurn".equals(kind)) {
                next.put("sessionTarget", "isolated");
            }
        }
        return next;
    }

    /**
     * Normalize a cron job patch map: coerce but do NOT apply defaults.
     */
    public static Map<String, Object> normalizeCronJobPatch(Map<String, Object> raw) {
        if (raw == null)
            return null;
        return coerceCommon(unwrapJob(raw));
    }

    /**
     * Bind a normalized create map.
     *
     * @throws CronValidationException if a field has the wrong shape
     */
    public static CronTypes.CronJobCreate toCreate(Map<String, Object> normalized) {
        try {
            return MAPPER.convertValue(normalized, CronTypes.CronJobCreate.class);
        } catch (IllegalArgumentException e) {
            throw new CronValidationException("invalid cron job: " + rootMessage(e), e);
        }
    }

    /**
     * Bind a normalized patch map. An explicit {@code agentId: null} becomes
     * {@code clearAgentId}.
     *
     * @throws CronValidationException if a field has the wrong shape
     */
    public static CronTypes.CronJobPatch toPatch(Map<String, Object> normalized) {
        CronTypes.CronJobPatch patch;
        try {
            patch = MAPPER.convertValue(normalized, CronTypes.CronJobPatch.class);
        } catch (IllegalArgumentException e) {
            throw new CronValidationException("invalid cron patch: " + rootMessage(e), e);
        }
        if (normalized.containsKey("agentId") && normalized.get("agentId") == null) {
            patch.setClearAgentId(true);
        }
        return patch;
    }

    public static CronTypes.CronJobCreate parseCreate(Map<String, Object> raw) {
        if (raw == null) {
            throw new CronValidationException("invalid cron job: missing params");
        }
        return toCreate(normalizeCronJobCreate(raw));
    }

    public static CronTypes.CronJobPatch parsePatch(Map<String, Object> raw) {
        if (raw == null) {
            throw new CronValidationException("invalid cron patch: missing patch");
        }
        return toPatch(normalizeCronJobPatch(raw));
    }

    /**
     * Trim an agent id; blank ids become null.
     */
    public static String normalizeAgentId(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> coerceCommon(Map<String, Object> next) {
        if (next.get("schedule") instanceof Map<?, ?> sched) {
            next.put("schedule", coerceSchedule((Map<String, Object>) sched));
        }
        if (next.get("payload") instanceof Map<?, ?> payload) {
            next.put("payload", coercePayload((Map<String, Object>) payload));
        }
        if (next.get("agentId") instanceof String agentId) {
            String normalized = normalizeAgentId(agentId);
            if (normalized == null)
                next.remove("agentId");
            else
                next.put("agentId", normalized);
        }
        if (next.get("name") instanceof String name) {
            next.put("name", name.trim());
        }
        return next;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapJob(Map<String, Object> raw) {
        if (raw.get("data") instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        if (raw.get("job") instanceof Map<?, ?> job) {
            return new LinkedHashMap<>((Map<String, Object>) job);
        }
        return new LinkedHashMap<>(raw);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        if (message == null) {
            return e.getMessage();
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
