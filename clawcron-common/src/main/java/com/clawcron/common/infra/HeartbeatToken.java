package com.clawcron.common.infra;

import java.util.regex.Pattern;

/**
 * Detection and stripping of the {@code HEARTBEAT_OK} acknowledgement token
 * that an agent replies with when nothing needs attention.
 */
public final class HeartbeatToken {

    private HeartbeatToken() {
    }

    public static final String TOKEN = "HEARTBEAT_OK";
    public static final int DEFAULT_ACK_MAX_CHARS = 300;

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern MARKUP_START = Pattern.compile("^[*`~_]+");
    private static final Pattern MARKUP_END = Pattern.compile("[*`~_]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Result of stripping the token. */
    public record StripResult(boolean shouldSkip, String text, boolean didStrip) {
    }

    /**
     * Strip the token from the start and end of {@code raw}. The reply should be
     * skipped when it is empty, or when it carried the token and what remains is
     * at most {@code maxAckChars} long.
     *
     * @param maxAckChars limit for leftover text; null or negative uses
     *                    {@link #DEFAULT_ACK_MAX_CHARS}
     */
    public static StripResult strip(String raw, Integer maxAckChars) {
        if (raw == null || raw.isBlank()) {
            return new StripResult(true, "", false);
        }
        String trimmed = raw.trim();
        int limit = maxAckChars != null && maxAckChars >= 0 ? maxAckChars : DEFAULT_ACK_MAX_CHARS;

        String normalized = stripMarkup(trimmed);
        if (!trimmed.contains(TOKEN) && !normalized.contains(TOKEN)) {
            return new StripResult(false, trimmed, false);
        }

        EdgeStrip original = stripAtEdges(trimmed);
        EdgeStrip picked = original.didStrip() && !original.text().isEmpty()
                ? original
                : stripAtEdges(normalized);
        if (!picked.didStrip()) {
            return new StripResult(false, trimmed, false);
        }
        String rest = picked.text().trim();
        if (rest.length() <= limit) {
            return new StripResult(true, "", true);
        }
        return new StripResult(false, rest, true);
    }

    /**
     * True when {@code raw} is only an acknowledgement and should not be relayed.
     */
    public static boolean isAckOnly(String raw, Integer maxAckChars) {
        return strip(raw, maxAckChars).shouldSkip();
    }

    private record EdgeStrip(String text, boolean didStrip) {
    }

    private static String stripMarkup(String text) {
        String out = HTML_TAG.matcher(text).replaceAll(" ");
        out = out.replace("&nbsp;", " ");
        out = MARKUP_START.matcher(out).replaceFirst("");
        return MARKUP_END.matcher(out).replaceFirst("");
    }

    private static EdgeStrip stripAtEdges(String raw) {
        String text = raw.trim();
        if (text.isEmpty() || !text.contains(TOKEN)) {
            return new EdgeStrip(text, false);
        }
        boolean didStrip = false;
        boolean changed = true;
        while (changed) {
            changed = false;
            String next = text.trim();
            if (next.startsWith(TOKEN)) {
                text = next.substring(TOKEN.length()).stripLeading();
                didStrip = true;
                changed = true;
            } else if (next.endsWith(TOKEN)) {
                text = next.substring(0, next.length() - TOKEN.length()).stripTrailing();
                didStrip = true;
                changed = true;
            }
        }
        return new EdgeStrip(WHITESPACE.matcher(text).replaceAll(" ").trim(), didStrip);
    }
}
