package com.conveyal.sweep.util;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Upstream APIs report durations in several shapes: plain numbers of seconds, numeric strings, or "HH:MM:SS" clock
 * strings. Unusable values yield null so callers can fall back to another source.
 */
public abstract class DurationParser {

    public static Integer seconds (JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        return seconds(node.asText());
    }

    public static Integer seconds (String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.contains(":")) {
            String[] parts = trimmed.split(":");
            int total = 0;
            for (int i = 0; i < 3; i++) {
                total = total * 60 + (i < parts.length ? parseIntOrZero(parts[i]) : 0);
            }
            return total;
        }
        try {
            return (int) Math.floor(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int parseIntOrZero (String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

}
