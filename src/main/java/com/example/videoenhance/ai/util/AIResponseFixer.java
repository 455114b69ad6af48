package com.example.videoenhance.ai.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs the usual damage in model-generated JSON before it reaches Jackson:
 * markdown fences, prose around the object, trailing commas, raw newlines
 * inside strings and output cut off before the closing braces.
 */
public final class AIResponseFixer {

    private static final Logger log = LoggerFactory.getLogger(AIResponseFixer.class);

    private AIResponseFixer() {
    }

    /**
     * Parses the response as a JSON object, first as-is and then after repair.
     *
     * @return the parsed object, or null if no JSON object can be recovered
     */
    public static JsonNode parseObject(String response, ObjectMapper objectMapper) {
        if (response == null || response.isBlank()) {
            return null;
        }

        JsonNode direct = readObject(response.trim(), objectMapper);
        if (direct != null) {
            return direct;
        }

        String repaired = repair(response);
        if (repaired == null) {
            log.warn("[AIResponseFixer] No JSON object in response (first 200 chars): {}", preview(response));
            return null;
        }

        JsonNode fixed = readObject(repaired, objectMapper);
        if (fixed != null) {
            log.info("[AIResponseFixer] Recovered JSON object after repair");
        } else {
            log.warn("[AIResponseFixer] Could not repair response (first 200 chars): {}", preview(response));
        }
        return fixed;
    }

    /**
     * Applies all repairs in order. Returns null when the text holds no '{'.
     */
    public static String repair(String response) {
        String cleaned = removeMarkdownFences(response);
        cleaned = extractJsonObject(cleaned);
        if (cleaned == null) {
            return null;
        }
        cleaned = fixTrailingCommas(cleaned);
        cleaned = escapeRawControlChars(cleaned);
        return closeTruncated(cleaned);
    }

    static String removeMarkdownFences(String text) {
        return text.replaceAll("(?s)```(?:json|JSON)?\\s*", "").trim();
    }

    /**
     * From the first '{' to the last '}', or to the end of the text when the
     * closing brace is missing.
     */
    static String extractJsonObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int end = text.lastIndexOf('}');
        return end > start ? text.substring(start, end + 1) : text.substring(start);
    }

    static String fixTrailingCommas(String json) {
        return json.replaceAll(",\\s*}", "}").replaceAll(",\\s*]", "]");
    }

    static String escapeRawControlChars(String json) {
        StringBuilder result = new StringBuilder(json.length());
        boolean inString = false;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c == '"' && (i == 0 || json.charAt(i - 1) != '\\')) {
                inString = !inString;
                result.append(c);
            } else if (inString && c == '\n') {
                result.append("\\n");
            } else if (inString && c == '\r') {
                result.append("\\r");
            } else if (inString && c == '\t') {
                result.append("\\t");
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /**
     * Appends a closing quote and the missing ']' and '}' for output that was
     * cut off mid-object.
     */
    static String closeTruncated(String json) {
        StringBuilder open = new StringBuilder();
        boolean inString = false;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c == '"' && (i == 0 || json.charAt(i - 1) != '\\')) {
                inString = !inString;
            } else if (!inString) {
                if (c == '{' || c == '[') {
                    open.append(c);
                } else if ((c == '}' || c == ']') && open.length() > 0) {
                    open.setLength(open.length() - 1);
                }
            }
        }
        if (!inString && open.length() == 0) {
            return json;
        }

        StringBuilder result = new StringBuilder(json);
        if (inString) {
            result.append('"');
        }
        for (int i = open.length() - 1; i >= 0; i--) {
            result.append(open.charAt(i) == '{' ? '}' : ']');
        }
        log.info("[AIResponseFixer] Closed {} unterminated brackets", open.length());
        return fixTrailingCommas(result.toString());
    }

    private static JsonNode readObject(String json, ObjectMapper objectMapper) {
        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (Exception e) {
            log.debug("[AIResponseFixer] Parse failed: {}", e.getMessage());
            return null;
        }
    }

    private static String preview(String response) {
        return response.substring(0, Math.min(200, response.length())).replaceAll("\\s+", " ");
    }
}
