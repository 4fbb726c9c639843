package org.learningjava.carbonengine.infrastructure.adapter.out.llm;

import com.fasterxml.jackson.databind.JsonNode;

final class JsonReplies {

    private JsonReplies() {}

    /** Strips ``` fences and any prose around the outermost JSON object. */
    static String extractObject(String reply) {
        if (reply == null) return "";
        String s = reply.trim();
        if (s.startsWith("```")) {
            int nl = s.indexOf('\n');
            s = nl >= 0 ? s.substring(nl + 1) : "";
            int end = s.lastIndexOf("```");
            if (end >= 0) s = s.substring(0, end);
        }
        int open = s.indexOf('{');
        int close = s.lastIndexOf('}');
        return open >= 0 && close > open ? s.substring(open, close + 1) : s.trim();
    }

    static String text(JsonNode n, String... fields) {
        for (String f : fields) {
            JsonNode v = n.get(f);
            if (v != null && !v.isNull() && !v.asText().isBlank()) return v.asText().trim();
        }
        return null;
    }

    // numbers sometimes come back quoted
    static Double number(JsonNode n, String... fields) {
        for (String f : fields) {
            JsonNode v = n.get(f);
            if (v == null || v.isNull()) continue;
            if (v.isNumber()) return v.asDouble();
            if (v.isTextual()) {
                try {
                    return Double.valueOf(v.asText().trim().replace(',', '.'));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }
}
