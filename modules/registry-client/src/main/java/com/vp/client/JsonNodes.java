package com.vp.client;

import com.fasterxml.jackson.databind.JsonNode;

/** Null-tolerant accessors over Jackson trees; collaborator payloads are loosely shaped. */
public final class JsonNodes {

    private JsonNodes() {
    }

    /** First non-null text value among the given field names, or null. */
    public static String first(JsonNode node, String... names) {
        if (node == null) return null;
        for (String n : names) {
            JsonNode v = node.get(n);
            if (v != null && !v.isNull()) return v.asText(null);
        }
        return null;
    }

    /** Like {@link #first} but never null. */
    public static String text(JsonNode node, String name) {
        String v = first(node, name);
        return v == null ? "" : v;
    }

    public static String trimSlash(String baseUrl) {
        if (baseUrl == null) return "";
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
