package com.finchat.rag.model;

import lombok.Value;

import java.util.Locale;

/**
 * A user query as received, plus its normalized form used for routing and caching.
 */
@Value
public class Query {

    String rawText;
    String normalizedText;
    String userId;

    public static Query of(String text, String userId) {
        String raw = text != null ? text : "";
        return new Query(raw, normalize(raw), userId != null ? userId : "guest");
    }

    /**
     * Lower-cases, trims and collapses whitespace runs to a single space.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public boolean isBlank() {
        return normalizedText.isEmpty();
    }
}
