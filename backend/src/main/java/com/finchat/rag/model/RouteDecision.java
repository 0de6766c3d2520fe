package com.finchat.rag.model;

import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of routing a single query. Produced fresh per query.
 */
@Value
public class RouteDecision {

    public static final String UNMATCHED = "unmatched";

    public enum Source { RULE, LLM, NONE }

    String intent;
    Map<String, Object> params;
    int rank;
    Source source;

    public static RouteDecision matched(String intent, Map<String, Object> params, int rank) {
        return new RouteDecision(intent, Collections.unmodifiableMap(params), rank, Source.RULE);
    }

    public static RouteDecision fromLlm(String intent, Map<String, Object> params) {
        return new RouteDecision(intent, Collections.unmodifiableMap(params), -1, Source.LLM);
    }

    public static RouteDecision unmatched() {
        return new RouteDecision(UNMATCHED, Collections.emptyMap(), -1, Source.NONE);
    }

    public boolean isMatched() {
        return !UNMATCHED.equals(intent);
    }
}
