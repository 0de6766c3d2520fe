package com.finchat.rag.model;

import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Result of invoking (or trying to invoke) an external handler for a Direct-state query.
 * Availability is explicit; the failure reason is for logs only and may be null.
 */
@Value
public class HandlerOutcome {

    boolean available;
    Map<String, Object> result;
    String failureReason;

    public static HandlerOutcome success(Map<String, Object> result) {
        return new HandlerOutcome(true, Collections.unmodifiableMap(result), null);
    }

    public static HandlerOutcome unavailable(String reason) {
        return new HandlerOutcome(false, Collections.emptyMap(), reason);
    }
}
