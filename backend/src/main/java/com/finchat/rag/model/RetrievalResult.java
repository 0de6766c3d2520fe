package com.finchat.rag.model;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ranked supporting context for a query, best match first. Empty means "no grounding available".
 */
@Value
public class RetrievalResult {

    List<ScoredChunk> matches;
    RetrievalMode mode;

    public static RetrievalResult of(List<ScoredChunk> matches, RetrievalMode mode) {
        return new RetrievalResult(List.copyOf(matches), mode);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(Collections.emptyList(), RetrievalMode.NONE);
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public DocumentChunk topChunk() {
        return matches.isEmpty() ? null : matches.get(0).getChunk();
    }

    public String joinedText() {
        return matches.stream()
                .map(m -> m.getChunk().getText())
                .collect(Collectors.joining("\n\n"));
    }
}
