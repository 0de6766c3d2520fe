package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;

import java.util.Map;

/**
 * Pulls handler parameters out of a query that a rule has already matched.
 * Implementations read only the query text; they never call out of process.
 */
public interface ParameterExtractor {

    /**
     * Name referenced by the {@code extractor} field in rag-intents.json.
     */
    String name();

    Map<String, Object> extract(Query query);
}
