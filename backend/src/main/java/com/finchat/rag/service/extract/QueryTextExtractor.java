package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Passes the raw query through; lookup handlers resolve names themselves.
 */
@Component
public class QueryTextExtractor implements ParameterExtractor {

    public static final String NAME = "query";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> extract(Query query) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", query.getRawText());
        return params;
    }
}
