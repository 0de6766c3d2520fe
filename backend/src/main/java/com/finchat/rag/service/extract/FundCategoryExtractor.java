package com.finchat.rag.service.extract;

import com.finchat.rag.model.Query;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class FundCategoryExtractor implements ParameterExtractor {

    private final int topFundsLimit;

    public FundCategoryExtractor(@Value("${rag.routing.top-funds-limit:10}") int topFundsLimit) {
        this.topFundsLimit = topFundsLimit;
    }

    @Override
    public String name() {
        return "fund_category";
    }

    @Override
    public Map<String, Object> extract(Query query) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("category", detectCategory(query.getNormalizedText()));
        params.put("limit", topFundsLimit);
        return params;
    }

    static String detectCategory(String q) {
        if (q.contains("large cap") || q.contains("largecap")) {
            return "large cap";
        }
        if (q.contains("mid cap") || q.contains("midcap")) {
            return "mid cap";
        }
        if (q.contains("small cap") || q.contains("smallcap")) {
            return "small cap";
        }
        if (q.contains("elss") || q.contains("tax saver")) {
            return "elss";
        }
        if (q.contains("debt") || q.contains("bond")) {
            return "debt";
        }
        if (q.contains("hybrid") || q.contains("balanced")) {
            return "hybrid";
        }
        return "equity";
    }
}
