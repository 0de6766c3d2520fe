package com.finchat.rag.service;

import com.finchat.rag.config.IntentConfigLoader;
import com.finchat.rag.model.DetectionRule;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.RouteDecision;
import com.finchat.rag.model.RuleTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic intent detection over the configured rule table.
 * The first rule (lowest rank) whose predicate matches wins; no later rule is evaluated.
 * Reads nothing but the query text and the static table, so it is safe to call from any thread.
 */
@Service
@Slf4j
public class IntentRouter {

    private final RuleTable ruleTable;

    @Autowired
    public IntentRouter(IntentConfigLoader intentConfigLoader) {
        this(intentConfigLoader.getRuleTable());
    }

    public IntentRouter(RuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    public RouteDecision route(Query query) {
        if (query == null || query.isBlank()) {
            return RouteDecision.unmatched();
        }

        String text = query.getNormalizedText();
        for (DetectionRule rule : ruleTable.getRules()) {
            if (rule.matches(text)) {
                Map<String, Object> params = new LinkedHashMap<>(rule.getExtractor().extract(query));
                log.debug("Detected intent '{}' (rank {}) for query '{}': {}",
                        rule.getIntent(), rule.getRank(), text, params);
                return RouteDecision.matched(rule.getIntent(), params, rule.getRank());
            }
        }

        log.debug("No intent rule matched query '{}'", text);
        return RouteDecision.unmatched();
    }

    public RuleTable getRuleTable() {
        return ruleTable;
    }
}
