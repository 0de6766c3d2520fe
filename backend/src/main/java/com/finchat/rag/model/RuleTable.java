package com.finchat.rag.model;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable, rank-ordered set of detection rules. Lowest rank is evaluated first.
 */
public final class RuleTable {

    private final List<DetectionRule> rules;

    public RuleTable(List<DetectionRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(DetectionRule::getRank))
                .collect(Collectors.toUnmodifiableList());
    }

    public List<DetectionRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public DetectionRule findByIntent(String intent) {
        return rules.stream()
                .filter(r -> r.getIntent().equals(intent))
                .findFirst()
                .orElse(null);
    }
}
