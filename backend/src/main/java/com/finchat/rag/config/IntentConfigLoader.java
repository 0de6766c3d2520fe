package com.finchat.rag.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finchat.rag.exception.ConfigurationException;
import com.finchat.rag.model.DetectionRule;
import com.finchat.rag.model.IntentRule;
import com.finchat.rag.model.RouteDecision;
import com.finchat.rag.model.RuleTable;
import com.finchat.rag.service.extract.ParameterExtractor;
import com.finchat.rag.service.extract.ParameterExtractorRegistry;
import com.finchat.rag.service.extract.QueryTextExtractor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads the intent rule table from rag-intents.json at startup.
 * Any malformed rule aborts startup with a {@link ConfigurationException}.
 */
@Component
@Slf4j
@Getter
public class IntentConfigLoader {

    private final ParameterExtractorRegistry extractorRegistry;
    private final String rulesResource;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private RuleTable ruleTable = new RuleTable(List.of());

    public IntentConfigLoader(ParameterExtractorRegistry extractorRegistry,
                              @Value("${rag.routing.rules-resource:/rag-intents.json}") String rulesResource) {
        this.extractorRegistry = extractorRegistry;
        this.rulesResource = rulesResource;
    }

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream(rulesResource)) {
            if (is == null) {
                throw new ConfigurationException(rulesResource + " not found in classpath resources");
            }

            JsonNode root = objectMapper.readTree(is);
            JsonNode intentsNode = root.get("intents");
            if (intentsNode == null || !intentsNode.isArray()) {
                throw new ConfigurationException("Invalid " + rulesResource + " format: 'intents' array not found");
            }

            List<IntentRule> rules = objectMapper.convertValue(intentsNode, new TypeReference<List<IntentRule>>() {});
            ruleTable = compile(rules);

            log.info("✅ Loaded {} intent rules from {}", ruleTable.size(), rulesResource);
            log.debug("Intent rules: {}", rules);

        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Error loading " + rulesResource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Validates and compiles raw rules into an immutable, rank-ordered table.
     */
    public RuleTable compile(List<IntentRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new ConfigurationException("Rule table is empty");
        }

        Set<Integer> ranks = new HashSet<>();
        List<DetectionRule> compiled = new ArrayList<>();

        for (IntentRule rule : rules) {
            if (rule.getRank() == null) {
                throw new ConfigurationException("Rule without rank: " + rule);
            }
            if (!ranks.add(rule.getRank())) {
                throw new ConfigurationException("Duplicate rule rank " + rule.getRank());
            }
            String intent = rule.getIntentName();
            if (intent == null || intent.isBlank()) {
                throw new ConfigurationException("Rule " + rule.getRank() + " has no intent_name");
            }
            if (RouteDecision.UNMATCHED.equals(intent)) {
                throw new ConfigurationException("Rule " + rule.getRank() + " uses the reserved intent name '"
                        + RouteDecision.UNMATCHED + "'");
            }

            Set<String> keywords = lowerCased(rule.getKeywords());
            List<Pattern> patterns = compilePatterns(rule);
            List<Set<String>> allOf = new ArrayList<>();
            if (rule.getAllOf() != null) {
                for (List<String> group : rule.getAllOf()) {
                    Set<String> terms = lowerCased(group);
                    if (terms.isEmpty()) {
                        throw new ConfigurationException("Rule " + rule.getRank() + " has an empty all_of group");
                    }
                    allOf.add(Set.copyOf(terms));
                }
            }
            if (keywords.isEmpty() && patterns.isEmpty() && allOf.isEmpty()) {
                throw new ConfigurationException("Rule " + rule.getRank() + " (" + intent
                        + ") needs keywords, patterns or all_of");
            }

            String extractorName = rule.getExtractor() != null ? rule.getExtractor() : QueryTextExtractor.NAME;
            ParameterExtractor extractor = extractorRegistry.get(extractorName);

            Duration ttl = null;
            if (rule.getCacheTtlSeconds() != null) {
                if (rule.getCacheTtlSeconds() <= 0) {
                    throw new ConfigurationException("Rule " + rule.getRank() + " has a non-positive cache_ttl_seconds");
                }
                ttl = Duration.ofSeconds(rule.getCacheTtlSeconds());
            }

            compiled.add(new DetectionRule(
                    rule.getRank(),
                    intent,
                    Set.copyOf(keywords),
                    List.copyOf(patterns),
                    List.copyOf(allOf),
                    Set.copyOf(lowerCased(rule.getExclude())),
                    extractorName,
                    extractor,
                    ttl
            ));
        }

        return new RuleTable(compiled);
    }

    private static List<Pattern> compilePatterns(IntentRule rule) {
        List<Pattern> patterns = new ArrayList<>();
        if (rule.getPatterns() == null) {
            return patterns;
        }
        for (String regex : rule.getPatterns()) {
            try {
                patterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Rule " + rule.getRank() + " has an invalid pattern '" + regex + "'", e);
            }
        }
        return patterns;
    }

    private static Set<String> lowerCased(List<String> terms) {
        Set<String> result = new LinkedHashSet<>();
        if (terms == null) {
            return result;
        }
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                result.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
