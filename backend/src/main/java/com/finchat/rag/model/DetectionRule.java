package com.finchat.rag.model;

import com.finchat.rag.service.extract.ParameterExtractor;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiled, immutable intent-detection rule.
 * Matches when the normalized text contains at least one inclusion keyword (if any are set),
 * finds at least one pattern (if any are set), hits every all-of group and contains no exclusion.
 */
@Value
public class DetectionRule {

    int rank;
    String intent;
    Set<String> keywords;
    List<Pattern> patterns;
    List<Set<String>> allOf;
    Set<String> exclusions;
    String extractorName;
    ParameterExtractor extractor;
    Duration cacheTtl;

    public boolean matches(String normalizedText) {
        if (!keywords.isEmpty() && keywords.stream().noneMatch(normalizedText::contains)) {
            return false;
        }
        if (!patterns.isEmpty() && patterns.stream().noneMatch(p -> p.matcher(normalizedText).find())) {
            return false;
        }
        for (Set<String> group : allOf) {
            if (group.stream().noneMatch(normalizedText::contains)) {
                return false;
            }
        }
        return exclusions.stream().noneMatch(normalizedText::contains);
    }
}
