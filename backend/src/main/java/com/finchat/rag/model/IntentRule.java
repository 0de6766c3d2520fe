package com.finchat.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Represents an intent rule from rag-intents.json.
 * Compiled into a {@link DetectionRule} at startup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntentRule {

    @JsonProperty("rank")
    private Integer rank;

    @JsonProperty("intent_name")
    private String intentName;

    @JsonProperty("keywords")
    private List<String> keywords;

    @JsonProperty("patterns")
    private List<String> patterns;

    // every group needs at least one hit
    @JsonProperty("all_of")
    private List<List<String>> allOf;

    @JsonProperty("exclude")
    private List<String> exclude;

    @JsonProperty("extractor")
    private String extractor;

    @JsonProperty("cache_ttl_seconds")
    private Long cacheTtlSeconds;  // Optional: overrides rag.cache.ttl-seconds for this intent
}
