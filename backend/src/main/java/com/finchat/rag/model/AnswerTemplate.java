package com.finchat.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Represents a deterministic answer template from answer-templates.json.
 * Used when the generation backend cannot format a handler result.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnswerTemplate {

    @JsonProperty("intent_name")
    private String intentName;

    // {field} placeholders are filled from the handler result
    @JsonProperty("headline")
    private String headline;

    @JsonProperty("unavailable")
    private String unavailable;
}
