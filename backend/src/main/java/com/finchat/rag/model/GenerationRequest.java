package com.finchat.rag.model;

import lombok.Builder;
import lombok.Value;

/**
 * Input for the generation backend.
 * {@code jsonMode} asks for a single JSON object (used for parameter extraction).
 */
@Value
@Builder
public class GenerationRequest {
    String prompt;
    String context;
    boolean jsonMode;
    Integer maxTokens;
    Double temperature;
}
