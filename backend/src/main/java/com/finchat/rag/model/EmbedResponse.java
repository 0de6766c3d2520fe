package com.finchat.rag.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible /v1/embeddings response body.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmbedResponse {
    private List<EmbeddingData> data;
    private String model;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmbeddingData {
        private Integer index;
        private List<Double> embedding;
    }
}
