package com.finchat.rag.service;

import com.finchat.rag.client.EmbeddingBackend;
import com.finchat.rag.exception.EmbeddingUnavailableException;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.RetrievalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Supplies supporting context for queries no handler answers.
 * Semantic search first; keyword overlap when the query cannot be embedded or the index has no vectors.
 * Never throws: an empty result means "no grounding available".
 */
@Service
@Slf4j
public class RetrievalService {

    private final CorpusIndexHolder indexHolder;
    private final EmbeddingBackend embeddingBackend;
    private final LexicalScorer lexicalScorer;
    private final int maxTopK;

    public RetrievalService(CorpusIndexHolder indexHolder,
                            EmbeddingBackend embeddingBackend,
                            LexicalScorer lexicalScorer,
                            @Value("${rag.retrieval.max-top-k:10}") int maxTopK) {
        this.indexHolder = indexHolder;
        this.embeddingBackend = embeddingBackend;
        this.lexicalScorer = lexicalScorer;
        this.maxTopK = maxTopK;
    }

    public RetrievalResult retrieve(Query query, int k) {
        int topK = Math.min(k, maxTopK);
        CorpusIndex index = indexHolder.get();

        if (topK <= 0 || index.isEmpty() || query.isBlank()) {
            log.debug("No retrieval: topK={}, indexSize={}, blankQuery={}", topK, index.size(), query.isBlank());
            return RetrievalResult.empty();
        }

        try {
            if (index.hasEmbeddings()) {
                try {
                    double[] queryEmbedding = embeddingBackend.embed(query.getRawText());
                    RetrievalResult result = index.search(queryEmbedding, topK);
                    log.debug("Retrieved {} chunks from semantic index", result.getMatches().size());
                    return result;
                } catch (EmbeddingUnavailableException e) {
                    log.warn("⚠️  Semantic retrieval unavailable ({}), falling back to keyword search", e.getMessage());
                }
            }

            RetrievalResult result = lexicalScorer.search(index.getChunks(), query.getNormalizedText(), topK);
            log.debug("Retrieved {} chunks using keyword search", result.getMatches().size());
            return result;

        } catch (RuntimeException e) {
            log.error("Error retrieving context: {}", e.getMessage(), e);
            return RetrievalResult.empty();
        }
    }
}
