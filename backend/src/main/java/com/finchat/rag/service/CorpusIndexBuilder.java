package com.finchat.rag.service;

import com.finchat.rag.client.EmbeddingBackend;
import com.finchat.rag.exception.EmbeddingUnavailableException;
import com.finchat.rag.model.DocumentChunk;
import com.finchat.rag.model.KnowledgeDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Chunks and embeds a corpus into a fresh {@link InMemoryCorpusIndex}.
 * When the embedding backend fails, the result is a lexical-only index holding the same chunks.
 */
@Component
@Slf4j
public class CorpusIndexBuilder {

    private final TextChunker chunker;
    private final EmbeddingBackend embeddingBackend;

    public CorpusIndexBuilder(TextChunker chunker, EmbeddingBackend embeddingBackend) {
        this.chunker = chunker;
        this.embeddingBackend = embeddingBackend;
    }

    public CorpusIndex build(List<KnowledgeDocument> documents) {
        long start = System.currentTimeMillis();

        List<DocumentChunk> chunks = new ArrayList<>();
        for (KnowledgeDocument document : documents) {
            chunks.addAll(chunker.split(document));
        }
        log.info("Building corpus index: {} documents, {} chunks (size={}, overlap={})",
                documents.size(), chunks.size(), chunker.getChunkSize(), chunker.getChunkOverlap());

        if (chunks.isEmpty()) {
            return InMemoryCorpusIndex.empty();
        }

        try {
            List<DocumentChunk> embedded = embedAll(chunks);
            log.info("✅ Built semantic index with {} chunks in {}ms", embedded.size(),
                    System.currentTimeMillis() - start);
            return new InMemoryCorpusIndex(embedded);
        } catch (EmbeddingUnavailableException e) {
            log.warn("⚠️  Embedding backend unavailable during index build ({}), keeping {} chunks for keyword search",
                    e.getMessage(), chunks.size());
            return new InMemoryCorpusIndex(chunks);
        }
    }

    private List<DocumentChunk> embedAll(List<DocumentChunk> chunks) {
        List<DocumentChunk> embedded = new ArrayList<>(chunks.size());
        int dimension = -1;
        for (DocumentChunk chunk : chunks) {
            double[] vector = embeddingBackend.embed(chunk.getText());
            if (vector == null || vector.length == 0) {
                throw new EmbeddingUnavailableException("Empty embedding for chunk "
                        + chunk.getDocumentId() + "#" + chunk.getSequenceIndex());
            }
            if (dimension < 0) {
                dimension = vector.length;
            } else if (vector.length != dimension) {
                throw new EmbeddingUnavailableException("Embedding dimension changed from " + dimension
                        + " to " + vector.length + " during build");
            }
            embedded.add(chunk.withEmbedding(vector));
        }
        return embedded;
    }
}
