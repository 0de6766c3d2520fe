package com.finchat.rag.service;

import com.finchat.rag.exception.EmbeddingUnavailableException;
import com.finchat.rag.model.DocumentChunk;
import com.finchat.rag.model.RetrievalMode;
import com.finchat.rag.model.RetrievalResult;
import com.finchat.rag.model.ScoredChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Brute-force cosine scan over every stored chunk.
 * Fine for a few hundred documents; a larger corpus wants an approximate index behind {@link CorpusIndex}.
 */
public class InMemoryCorpusIndex implements CorpusIndex {

    private final List<DocumentChunk> chunks;
    private final int dimension;

    public InMemoryCorpusIndex(List<DocumentChunk> chunks) {
        this.chunks = chunks.stream()
                .sorted(DocumentChunk.CORPUS_ORDER)
                .collect(Collectors.toUnmodifiableList());
        this.dimension = resolveDimension(this.chunks);
    }

    public static InMemoryCorpusIndex empty() {
        return new InMemoryCorpusIndex(List.of());
    }

    @Override
    public RetrievalResult search(double[] queryEmbedding, int k) {
        if (k <= 0 || chunks.isEmpty() || dimension == 0) {
            return RetrievalResult.empty();
        }
        if (queryEmbedding == null || queryEmbedding.length != dimension) {
            throw new EmbeddingUnavailableException("Query embedding has dimension "
                    + (queryEmbedding == null ? 0 : queryEmbedding.length) + ", index expects " + dimension);
        }

        List<ScoredChunk> scored = new ArrayList<>(chunks.size());
        for (DocumentChunk chunk : chunks) {
            scored.add(new ScoredChunk(chunk, cosineSimilarity(queryEmbedding, chunk.getEmbedding())));
        }
        scored.sort(ScoredChunk.RANKING);

        return RetrievalResult.of(scored.subList(0, Math.min(k, scored.size())), RetrievalMode.SEMANTIC);
    }

    @Override
    public List<DocumentChunk> getChunks() {
        return chunks;
    }

    @Override
    public boolean hasEmbeddings() {
        return dimension > 0;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero length.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    private static int resolveDimension(List<DocumentChunk> chunks) {
        if (chunks.isEmpty() || !chunks.get(0).hasEmbedding()) {
            for (DocumentChunk chunk : chunks) {
                if (chunk.hasEmbedding()) {
                    throw new IllegalArgumentException("Index mixes embedded and unembedded chunks");
                }
            }
            return 0;
        }
        int dim = chunks.get(0).getEmbedding().length;
        for (DocumentChunk chunk : chunks) {
            if (!chunk.hasEmbedding() || chunk.getEmbedding().length != dim) {
                throw new IllegalArgumentException("Chunk " + chunk.getDocumentId() + "#" + chunk.getSequenceIndex()
                        + " does not have a " + dim + "-dimensional embedding");
            }
        }
        return dim;
    }
}
