package com.finchat.rag.service;

import com.finchat.rag.exception.EmbeddingUnavailableException;
import com.finchat.rag.model.DocumentChunk;
import com.finchat.rag.model.RetrievalResult;

import java.util.List;

/**
 * Read-only semantic index over document chunks. Instances are immutable once built
 * and may be shared by any number of concurrent readers.
 */
public interface CorpusIndex {

    /**
     * Top {@code k} chunks by cosine similarity to {@code queryEmbedding}, best first,
     * ties broken by document id then sequence index.
     *
     * @throws EmbeddingUnavailableException if the query vector does not fit the index dimension
     */
    RetrievalResult search(double[] queryEmbedding, int k);

    /**
     * All chunks in corpus order.
     */
    List<DocumentChunk> getChunks();

    /**
     * False for an index built while the embedding backend was down; such an index only supports lexical search.
     */
    boolean hasEmbeddings();

    int dimension();

    default int size() {
        return getChunks().size();
    }

    default boolean isEmpty() {
        return getChunks().isEmpty();
    }
}
