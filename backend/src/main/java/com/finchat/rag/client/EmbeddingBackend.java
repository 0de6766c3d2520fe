package com.finchat.rag.client;

import com.finchat.rag.exception.EmbeddingUnavailableException;

/**
 * Turns text into a fixed-length vector.
 */
public interface EmbeddingBackend {

    /**
     * @throws EmbeddingUnavailableException when the model cannot be reached or returns no vector
     */
    double[] embed(String text);
}
