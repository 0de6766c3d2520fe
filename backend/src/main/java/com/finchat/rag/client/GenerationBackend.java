package com.finchat.rag.client;

import com.finchat.rag.exception.GenerationUnavailableException;
import com.finchat.rag.model.GenerationRequest;

/**
 * Produces text from a prompt and optional context, in free-text or JSON mode.
 */
public interface GenerationBackend {

    /**
     * @throws GenerationUnavailableException on any backend failure, including timeouts
     */
    String generate(GenerationRequest request);
}
