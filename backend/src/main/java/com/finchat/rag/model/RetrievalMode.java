package com.finchat.rag.model;

/**
 * Which retrieval path produced a {@link RetrievalResult}.
 */
public enum RetrievalMode {
    SEMANTIC,
    LEXICAL,
    NONE
}
