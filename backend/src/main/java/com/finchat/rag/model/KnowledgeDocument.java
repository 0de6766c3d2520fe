package com.finchat.rag.model;

import lombok.Value;

/**
 * One corpus document as supplied by a document source at build time.
 */
@Value
public class KnowledgeDocument {
    String id;
    String text;
}
