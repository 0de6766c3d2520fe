package com.finchat.rag.service;

import com.finchat.rag.model.KnowledgeDocument;

import java.util.List;

/**
 * Supplies the knowledge corpus at index build time.
 */
public interface DocumentSource {

    List<KnowledgeDocument> loadDocuments();
}
