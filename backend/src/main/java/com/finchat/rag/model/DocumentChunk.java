package com.finchat.rag.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Comparator;

/**
 * A bounded slice of a knowledge document, optionally carrying its embedding.
 * A null embedding means the chunk was indexed while the embedding backend was unavailable.
 */
@Value
@Builder
@Jacksonized
public class DocumentChunk {

    /** Corpus order: document id, then sequence index. Used for all score tie-breaks. */
    public static final Comparator<DocumentChunk> CORPUS_ORDER =
            Comparator.comparing(DocumentChunk::getDocumentId)
                    .thenComparingInt(DocumentChunk::getSequenceIndex);

    String documentId;
    int sequenceIndex;
    String text;
    double[] embedding;

    DocumentChunk(String documentId, int sequenceIndex, String text, double[] embedding) {
        this.documentId = documentId;
        this.sequenceIndex = sequenceIndex;
        this.text = text;
        this.embedding = embedding != null ? embedding.clone() : null;
    }

    /** Copy of the vector; the chunk's own array never leaves it. */
    public double[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public DocumentChunk withEmbedding(double[] vector) {
        return new DocumentChunk(documentId, sequenceIndex, text, vector);
    }
}
