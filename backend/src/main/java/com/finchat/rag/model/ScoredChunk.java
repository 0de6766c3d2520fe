package com.finchat.rag.model;

import lombok.Value;

import java.util.Comparator;

@Value
public class ScoredChunk {

    /** Descending score, then corpus order. */
    public static final Comparator<ScoredChunk> RANKING =
            Comparator.comparingDouble(ScoredChunk::getScore).reversed()
                    .thenComparing(ScoredChunk::getChunk, DocumentChunk.CORPUS_ORDER);

    DocumentChunk chunk;
    double score;
}
