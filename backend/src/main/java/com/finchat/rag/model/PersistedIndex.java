package com.finchat.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * On-disk form of a built corpus index.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersistedIndex {

    @JsonProperty("chunk_size")
    private int chunkSize;

    @JsonProperty("chunk_overlap")
    private int chunkOverlap;

    @JsonProperty("dimension")
    private int dimension;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("chunks")
    private List<DocumentChunk> chunks;
}
