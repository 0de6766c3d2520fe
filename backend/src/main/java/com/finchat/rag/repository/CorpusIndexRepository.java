package com.finchat.rag.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.finchat.rag.model.PersistedIndex;
import com.finchat.rag.service.CorpusIndex;
import com.finchat.rag.service.InMemoryCorpusIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;

/**
 * Persists a built semantic index as a JSON file so restarts skip re-embedding the corpus.
 */
@Repository
@Slf4j
public class CorpusIndexRepository {

    private final Path indexFile;
    private final ObjectMapper objectMapper;

    public CorpusIndexRepository(@Value("${rag.index.persist-path:data/corpus-index.json}") String indexFile) {
        this.indexFile = Paths.get(indexFile);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Loads the stored index if it exists, is non-empty and was built with the same chunking settings.
     */
    public Optional<CorpusIndex> load(int chunkSize, int chunkOverlap) {
        try {
            if (!Files.isRegularFile(indexFile) || Files.size(indexFile) == 0) {
                log.debug("No persisted index at {}", indexFile);
                return Optional.empty();
            }

            PersistedIndex stored = objectMapper.readValue(indexFile.toFile(), PersistedIndex.class);
            if (stored.getChunkSize() != chunkSize || stored.getChunkOverlap() != chunkOverlap) {
                log.info("Persisted index was built with size={}, overlap={}; rebuilding",
                        stored.getChunkSize(), stored.getChunkOverlap());
                return Optional.empty();
            }
            if (stored.getChunks() == null || stored.getChunks().isEmpty()) {
                log.warn("⚠️  Persisted index at {} is empty, rebuilding", indexFile);
                return Optional.empty();
            }

            InMemoryCorpusIndex index = new InMemoryCorpusIndex(stored.getChunks());
            if (!index.hasEmbeddings() || index.dimension() != stored.getDimension()) {
                log.warn("⚠️  Persisted index at {} has inconsistent embeddings, rebuilding", indexFile);
                return Optional.empty();
            }

            log.info("✅ Loaded persisted index: {} chunks, dimension {}, built {}",
                    index.size(), index.dimension(), stored.getCreatedAt());
            return Optional.of(index);

        } catch (IOException | IllegalArgumentException e) {
            log.warn("⚠️  Failed to load persisted index from {}: {}, rebuilding", indexFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the index through a temporary file so a crash never leaves a half-written index behind.
     * Lexical-only indexes are not stored.
     */
    public boolean save(CorpusIndex index, int chunkSize, int chunkOverlap) {
        if (!index.hasEmbeddings()) {
            log.debug("Not persisting index without embeddings");
            return false;
        }
        try {
            Path parent = indexFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = indexFile.resolveSibling(indexFile.getFileName() + ".tmp");

            PersistedIndex stored = new PersistedIndex(chunkSize, chunkOverlap, index.dimension(),
                    Instant.now(), index.getChunks());
            objectMapper.writeValue(tmp.toFile(), stored);
            Files.move(tmp, indexFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            log.info("✅ Persisted index with {} chunks to {}", index.size(), indexFile);
            return true;
        } catch (IOException e) {
            log.warn("⚠️  Failed to persist index to {}: {}", indexFile, e.getMessage());
            return false;
        }
    }
}
