package com.finchat.rag.service;

import com.finchat.rag.model.KnowledgeDocument;
import com.finchat.rag.repository.CorpusIndexRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Optional;

/**
 * Owns the corpus index lifecycle: load or build before serving, rebuild on demand.
 */
@Service
@Slf4j
public class CorpusIndexService {

    private final DocumentSource documentSource;
    private final CorpusIndexBuilder indexBuilder;
    private final CorpusIndexRepository repository;
    private final CorpusIndexHolder indexHolder;
    private final TextChunker chunker;
    private final boolean buildOnStartup;

    public CorpusIndexService(DocumentSource documentSource,
                              CorpusIndexBuilder indexBuilder,
                              CorpusIndexRepository repository,
                              CorpusIndexHolder indexHolder,
                              TextChunker chunker,
                              @Value("${rag.index.build-on-startup:true}") boolean buildOnStartup) {
        this.documentSource = documentSource;
        this.indexBuilder = indexBuilder;
        this.repository = repository;
        this.indexHolder = indexHolder;
        this.chunker = chunker;
        this.buildOnStartup = buildOnStartup;
    }

    @PostConstruct
    public void initialize() {
        if (!buildOnStartup) {
            log.info("Corpus index build on startup disabled");
            return;
        }

        Optional<CorpusIndex> persisted = repository.load(chunker.getChunkSize(), chunker.getChunkOverlap());
        if (persisted.isPresent()) {
            indexHolder.swap(persisted.get());
            return;
        }
        rebuild();
    }

    /**
     * Builds a new index from the document source and installs it atomically.
     * Serialized so two concurrent rebuilds cannot interleave their swaps.
     */
    public synchronized CorpusIndex rebuild() {
        List<KnowledgeDocument> documents = documentSource.loadDocuments();
        CorpusIndex index = indexBuilder.build(documents);
        repository.save(index, chunker.getChunkSize(), chunker.getChunkOverlap());
        indexHolder.swap(index);
        return index;
    }
}
