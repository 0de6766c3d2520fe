package com.finchat.rag.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes the live corpus index. Rebuilds install a complete new instance in one step,
 * so readers see either the old index or the new one.
 */
@Component
@Slf4j
public class CorpusIndexHolder {

    private final AtomicReference<CorpusIndex> current = new AtomicReference<>(InMemoryCorpusIndex.empty());

    public CorpusIndex get() {
        return current.get();
    }

    public void swap(CorpusIndex index) {
        CorpusIndex previous = current.getAndSet(index);
        log.info("Corpus index swapped: {} chunks -> {} chunks (embeddings: {})",
                previous.size(), index.size(), index.hasEmbeddings());
    }
}
