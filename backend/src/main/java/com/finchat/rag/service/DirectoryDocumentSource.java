package com.finchat.rag.service;

import com.finchat.rag.model.KnowledgeDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads every {@code *.txt} file of {@code rag.docs-path}, in file-name order.
 * Falls back to the bundled default knowledge when the directory has no documents.
 */
@Component
@Slf4j
public class DirectoryDocumentSource implements DocumentSource {

    static final String DEFAULT_KNOWLEDGE_RESOURCE = "/knowledge/default_knowledge.txt";

    private final Path docsPath;

    public DirectoryDocumentSource(@Value("${rag.docs-path:data/static_docs}") String docsPath) {
        this.docsPath = Paths.get(docsPath);
    }

    @Override
    public List<KnowledgeDocument> loadDocuments() {
        List<KnowledgeDocument> documents = new ArrayList<>();

        if (Files.isDirectory(docsPath)) {
            List<Path> files;
            try (Stream<Path> listing = Files.list(docsPath)) {
                files = listing
                        .filter(p -> p.getFileName().toString().endsWith(".txt"))
                        .sorted()
                        .collect(Collectors.toList());
            } catch (IOException e) {
                log.error("Failed to list {}: {}", docsPath, e.getMessage());
                files = List.of();
            }

            for (Path file : files) {
                try {
                    documents.add(new KnowledgeDocument(file.getFileName().toString(),
                            Files.readString(file, StandardCharsets.UTF_8)));
                    log.debug("Loaded {}", file.getFileName());
                } catch (IOException e) {
                    log.error("Failed to load {}: {}", file.getFileName(), e.getMessage());
                }
            }
        }

        if (documents.isEmpty()) {
            log.info("No documents found in {}, using default knowledge", docsPath);
            KnowledgeDocument fallback = loadDefaultKnowledge();
            if (fallback != null) {
                documents.add(fallback);
            }
        }

        log.info("✅ Loaded {} knowledge documents", documents.size());
        return documents;
    }

    private KnowledgeDocument loadDefaultKnowledge() {
        try (InputStream is = getClass().getResourceAsStream(DEFAULT_KNOWLEDGE_RESOURCE)) {
            if (is == null) {
                log.warn("⚠️  {} not found in classpath resources, corpus is empty", DEFAULT_KNOWLEDGE_RESOURCE);
                return null;
            }
            return new KnowledgeDocument("default_knowledge", new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Failed to read {}: {}", DEFAULT_KNOWLEDGE_RESOURCE, e.getMessage());
            return null;
        }
    }
}
