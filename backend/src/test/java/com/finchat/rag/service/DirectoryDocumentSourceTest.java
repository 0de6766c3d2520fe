package com.finchat.rag.service;

import com.finchat.rag.model.KnowledgeDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryDocumentSourceTest {

    @TempDir
    Path docs;

    @Test
    void readsTextFilesInNameOrder() throws Exception {
        Files.writeString(docs.resolve("tax.txt"), "Section 80C");
        Files.writeString(docs.resolve("mutual_funds.txt"), "NAV is the unit price");
        Files.writeString(docs.resolve("notes.md"), "ignored");

        List<KnowledgeDocument> documents = new DirectoryDocumentSource(docs.toString()).loadDocuments();

        assertThat(documents).extracting(KnowledgeDocument::getId).containsExactly("mutual_funds.txt", "tax.txt");
        assertThat(documents.get(1).getText()).isEqualTo("Section 80C");
    }

    @Test
    void emptyDirectoryFallsBackToBundledKnowledge() {
        List<KnowledgeDocument> documents = new DirectoryDocumentSource(docs.toString()).loadDocuments();

        assertThat(documents).hasSize(1);
        assertThat(documents.get(0).getId()).isEqualTo("default_knowledge");
        assertThat(documents.get(0).getText()).contains("Systematic Investment Plan");
    }

    @Test
    void missingDirectoryFallsBackToBundledKnowledge() {
        List<KnowledgeDocument> documents =
                new DirectoryDocumentSource(docs.resolve("absent").toString()).loadDocuments();

        assertThat(documents).extracting(KnowledgeDocument::getId).containsExactly("default_knowledge");
    }
}
