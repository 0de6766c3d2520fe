package com.finchat.rag.repository;

import com.finchat.rag.model.DocumentChunk;
import com.finchat.rag.service.CorpusIndex;
import com.finchat.rag.service.InMemoryCorpusIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CorpusIndexRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void savedIndexLoadsBack() {
        Path file = tempDir.resolve("index/corpus-index.json");
        CorpusIndexRepository repository = new CorpusIndexRepository(file.toString());
        CorpusIndex index = semanticIndex();

        assertThat(repository.save(index, 400, 100)).isTrue();
        assertThat(file).exists();

        Optional<CorpusIndex> loaded = repository.load(400, 100);
        assertThat(loaded).isPresent();
        assertThat(loaded.get().dimension()).isEqualTo(2);
        assertThat(loaded.get().getChunks())
                .extracting(DocumentChunk::getText)
                .containsExactly("first chunk", "second chunk");
        assertThat(loaded.get().getChunks().get(1).getEmbedding()).containsExactly(0.25, 0.75);
    }

    @Test
    void differentChunkingSettingsAreNotReused() {
        CorpusIndexRepository repository = new CorpusIndexRepository(tempDir.resolve("idx.json").toString());
        repository.save(semanticIndex(), 400, 100);

        assertThat(repository.load(500, 100)).isEmpty();
        assertThat(repository.load(400, 50)).isEmpty();
    }

    @Test
    void lexicalOnlyIndexIsNotSaved() {
        Path file = tempDir.resolve("idx.json");
        CorpusIndexRepository repository = new CorpusIndexRepository(file.toString());
        CorpusIndex lexical = new InMemoryCorpusIndex(List.of(
                DocumentChunk.builder().documentId("a").sequenceIndex(0).text("plain").build()));

        assertThat(repository.save(lexical, 400, 100)).isFalse();
        assertThat(file).doesNotExist();
    }

    @Test
    void missingOrCorruptFileLoadsNothing() throws Exception {
        Path file = tempDir.resolve("idx.json");
        CorpusIndexRepository repository = new CorpusIndexRepository(file.toString());

        assertThat(repository.load(400, 100)).isEmpty();

        Files.writeString(file, "{ not json");
        assertThat(repository.load(400, 100)).isEmpty();
    }

    private static CorpusIndex semanticIndex() {
        return new InMemoryCorpusIndex(List.of(
                DocumentChunk.builder().documentId("doc").sequenceIndex(0).text("first chunk")
                        .embedding(new double[]{1.0, 0.0}).build(),
                DocumentChunk.builder().documentId("doc").sequenceIndex(1).text("second chunk")
                        .embedding(new double[]{0.25, 0.75}).build()));
    }
}
