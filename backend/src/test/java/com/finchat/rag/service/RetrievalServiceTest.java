package com.finchat.rag.service;

import com.finchat.rag.client.EmbeddingBackend;
import com.finchat.rag.exception.EmbeddingUnavailableException;
import com.finchat.rag.model.DocumentChunk;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.RetrievalMode;
import com.finchat.rag.model.RetrievalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrievalServiceTest {

    @Mock
    private EmbeddingBackend embeddingBackend;

    private CorpusIndexHolder holder;
    private RetrievalService retrievalService;

    @BeforeEach
    void setUp() {
        holder = new CorpusIndexHolder();
        retrievalService = new RetrievalService(holder, embeddingBackend, new LexicalScorer(), 2);
    }

    @Test
    void usesSemanticSearchWhenQueryCanBeEmbedded() {
        holder.swap(semanticIndex());
        when(embeddingBackend.embed("Tell me about loans")).thenReturn(new double[]{0, 0, 1});

        RetrievalResult result = retrievalService.retrieve(Query.of("Tell me about loans", null), 1);

        assertThat(result.getMode()).isEqualTo(RetrievalMode.SEMANTIC);
        assertThat(result.topChunk().getDocumentId()).isEqualTo("emi");
    }

    @Test
    void fallsBackToKeywordSearchWhenEmbeddingFails() {
        holder.swap(semanticIndex());
        when(embeddingBackend.embed(anyString())).thenThrow(new EmbeddingUnavailableException("model offline"));

        RetrievalResult result = retrievalService.retrieve(Query.of("What is SIP", null), 3);

        assertThat(result.getMode()).isEqualTo(RetrievalMode.LEXICAL);
        assertThat(result.topChunk().getDocumentId()).isEqualTo("sip");
    }

    @Test
    void fallsBackWhenQueryVectorDoesNotFitIndex() {
        holder.swap(semanticIndex());
        when(embeddingBackend.embed(anyString())).thenReturn(new double[]{1, 0});

        RetrievalResult result = retrievalService.retrieve(Query.of("what is sip", null), 3);

        assertThat(result.getMode()).isEqualTo(RetrievalMode.LEXICAL);
        assertThat(result.topChunk().getDocumentId()).isEqualTo("sip");
    }

    @Test
    void lexicalOnlyIndexSkipsTheEmbeddingBackend() {
        holder.swap(new InMemoryCorpusIndex(List.of(
                DocumentChunk.builder().documentId("sip").sequenceIndex(0).text("SIP means monthly investing").build())));

        RetrievalResult result = retrievalService.retrieve(Query.of("what is sip", null), 3);

        assertThat(result.getMode()).isEqualTo(RetrievalMode.LEXICAL);
        verify(embeddingBackend, never()).embed(anyString());
    }

    @Test
    void emptyIndexGivesEmptyResult() {
        RetrievalResult result = retrievalService.retrieve(Query.of("what is sip", null), 3);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getMode()).isEqualTo(RetrievalMode.NONE);
        verify(embeddingBackend, never()).embed(anyString());
    }

    @Test
    void topKIsCapped() {
        holder.swap(semanticIndex());
        when(embeddingBackend.embed(anyString())).thenReturn(new double[]{1, 1, 1});

        assertThat(retrievalService.retrieve(Query.of("anything", null), 10).getMatches()).hasSize(2);
        assertThat(retrievalService.retrieve(Query.of("anything", null), 0).isEmpty()).isTrue();
    }

    private static CorpusIndex semanticIndex() {
        return new InMemoryCorpusIndex(List.of(
                chunk("sip", "A SIP is a Systematic Investment Plan for mutual funds.", 1, 0, 0),
                chunk("tax", "Section 80C allows deductions up to 1.5 lakh.", 0, 1, 0),
                chunk("emi", "An EMI repays a loan in equal monthly parts.", 0, 0, 1)));
    }

    private static DocumentChunk chunk(String doc, String text, double... embedding) {
        return DocumentChunk.builder().documentId(doc).sequenceIndex(0).text(text).embedding(embedding).build();
    }
}
