package com.finchat.rag.service;

import com.finchat.rag.exception.ConfigurationException;
import com.finchat.rag.model.DocumentChunk;
import com.finchat.rag.model.KnowledgeDocument;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits documents into chunks of at most {@code chunkSize} characters, each starting
 * {@code chunkOverlap} characters before the end of the previous one.
 * Break points prefer paragraph, line, sentence and word boundaries, in that order.
 */
@Component
@Getter
public class TextChunker {

    private static final String[] SEPARATORS = {"\n\n", "\n", ". ", " "};

    private final int chunkSize;
    private final int chunkOverlap;

    public TextChunker(@Value("${rag.index.chunk-size:400}") int chunkSize,
                       @Value("${rag.index.chunk-overlap:100}") int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("rag.index.chunk-size must be positive, was " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new ConfigurationException("rag.index.chunk-overlap must be in [0, chunk-size), was " + chunkOverlap);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public List<DocumentChunk> split(KnowledgeDocument document) {
        List<DocumentChunk> chunks = new ArrayList<>();
        String text = document.getText();
        if (text == null || text.isBlank()) {
            return chunks;
        }

        int length = text.length();
        int pos = 0;
        int sequence = 0;

        while (pos < length) {
            int end = Math.min(pos + chunkSize, length);
            if (end < length) {
                end = findBreak(text, pos, end);
            }

            String slice = text.substring(pos, end).trim();
            if (!slice.isEmpty()) {
                chunks.add(DocumentChunk.builder()
                        .documentId(document.getId())
                        .sequenceIndex(sequence++)
                        .text(slice)
                        .build());
            }
            if (end >= length) {
                break;
            }

            int next = Math.max(end - chunkOverlap, pos + 1);
            // start the overlap on a word boundary when one is available before end
            if (next > 0 && !Character.isWhitespace(text.charAt(next - 1))) {
                int space = indexOfWhitespace(text, next, end);
                if (space >= 0) {
                    next = space + 1;
                }
            }
            pos = next;
        }
        return chunks;
    }

    private int findBreak(String text, int start, int limit) {
        int floor = start + chunkSize / 2;
        for (String separator : SEPARATORS) {
            int idx = text.lastIndexOf(separator, limit - separator.length());
            if (idx >= floor) {
                // keep the sentence-ending period inside the chunk
                return separator.equals(". ") ? idx + 1 : idx + separator.length();
            }
        }
        return limit;
    }

    private static int indexOfWhitespace(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
