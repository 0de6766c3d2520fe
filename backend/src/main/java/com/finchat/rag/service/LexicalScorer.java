package com.finchat.rag.service;

import com.finchat.rag.model.DocumentChunk;
import com.finchat.rag.model.RetrievalMode;
import com.finchat.rag.model.RetrievalResult;
import com.finchat.rag.model.ScoredChunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-overlap retrieval used when no query embedding can be computed.
 * A chunk scores the number of distinct word tokens it shares with the query; chunks sharing none are dropped.
 */
@Component
public class LexicalScorer {

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    public RetrievalResult search(List<DocumentChunk> chunks, String queryText, int k) {
        if (k <= 0 || chunks.isEmpty()) {
            return RetrievalResult.empty();
        }
        Set<String> queryTokens = tokenize(queryText);
        if (queryTokens.isEmpty()) {
            return RetrievalResult.empty();
        }

        List<ScoredChunk> scored = new ArrayList<>();
        for (DocumentChunk chunk : chunks) {
            int overlap = overlap(queryTokens, tokenize(chunk.getText()));
            if (overlap > 0) {
                scored.add(new ScoredChunk(chunk, overlap));
            }
        }
        if (scored.isEmpty()) {
            return RetrievalResult.empty();
        }
        scored.sort(ScoredChunk.RANKING);

        return RetrievalResult.of(scored.subList(0, Math.min(k, scored.size())), RetrievalMode.LEXICAL);
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    private static int overlap(Set<String> queryTokens, Set<String> chunkTokens) {
        int count = 0;
        for (String token : queryTokens) {
            if (chunkTokens.contains(token)) {
                count++;
            }
        }
        return count;
    }
}
