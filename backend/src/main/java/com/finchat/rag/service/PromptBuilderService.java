package com.finchat.rag.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finchat.rag.model.GenerationRequest;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.RetrievalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;

/**
 * Builds the generation requests for each answer path.
 * Token limits: 200 for handler summaries, 500 for chat answers, 300 for action detection.
 */
@Service
@Slf4j
public class PromptBuilderService {

    static final int SUMMARY_MAX_TOKENS = 200;
    static final int CHAT_MAX_TOKENS = 500;
    static final int ACTION_MAX_TOKENS = 300;

    private static final String SYSTEM_PROMPT =
        "You are a helpful personal finance assistant for Indian retail investors.\n" +
        "Be accurate and concise. Never invent prices, returns or figures.\n" +
        "If you are unsure, say so instead of guessing.";

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Ask for a short natural-language summary of a handler result.
     */
    public GenerationRequest buildSummaryPrompt(Query query, String intent, Map<String, Object> data) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(SYSTEM_PROMPT).append("\n\n");
        prompt.append("User Question: ").append(query.getRawText()).append("\n\n");
        prompt.append("Result of ").append(intent).append(":\n");
        prompt.append(toJson(data)).append("\n\n");
        prompt.append("Summarize this result for the user in 2-3 sentences. ");
        prompt.append("Use only the numbers shown above.\n");

        log.debug("Summary prompt built for intent {} ({} chars)", intent, prompt.length());
        return GenerationRequest.builder()
                .prompt(prompt.toString())
                .maxTokens(SUMMARY_MAX_TOKENS)
                .build();
    }

    /**
     * Answer from retrieved knowledge chunks. The chunk texts travel as the request context.
     */
    public GenerationRequest buildGroundedPrompt(Query query, RetrievalResult retrieval) {
        String prompt = SYSTEM_PROMPT + "\n" +
            "Answer only using the provided context. If the context does not contain the answer,\n" +
            "say that the information is not available.\n\n" +
            "User Question: " + query.getRawText() + "\n\n" +
            "Please provide a clear answer based on the context above.\n";

        log.debug("Grounded prompt built with {} chunks ({} mode)",
                retrieval.getMatches().size(), retrieval.getMode());
        return GenerationRequest.builder()
                .prompt(prompt)
                .context(retrieval.joinedText())
                .maxTokens(CHAT_MAX_TOKENS)
                .build();
    }

    public GenerationRequest buildUngroundedPrompt(Query query) {
        String prompt = SYSTEM_PROMPT + "\n\n" +
            "User Question: " + query.getRawText() + "\n\n" +
            "Context: No relevant documents found in the knowledge base.\n\n" +
            "Answer from general financial knowledge and keep it brief.\n";

        return GenerationRequest.builder()
                .prompt(prompt)
                .maxTokens(CHAT_MAX_TOKENS)
                .build();
    }

    /**
     * JSON-mode prompt asking which registered action, if any, the question calls for.
     */
    public GenerationRequest buildActionPrompt(Query query, Collection<String> actions) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You route finance questions to tools.\n");
        prompt.append("Available actions: ").append(String.join(", ", actions)).append("\n\n");
        prompt.append("User Question: ").append(query.getRawText()).append("\n\n");
        prompt.append("Reply with a single JSON object: ");
        prompt.append("{\"action\": \"<one of the actions or none>\", \"parameters\": {...}}.\n");
        prompt.append("Use \"none\" when no action fits.");

        return GenerationRequest.builder()
                .prompt(prompt.toString())
                .jsonMode(true)
                .maxTokens(ACTION_MAX_TOKENS)
                .build();
    }

    private String toJson(Map<String, Object> data) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize handler result: {}", e.getMessage());
            return String.valueOf(data);
        }
    }
}
