package com.finchat.rag.service;

import com.finchat.rag.client.GenerationBackend;
import com.finchat.rag.exception.GenerationUnavailableException;
import com.finchat.rag.model.DocumentChunk;
import com.finchat.rag.model.FinalAnswer;
import com.finchat.rag.model.GenerationRequest;
import com.finchat.rag.model.HandlerOutcome;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.ResponseStrategy;
import com.finchat.rag.model.RetrievalResult;
import com.finchat.rag.model.RouteDecision;
import com.finchat.rag.model.ScoredChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Picks the answer path for a routed query and produces the final answer.
 * Every path degrades to deterministic text when generation fails, so an answer is always returned.
 */
@Service
@Slf4j
public class ResponseStrategySelector {

    static final String NO_INFORMATION =
            "I don't have enough information to answer that right now. " +
            "Try asking about stock prices, mutual funds, SIP or EMI calculations, or investment basics.";

    private final GenerationBackend generationBackend;
    private final PromptBuilderService promptBuilder;
    private final AnswerTemplateFormatter templateFormatter;

    public ResponseStrategySelector(GenerationBackend generationBackend,
                                    PromptBuilderService promptBuilder,
                                    AnswerTemplateFormatter templateFormatter) {
        this.generationBackend = generationBackend;
        this.promptBuilder = promptBuilder;
        this.templateFormatter = templateFormatter;
    }

    public ResponseStrategy select(RouteDecision decision, RetrievalResult retrieval) {
        if (decision.isMatched()) {
            return ResponseStrategy.DIRECT;
        }
        if (retrieval != null && !retrieval.isEmpty()) {
            return ResponseStrategy.GROUNDED_GENERATION;
        }
        return ResponseStrategy.UNGROUNDED_GENERATION;
    }

    /**
     * @param handlerOutcome required for matched decisions, ignored otherwise
     */
    public FinalAnswer respond(Query query, RouteDecision decision,
                               RetrievalResult retrieval, HandlerOutcome handlerOutcome) {
        ResponseStrategy strategy = select(decision, retrieval);
        log.info("🔵 Responding to '{}' with strategy {}", query.getNormalizedText(), strategy);

        switch (strategy) {
            case DIRECT:
                return respondDirect(query, decision, handlerOutcome);
            case GROUNDED_GENERATION:
                return respondGrounded(query, decision, retrieval);
            default:
                return respondUngrounded(query, decision);
        }
    }

    private FinalAnswer respondDirect(Query query, RouteDecision decision, HandlerOutcome outcome) {
        String intent = decision.getIntent();
        FinalAnswer.FinalAnswerBuilder answer = FinalAnswer.builder()
                .intent(intent)
                .strategy(ResponseStrategy.DIRECT)
                .sources(Collections.emptyList());

        if (outcome == null || !outcome.isAvailable()) {
            log.warn("⚠️  Handler for {} unavailable: {}", intent,
                    outcome != null ? outcome.getFailureReason() : "no outcome");
            return answer.answer(templateFormatter.unavailable(intent))
                    .fallbackUsed(true)
                    .data(Collections.emptyMap())
                    .build();
        }

        Map<String, Object> data = outcome.getResult();
        answer.data(data);
        String summary = tryGenerate(promptBuilder.buildSummaryPrompt(query, intent, data), "summary");
        if (summary != null) {
            return answer.answer(summary).fallbackUsed(false).build();
        }
        return answer.answer(templateFormatter.format(intent, data)).fallbackUsed(true).build();
    }

    private FinalAnswer respondGrounded(Query query, RouteDecision decision, RetrievalResult retrieval) {
        List<String> sources = retrieval.getMatches().stream()
                .map(ScoredChunk::getChunk)
                .map(DocumentChunk::getDocumentId)
                .distinct()
                .collect(Collectors.toList());

        FinalAnswer.FinalAnswerBuilder answer = FinalAnswer.builder()
                .intent(decision.getIntent())
                .strategy(ResponseStrategy.GROUNDED_GENERATION)
                .data(Collections.emptyMap())
                .sources(sources);

        String generated = tryGenerate(promptBuilder.buildGroundedPrompt(query, retrieval), "grounded answer");
        if (generated != null) {
            return answer.answer(generated).fallbackUsed(false).build();
        }
        return answer.answer(retrieval.topChunk().getText()).fallbackUsed(true).build();
    }

    private FinalAnswer respondUngrounded(Query query, RouteDecision decision) {
        FinalAnswer.FinalAnswerBuilder answer = FinalAnswer.builder()
                .intent(decision.getIntent())
                .strategy(ResponseStrategy.UNGROUNDED_GENERATION)
                .data(Collections.emptyMap())
                .sources(Collections.emptyList());

        String generated = tryGenerate(promptBuilder.buildUngroundedPrompt(query), "ungrounded answer");
        if (generated != null) {
            return answer.answer(generated).fallbackUsed(false).build();
        }
        return answer.answer(NO_INFORMATION).fallbackUsed(true).build();
    }

    /**
     * Generated text, or null when the backend failed or returned nothing usable.
     */
    private String tryGenerate(GenerationRequest request, String purpose) {
        try {
            String text = generationBackend.generate(request);
            if (text == null || text.isBlank()) {
                log.warn("⚠️  Blank {} from generation backend, using fallback", purpose);
                return null;
            }
            return text.trim();
        } catch (GenerationUnavailableException e) {
            log.warn("⚠️  Generation unavailable for {} ({}), using fallback", purpose, e.getMessage());
            return null;
        }
    }
}
