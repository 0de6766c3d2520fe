package com.finchat.rag.service;

import com.finchat.rag.exception.HandlerException;
import com.finchat.rag.handler.ExternalHandler;
import com.finchat.rag.handler.HandlerRegistry;
import com.finchat.rag.model.DetectionRule;
import com.finchat.rag.model.FinalAnswer;
import com.finchat.rag.model.HandlerOutcome;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.ResponseStrategy;
import com.finchat.rag.model.RetrievalResult;
import com.finchat.rag.model.RouteDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for one user query: route, then either call the handler (through the cache)
 * or retrieve context, then let the strategy selector produce the answer.
 * Never throws to the caller.
 */
@Service
@Slf4j
public class QueryOrchestrator {

    static final String EMPTY_QUERY_ANSWER =
            "Please type a question, for example \"What is SIP?\" or \"Price of TCS\".";

    private final IntentRouter intentRouter;
    private final ActionExtractionService actionExtraction;
    private final HandlerRegistry handlerRegistry;
    private final ResponseCache responseCache;
    private final RetrievalService retrievalService;
    private final ResponseStrategySelector strategySelector;
    private final MetricsService metricsService;
    private final int defaultTopK;

    public QueryOrchestrator(IntentRouter intentRouter,
                             ActionExtractionService actionExtraction,
                             HandlerRegistry handlerRegistry,
                             ResponseCache responseCache,
                             RetrievalService retrievalService,
                             ResponseStrategySelector strategySelector,
                             MetricsService metricsService,
                             @Value("${rag.retrieval.top-k:3}") int defaultTopK) {
        this.intentRouter = intentRouter;
        this.actionExtraction = actionExtraction;
        this.handlerRegistry = handlerRegistry;
        this.responseCache = responseCache;
        this.retrievalService = retrievalService;
        this.strategySelector = strategySelector;
        this.metricsService = metricsService;
        this.defaultTopK = defaultTopK;
    }

    public FinalAnswer handleQuery(String text, String userId) {
        return handleQuery(text, userId, null);
    }

    /**
     * @param topK retrieval depth for unmatched queries, {@code rag.retrieval.top-k} when null
     */
    public FinalAnswer handleQuery(String text, String userId, Integer topK) {
        long startTime = System.currentTimeMillis();
        String requestId = UUID.randomUUID().toString();
        Query query = Query.of(text, userId);

        log.info("🔵 Query {} from {}: '{}'", requestId, query.getUserId(), query.getNormalizedText());

        FinalAnswer answer;
        if (query.isBlank()) {
            answer = emptyQueryAnswer();
        } else {
            try {
                answer = process(query, topK != null ? topK : defaultTopK);
            } catch (RuntimeException e) {
                log.error("❌ Unexpected error handling query {}: {}", requestId, e.getMessage(), e);
                answer = FinalAnswer.builder()
                        .answer(ResponseStrategySelector.NO_INFORMATION)
                        .intent(RouteDecision.UNMATCHED)
                        .strategy(ResponseStrategy.UNGROUNDED_GENERATION)
                        .fallbackUsed(true)
                        .data(Collections.emptyMap())
                        .sources(Collections.emptyList())
                        .build();
            }
        }

        long latency = System.currentTimeMillis() - startTime;
        metricsService.recordQuery(requestId, answer.getIntent(), answer.getStrategy(),
                answer.isFallbackUsed(), latency);
        log.info("✅ Query {} answered: intent={}, strategy={}, fallback={}, {}ms", requestId,
                answer.getIntent(), answer.getStrategy(), answer.isFallbackUsed(), latency);
        return answer;
    }

    private FinalAnswer process(Query query, int topK) {
        RouteDecision decision = intentRouter.route(query);

        if (!decision.isMatched() && actionExtraction.isEnabled()) {
            Optional<RouteDecision> detected = actionExtraction.detect(query, handlerRegistry.intents());
            if (detected.isPresent()) {
                decision = detected.get();
            }
        }

        if (decision.isMatched()) {
            HandlerOutcome outcome = invokeHandler(query, decision);
            return strategySelector.respond(query, decision, RetrievalResult.empty(), outcome);
        }

        RetrievalResult retrieval = retrievalService.retrieve(query, topK);
        return strategySelector.respond(query, decision, retrieval, null);
    }

    private HandlerOutcome invokeHandler(Query query, RouteDecision decision) {
        String intent = decision.getIntent();
        Optional<ExternalHandler> handler = handlerRegistry.find(intent);
        if (handler.isEmpty()) {
            log.warn("⚠️  No handler registered for intent {}", intent);
            return HandlerOutcome.unavailable("No handler registered for " + intent);
        }

        try {
            Map<String, Object> result = responseCache.getOrCompute(query.getNormalizedText(),
                    cacheTtlFor(intent), () -> handler.get().execute(decision.getParams()));
            if (result == null || result.isEmpty()) {
                return HandlerOutcome.unavailable("Handler " + intent + " returned no data");
            }
            return HandlerOutcome.success(result);

        } catch (HandlerException e) {
            log.warn("⚠️  Handler {} failed: {}", intent, e.getMessage());
            return HandlerOutcome.unavailable(String.valueOf(e));
        } catch (RuntimeException e) {
            log.error("❌ Handler {} threw unexpectedly: {}", intent, e, e);
            return HandlerOutcome.unavailable(String.valueOf(e));
        }
    }

    // null means the cache default
    private Duration cacheTtlFor(String intent) {
        DetectionRule rule = intentRouter.getRuleTable().findByIntent(intent);
        return rule != null ? rule.getCacheTtl() : null;
    }

    private FinalAnswer emptyQueryAnswer() {
        return FinalAnswer.builder()
                .answer(EMPTY_QUERY_ANSWER)
                .intent(RouteDecision.UNMATCHED)
                .strategy(ResponseStrategy.UNGROUNDED_GENERATION)
                .fallbackUsed(true)
                .data(Collections.emptyMap())
                .sources(Collections.emptyList())
                .build();
    }
}
