package com.finchat.rag.controller;

import com.finchat.rag.model.AskRequest;
import com.finchat.rag.model.FinalAnswer;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.RetrievalResult;
import com.finchat.rag.model.RouteDecision;
import com.finchat.rag.service.CorpusIndex;
import com.finchat.rag.service.CorpusIndexService;
import com.finchat.rag.service.IntentRouter;
import com.finchat.rag.service.QueryOrchestrator;
import com.finchat.rag.service.RetrievalService;
import jakarta.validation.Valid;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/rag")
@CrossOrigin(origins = "*")
@Slf4j
public class RagController {

    private final QueryOrchestrator orchestrator;
    private final IntentRouter intentRouter;
    private final RetrievalService retrievalService;
    private final CorpusIndexService corpusIndexService;
    private final int defaultTopK;

    public RagController(QueryOrchestrator orchestrator,
                         IntentRouter intentRouter,
                         RetrievalService retrievalService,
                         CorpusIndexService corpusIndexService,
                         @Value("${rag.retrieval.top-k:3}") int defaultTopK) {
        this.orchestrator = orchestrator;
        this.intentRouter = intentRouter;
        this.retrievalService = retrievalService;
        this.corpusIndexService = corpusIndexService;
        this.defaultTopK = defaultTopK;
    }

    /**
     * Main endpoint: route, answer through handler or knowledge base, always returns an answer.
     */
    @PostMapping("/ask")
    public ResponseEntity<FinalAnswer> ask(@Valid @RequestBody AskRequest request) {
        log.info("🔵 /rag/ask: '{}'", request.getQuestion());
        return ResponseEntity.ok(orchestrator.handleQuery(
                request.getQuestion(), request.getUserId(), request.getTopK()));
    }

    /**
     * Diagnostic: which rule (if any) a question matches and what parameters it extracts.
     */
    @PostMapping("/route")
    public ResponseEntity<RouteDecision> route(@Valid @RequestBody AskRequest request) {
        return ResponseEntity.ok(intentRouter.route(Query.of(request.getQuestion(), request.getUserId())));
    }

    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody AskRequest request) {
        int topK = request.getTopK() != null ? request.getTopK() : defaultTopK;
        RetrievalResult result = retrievalService.retrieve(Query.of(request.getQuestion(), request.getUserId()), topK);

        SearchResponse response = new SearchResponse();
        response.setMode(result.getMode().name());
        response.setMatches(result.getMatches().stream()
                .map(match -> {
                    SearchHit hit = new SearchHit();
                    hit.setDocumentId(match.getChunk().getDocumentId());
                    hit.setSequenceIndex(match.getChunk().getSequenceIndex());
                    hit.setScore(match.getScore());
                    hit.setText(match.getChunk().getText());
                    return hit;
                })
                .collect(Collectors.toList()));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/index/rebuild")
    public ResponseEntity<Map<String, Object>> rebuildIndex() {
        log.info("🔵 /rag/index/rebuild requested");
        CorpusIndex index = corpusIndexService.rebuild();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "REBUILT");
        body.put("chunks", index.size());
        body.put("semantic", index.hasEmbeddings());
        body.put("dimension", index.dimension());
        return ResponseEntity.ok(body);
    }

    // Data classes

    @Data
    public static class SearchResponse {
        private String mode;
        private List<SearchHit> matches;
    }

    @Data
    public static class SearchHit {
        private String documentId;
        private int sequenceIndex;
        private double score;
        private String text;
    }
}
