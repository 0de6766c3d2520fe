package com.finchat.rag.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finchat.rag.client.GenerationBackend;
import com.finchat.rag.exception.GenerationUnavailableException;
import com.finchat.rag.model.Query;
import com.finchat.rag.model.RouteDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Second chance for queries no rule matched: asks the generation backend, in JSON mode,
 * whether one of the registered actions fits. Disabled unless {@code rag.routing.llm-actions.enabled}.
 */
@Service
@Slf4j
public class ActionExtractionService {

    private static final String NO_ACTION = "none";

    private final GenerationBackend generationBackend;
    private final PromptBuilderService promptBuilder;
    private final boolean enabled;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ActionExtractionService(GenerationBackend generationBackend,
                                   PromptBuilderService promptBuilder,
                                   @Value("${rag.routing.llm-actions.enabled:false}") boolean enabled) {
        this.generationBackend = generationBackend;
        this.promptBuilder = promptBuilder;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * A Direct decision for one of {@code actions}, or empty when detection is off, fails,
     * or the model names nothing usable.
     */
    public Optional<RouteDecision> detect(Query query, Collection<String> actions) {
        if (!enabled || actions.isEmpty() || query.isBlank()) {
            return Optional.empty();
        }

        String raw;
        try {
            raw = generationBackend.generate(promptBuilder.buildActionPrompt(query, actions));
        } catch (GenerationUnavailableException e) {
            log.warn("⚠️  Action detection skipped: {}", e.getMessage());
            return Optional.empty();
        }

        return parse(raw, actions);
    }

    Optional<RouteDecision> parse(String raw, Collection<String> actions) {
        String json = extractJsonObject(raw);
        if (json == null) {
            log.debug("No JSON object in action response: {}", raw);
            return Optional.empty();
        }

        try {
            JsonNode root = objectMapper.readTree(json);
            String action = root.path("action").asText("").trim();
            if (action.isEmpty() || NO_ACTION.equalsIgnoreCase(action) || !actions.contains(action)) {
                log.debug("Action '{}' not usable", action);
                return Optional.empty();
            }

            Map<String, Object> params = new LinkedHashMap<>();
            JsonNode parameters = root.path("parameters");
            if (parameters.isObject()) {
                params.putAll(objectMapper.convertValue(parameters, new TypeReference<Map<String, Object>>() {}));
            }

            log.info("✅ Action detected by model: {} {}", action, params);
            return Optional.of(RouteDecision.fromLlm(action, params));

        } catch (JsonProcessingException e) {
            log.warn("⚠️  Could not parse action response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * The outermost {...} span, which also strips markdown code fences around the object.
     */
    static String extractJsonObject(String raw) {
        if (raw == null) {
            return null;
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return raw.substring(start, end + 1);
    }
}
