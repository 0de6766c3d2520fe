package com.finchat.rag.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finchat.rag.exception.ConfigurationException;
import com.finchat.rag.model.AnswerTemplate;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads per-intent answer templates from answer-templates.json at startup.
 * Intents without a template still get the generic field listing.
 */
@Component
@Slf4j
@Getter
public class AnswerTemplateConfigLoader {

    private final String templatesResource;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private Map<String, AnswerTemplate> templateMap = new HashMap<>();

    public AnswerTemplateConfigLoader(
            @Value("${rag.answers.templates-resource:/answer-templates.json}") String templatesResource) {
        this.templatesResource = templatesResource;
    }

    @PostConstruct
    public void load() {
        try (InputStream is = getClass().getResourceAsStream(templatesResource)) {
            if (is == null) {
                log.warn("⚠️  {} not found in classpath resources, using generic answer templates", templatesResource);
                return;
            }

            List<AnswerTemplate> templates = objectMapper.readValue(is, new TypeReference<List<AnswerTemplate>>() {});

            Map<String, AnswerTemplate> loaded = new HashMap<>();
            for (AnswerTemplate template : templates) {
                if (template.getIntentName() == null || template.getIntentName().isBlank()) {
                    throw new ConfigurationException("Answer template without intent_name in " + templatesResource);
                }
                loaded.put(template.getIntentName(), template);
            }
            templateMap = loaded;

            log.info("✅ Loaded {} answer templates from {}", templateMap.size(), templatesResource);

        } catch (IOException e) {
            throw new ConfigurationException("Error loading " + templatesResource + ": " + e.getMessage(), e);
        }
    }

    public AnswerTemplate getTemplate(String intent) {
        return templateMap.get(intent);
    }
}
