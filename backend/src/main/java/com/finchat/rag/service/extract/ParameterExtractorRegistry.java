package com.finchat.rag.service.extract;

import com.finchat.rag.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Name → extractor lookup used when compiling the rule table.
 */
@Component
@Slf4j
public class ParameterExtractorRegistry {

    private final Map<String, ParameterExtractor> extractors = new LinkedHashMap<>();

    public ParameterExtractorRegistry(List<ParameterExtractor> extractors) {
        for (ParameterExtractor extractor : extractors) {
            if (this.extractors.putIfAbsent(extractor.name(), extractor) != null) {
                throw new ConfigurationException("Duplicate parameter extractor name: " + extractor.name());
            }
        }
        log.debug("Registered parameter extractors: {}", this.extractors.keySet());
    }

    public ParameterExtractor get(String name) {
        ParameterExtractor extractor = extractors.get(name);
        if (extractor == null) {
            throw new ConfigurationException("Unknown parameter extractor '" + name + "', known: " + extractors.keySet());
        }
        return extractor;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(extractors.keySet());
    }
}
