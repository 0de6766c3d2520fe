package com.finchat.rag.handler;

import com.finchat.rag.config.HandlerProperties;
import com.finchat.rag.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Intent → handler lookup. Handlers come from Spring beans and from configured HTTP endpoints;
 * registering two handlers for one intent is a startup error.
 */
@Component
@Slf4j
public class HandlerRegistry {

    private final Map<String, ExternalHandler> handlers = new LinkedHashMap<>();

    @Autowired
    public HandlerRegistry(ObjectProvider<ExternalHandler> handlerBeans, HandlerProperties properties) {
        this(collect(handlerBeans.orderedStream().collect(Collectors.toList()), properties));
    }

    public HandlerRegistry(List<ExternalHandler> handlers) {
        for (ExternalHandler handler : handlers) {
            if (this.handlers.putIfAbsent(handler.intent(), handler) != null) {
                throw new ConfigurationException("More than one handler registered for intent " + handler.intent());
            }
        }
        log.info("✅ Registered handlers for intents: {}", this.handlers.keySet());
    }

    public Optional<ExternalHandler> find(String intent) {
        return Optional.ofNullable(handlers.get(intent));
    }

    public Set<String> intents() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    private static List<ExternalHandler> collect(List<ExternalHandler> beans, HandlerProperties properties) {
        List<ExternalHandler> all = new ArrayList<>(beans);
        if (properties.getEndpoints().isEmpty()) {
            return all;
        }

        WebClient webClient = WebClient.builder().build();
        Duration timeout = Duration.ofMillis(properties.getTimeoutMs());
        properties.getEndpoints().forEach((intent, url) -> {
            if (url == null || url.isBlank()) {
                throw new ConfigurationException("Empty endpoint for handler intent " + intent);
            }
            all.add(new HttpExternalHandler(intent, url, webClient, timeout));
        });
        return all;
    }
}
