package com.finchat.rag.handler;

import com.finchat.rag.exception.HandlerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Delegates an intent to a remote service: POSTs the parameters as JSON, expects a JSON object back.
 * A response carrying an {@code error} field counts as a failure.
 */
@Slf4j
public class HttpExternalHandler implements ExternalHandler {

    private static final ParameterizedTypeReference<Map<String, Object>> RESULT_TYPE =
            new ParameterizedTypeReference<>() {};

    private final String intent;
    private final String endpoint;
    private final WebClient webClient;
    private final Duration timeout;

    public HttpExternalHandler(String intent, String endpoint, WebClient webClient, Duration timeout) {
        this.intent = intent;
        this.endpoint = endpoint;
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public String intent() {
        return intent;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> params) {
        Map<String, Object> result;
        try {
            log.debug("Calling {} handler at {} with {}", intent, endpoint, params);
            result = webClient.post()
                    .uri(endpoint)
                    .bodyValue(params)
                    .retrieve()
                    .bodyToMono(RESULT_TYPE)
                    .timeout(timeout)
                    .block();
        } catch (Exception e) {
            throw new HandlerException("Handler " + intent + " failed: " + e.getMessage(), e);
        }

        if (result == null || result.isEmpty()) {
            throw new HandlerException("Handler " + intent + " returned no data");
        }
        if (result.containsKey("error")) {
            throw new HandlerException("Handler " + intent + " reported: " + result.get("error"));
        }
        return result;
    }
}
