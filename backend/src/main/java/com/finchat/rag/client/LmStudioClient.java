package com.finchat.rag.client;

import com.finchat.rag.exception.EmbeddingUnavailableException;
import com.finchat.rag.exception.GenerationUnavailableException;
import com.finchat.rag.model.ChatCompletionRequest;
import com.finchat.rag.model.ChatCompletionResponse;
import com.finchat.rag.model.EmbedRequest;
import com.finchat.rag.model.EmbedResponse;
import com.finchat.rag.model.GenerationRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for an OpenAI-compatible local model server (LM Studio by default).
 * Serves both the embedding and the generation capability.
 */
@Component
@Slf4j
public class LmStudioClient implements EmbeddingBackend, GenerationBackend {

    private final WebClient webClient;

    @Value("${llm.base-url:http://127.0.0.1:1234/v1}")
    private String baseUrl;

    @Value("${llm.api-key:lm-studio}")
    private String apiKey;

    @Value("${llm.chat-model:local-model}")
    private String chatModel;

    @Value("${llm.embedding-model:text-embedding-all-minilm-l6-v2}")
    private String embeddingModel;

    @Value("${llm.timeout-ms:60000}")
    private long timeout;

    @Value("${llm.embed-timeout-ms:10000}")
    private long embedTimeout;

    @Value("${llm.max-retries:1}")
    private int maxRetries;

    @Value("${llm.temperature-json:0.3}")
    private double jsonTemperature;

    @Value("${llm.temperature-chat:0.4}")
    private double chatTemperature;

    @Value("${llm.max-context-chars:800}")
    private int maxContextChars;

    public LmStudioClient() {
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }

    @Override
    public double[] embed(String text) {
        try {
            log.debug("Generating embedding for text: {}", text.substring(0, Math.min(50, text.length())));

            EmbedResponse response = webClient.post()
                    .uri(baseUrl + "/embeddings")
                    .header("Authorization", "Bearer " + apiKey)
                    .bodyValue(new EmbedRequest(embeddingModel, text))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .timeout(Duration.ofMillis(embedTimeout))
                    .block();

            if (response == null || response.getData() == null || response.getData().isEmpty()
                    || response.getData().get(0).getEmbedding() == null) {
                throw new EmbeddingUnavailableException("Embedding backend returned no vector");
            }

            List<Double> values = response.getData().get(0).getEmbedding();
            double[] vector = new double[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i);
            }
            log.debug("Generated embedding with {} dimensions", vector.length);
            return vector;

        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Error generating embedding: {}", e.getMessage());
            throw new EmbeddingUnavailableException("Failed to generate embedding: " + e.getMessage(), e);
        }
    }

    @Override
    public String generate(GenerationRequest request) {
        ChatCompletionRequest body = toChatRequest(request);

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    log.warn("Retry attempt {} for generation", attempt);
                }

                ChatCompletionResponse response = webClient.post()
                        .uri(baseUrl + "/chat/completions")
                        .header("Authorization", "Bearer " + apiKey)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(ChatCompletionResponse.class)
                        .timeout(Duration.ofMillis(timeout))
                        .block();

                String text = response != null ? response.firstContent() : null;
                if (text == null || text.trim().isEmpty()) {
                    if (attempt < maxRetries) {
                        log.warn("Empty completion on attempt {}, retrying...", attempt + 1);
                        continue;
                    }
                    throw new GenerationUnavailableException(
                            "Empty completion after " + (attempt + 1) + " attempts");
                }

                log.debug("LLM response: {} chars (jsonMode={})", text.length(), request.isJsonMode());
                return text.trim();

            } catch (GenerationUnavailableException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Generation failed (attempt {}): {}", attempt + 1, e.getMessage());
                if (attempt < maxRetries) {
                    try {
                        Thread.sleep(500L * (attempt + 1));
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new GenerationUnavailableException("Interrupted while retrying generation", ie);
                    }
                    continue;
                }
                throw new GenerationUnavailableException(
                        "Generation failed after " + (attempt + 1) + " attempts: " + e.getMessage(), e);
            }
        }

        throw new GenerationUnavailableException("Generation failed after all retries");
    }

    private ChatCompletionRequest toChatRequest(GenerationRequest request) {
        StringBuilder content = new StringBuilder();
        String context = request.getContext();
        if (context != null && !context.isBlank()) {
            content.append("Context: ")
                    .append(context, 0, Math.min(context.length(), maxContextChars))
                    .append("\n\n");
        }
        content.append(request.getPrompt());

        double temperature = request.getTemperature() != null
                ? request.getTemperature()
                : (request.isJsonMode() ? jsonTemperature : chatTemperature);

        return ChatCompletionRequest.builder()
                .model(chatModel)
                .messages(List.of(new ChatCompletionRequest.Message("user", content.toString())))
                .temperature(temperature)
                .maxTokens(request.getMaxTokens())
                .responseFormat(request.isJsonMode() ? Map.of("type", "json_object") : null)
                .build();
    }

    public boolean checkHealth() {
        try {
            String response = webClient.get()
                    .uri(baseUrl + "/models")
                    .header("Authorization", "Bearer " + apiKey)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(5))
                    .block();
            return response != null && response.contains("data");
        } catch (Exception e) {
            log.warn("LLM health check failed: {}", e.getMessage());
            return false;
        }
    }
}
