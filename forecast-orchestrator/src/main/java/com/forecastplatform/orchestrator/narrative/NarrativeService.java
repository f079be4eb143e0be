package com.forecastplatform.orchestrator.narrative;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.exception.NarrativeGenerationException;
import com.forecastplatform.common.port.NarrativeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Generates forecast narratives with the Anthropic Messages API.
 *
 * <p><strong>Reactive contract</strong>: fully non-blocking, no {@code .block()}.
 * Failures surface as errors on the returned {@code Mono}; the orchestrator
 * recovers them with a fallback sentence, so this class does not.
 */
@Service
public class NarrativeService implements NarrativeGenerator {

    private static final Logger log = LoggerFactory.getLogger(NarrativeService.class);

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;

    @Value("${narrative.api-key:}")
    private String apiKey;

    @Value("${narrative.model:claude-3-5-sonnet-latest}")
    private String model;

    @Value("${narrative.max-tokens:1000}")
    private int maxTokens;

    @Value("${narrative.timeout-ms:20000}")
    private long timeoutMs;

    public NarrativeService(WebClient.Builder builder,
                            ObjectMapper objectMapper,
                            @Value("${narrative.base-url:https://api.anthropic.com}") String baseUrl) {
        this.anthropicClient = builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<String> generate(String prompt) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new NarrativeGenerationException("No narrative API key configured"));
        }

        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
            )
            .map(this::extractText)
            .doOnNext(text -> log.info("[Narrative] Generated. model={} chars={}", model, text.length()));
    }

    String extractText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new NarrativeGenerationException("Unreadable narrative response", e);
        }
        String text = root.path("content").path(0).path("text").asText("");
        if (text.isBlank()) {
            throw new NarrativeGenerationException("Narrative response contained no text");
        }
        return text.trim();
    }
}
