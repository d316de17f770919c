package com.machining.kg.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machining.kg.config.GenerationProperties;
import com.machining.kg.exception.RetrievalServiceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static com.machining.kg.exception.RetrievalServiceUnavailableException.Service.GENERATION;

/**
 * LLM service for answering questions from retrieved graph context.
 * Calls an OpenAI-compatible {@code /chat/completions} endpoint and returns the first
 * choice's content verbatim.
 */
@Service
@Slf4j
public class GenerationService {

    private final GenerationProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public GenerationService(GenerationProperties properties,
                             @Qualifier("generationRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Single-turn completion.
     *
     * @param systemPrompt System instructions including the retrieved context
     * @param userMessage The user's question
     * @return generated answer text
     * @throws RetrievalServiceUnavailableException if the service fails, times out or returns nothing
     */
    public String generate(String systemPrompt, String userMessage) {
        if (!properties.isConfigured()) {
            throw new RetrievalServiceUnavailableException(GENERATION, "Generation API key not configured");
        }

        log.info("Calling generation model {} ({} chars of context)", properties.getModel(), systemPrompt.length());
        log.debug("User message: {}", userMessage.length() > 200 ? userMessage.substring(0, 200) + "..." : userMessage);

        List<Map<String, String>> messages = List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userMessage));

        Map<String, Object> requestBody = Map.of(
                "model", properties.getModel(),
                "messages", messages,
                "temperature", properties.getTemperature(),
                "max_tokens", properties.getMaxTokens()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(endpoint(), new HttpEntity<>(requestBody, headers), String.class);
        } catch (RestClientException e) {
            log.warn("Generation call failed: {}", e.getMessage());
            throw new RetrievalServiceUnavailableException(GENERATION, "Generation call failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            log.error("Generation API error: status={}, body={}", response.getStatusCode(), response.getBody());
            throw new RetrievalServiceUnavailableException(GENERATION,
                    "Generation service returned " + response.getStatusCode());
        }

        String content = extractContent(response.getBody());
        log.info("Generation response received: {} chars", content.length());
        log.debug("Generation response: {}", content.length() > 500 ? content.substring(0, 500) + "..." : content);
        return content;
    }

    private String extractContent(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RetrievalServiceUnavailableException(GENERATION, "Malformed generation response", e);
        }

        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new RetrievalServiceUnavailableException(GENERATION, "No choices in generation response");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new RetrievalServiceUnavailableException(GENERATION, "No content in generation response");
        }
        return content.asText();
    }

    private String endpoint() {
        String baseUrl = properties.getBaseUrl();
        return (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl) + "/chat/completions";
    }
}
