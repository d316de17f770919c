package com.machining.kg.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machining.kg.config.EmbeddingProperties;
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

import java.util.Map;

import static com.machining.kg.exception.RetrievalServiceUnavailableException.Service.EMBEDDING;

/**
 * Calls an OpenAI-compatible {@code /embeddings} endpoint.
 * Any failure (not configured, timeout, HTTP error, malformed body) is reported as
 * {@link RetrievalServiceUnavailableException} so callers can degrade instead of crash.
 */
@Service
@Slf4j
public class EmbeddingService {

    private final EmbeddingProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public EmbeddingService(EmbeddingProperties properties,
                            @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
                            ObjectMapper objectMapper) {
        this.properties = properties;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return properties.isConfigured();
    }

    /**
     * Generate embedding for text.
     *
     * @param text Text to embed (a retrieval unit or a user question)
     * @return embedding vector
     * @throws RetrievalServiceUnavailableException if the service cannot produce one
     */
    public float[] embed(String text) {
        if (!properties.isConfigured()) {
            throw new RetrievalServiceUnavailableException(EMBEDDING, "Embedding API key not configured");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty text provided for embedding");
        }

        Map<String, Object> request = Map.of(
                "input", text,
                "model", properties.getModel()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(endpoint(), new HttpEntity<>(request, headers), String.class);
        } catch (RestClientException e) {
            log.warn("Embedding call failed: {}", e.getMessage());
            throw new RetrievalServiceUnavailableException(EMBEDDING, "Embedding call failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new RetrievalServiceUnavailableException(EMBEDDING,
                    "Embedding service returned " + response.getStatusCode());
        }

        float[] embedding = parse(response.getBody());
        if (properties.getDimensions() > 0 && embedding.length != properties.getDimensions()) {
            throw new RetrievalServiceUnavailableException(EMBEDDING, String.format(
                    "Expected %d dimensions but got %d", properties.getDimensions(), embedding.length));
        }

        log.debug("Generated embedding for text: {} chars -> {} dimensions", text.length(), embedding.length);
        return embedding;
    }

    private float[] parse(String body) {
        JsonNode embeddingNode;
        try {
            embeddingNode = objectMapper.readTree(body).path("data").path(0).path("embedding");
        } catch (JsonProcessingException e) {
            throw new RetrievalServiceUnavailableException(EMBEDDING, "Malformed embedding response", e);
        }
        if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
            throw new RetrievalServiceUnavailableException(EMBEDDING, "No embedding in response");
        }

        float[] embedding = new float[embeddingNode.size()];
        for (int i = 0; i < embeddingNode.size(); i++) {
            embedding[i] = (float) embeddingNode.get(i).asDouble();
        }
        return embedding;
    }

    private String endpoint() {
        String baseUrl = properties.getBaseUrl();
        return (baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl) + "/embeddings";
    }
}
