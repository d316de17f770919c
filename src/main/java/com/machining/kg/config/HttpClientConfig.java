package com.machining.kg.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * RestTemplate beans for the embedding and generation services.
 * Each gets its own connect/read timeout so a hung service surfaces as unavailable.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder, EmbeddingProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public RestTemplate generationRestTemplate(RestTemplateBuilder builder, GenerationProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
