package com.machining.kg.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI-compatible chat completion endpoint used to phrase answers.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "machining.generation")
public class GenerationProperties {
    private String apiKey;
    private String baseUrl = "https://api.ppinfra.com/v3/openai";
    private String model = "qwen/qwen3-8b-fp8";
    private double temperature = 0.3;
    private int maxTokens = 2000;
    private int timeoutSeconds = 30;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
