package com.machining.kg.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI-compatible embedding endpoint.
 * An empty api key disables embeddings; the index is then built lexical-only.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "machining.embedding")
public class EmbeddingProperties {
    private String apiKey;
    private String baseUrl = "https://api.siliconflow.cn/v1";
    private String model = "BAAI/bge-large-zh-v1.5";
    private int timeoutSeconds = 15;
    private int concurrency = 4;
    private int dimensions = 0; // 0 = accept whatever length the service returns

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
