package com.machining.kg.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI machiningKnowledgeGraphOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080");
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Machining Knowledge Graph API")
                .version("1.0.0")
                .description("Loads machining process templates and cutting tools into a Neo4j knowledge graph " +
                        "and answers questions about them with graph-backed retrieval and a tiered fallback.");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
