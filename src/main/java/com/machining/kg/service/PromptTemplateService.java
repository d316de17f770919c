package com.machining.kg.service;

import com.machining.kg.dto.GraphFact;
import com.machining.kg.index.ScoredUnit;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Renders the system prompt for answer generation from retrieved units and graph facts.
 */
@Service
@Slf4j
public class PromptTemplateService {

    private final ResourceLoader resourceLoader;

    @Value("${machining.generation.prompt:classpath:prompts/answer-system-prompt.txt}")
    private String answerPromptPath;

    private String answerPromptTemplate;

    public PromptTemplateService(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Load prompt template on startup
     */
    @PostConstruct
    public void loadPromptTemplate() {
        try {
            Resource resource = resourceLoader.getResource(answerPromptPath);
            answerPromptTemplate = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            log.info("Loaded answer prompt template from: {}", answerPromptPath);
        } catch (IOException e) {
            log.error("Failed to load answer prompt template: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to load answer prompt template " + answerPromptPath, e);
        }
    }

    public String systemPrompt(List<ScoredUnit> units, List<GraphFact> facts) {
        return answerPromptTemplate.replace("{{CONTEXT}}", context(units, facts));
    }

    /**
     * Numbered knowledge passages followed by graph facts, in retrieval order.
     */
    public String context(List<ScoredUnit> units, List<GraphFact> facts) {
        StringBuilder context = new StringBuilder();
        int n = 1;
        for (ScoredUnit scored : units) {
            context.append('[').append(n++).append("] ").append(scored.getUnit().getText()).append("\n\n");
        }
        if (!facts.isEmpty()) {
            context.append("图谱查询结果:\n");
            for (GraphFact fact : facts) {
                context.append("- ").append(fact.getText()).append('\n');
            }
        }
        return context.toString().trim();
    }
}
