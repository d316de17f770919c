package com.machining.kg.resolver.tier;

import com.machining.kg.resolver.ResolutionContext;
import com.machining.kg.resolver.RetrievalEngine;
import com.machining.kg.resolver.RetrievalMode;
import com.machining.kg.resolver.TierAnswer;
import com.machining.kg.service.GenerationService;
import com.machining.kg.service.GraphTraversalService;
import com.machining.kg.service.KnowledgeIndexService;
import com.machining.kg.service.PromptTemplateService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Lexical retrieval + generation, for when the embedding service is down.
 */
@Component
@Order(2)
public class NaiveTier extends RetrievalGenerationTier {

    public NaiveTier(KnowledgeIndexService knowledgeIndexService,
                     RetrievalEngine retrievalEngine,
                     GraphTraversalService graphTraversalService,
                     PromptTemplateService promptTemplateService,
                     GenerationService generationService) {
        super(knowledgeIndexService, retrievalEngine, graphTraversalService, promptTemplateService, generationService);
    }

    @Override
    public int tier() {
        return 2;
    }

    @Override
    public String name() {
        return "naive+generation";
    }

    @Override
    public Optional<String> skipReason(ResolutionContext context) {
        if (context.getRequestedMode() == RetrievalMode.NAIVE) {
            return Optional.of("naive mode already tried");
        }
        if (context.isGenerationUnavailable()) {
            return Optional.of("generation service unavailable");
        }
        if (context.isStoreUnavailable() && knowledgeIndexService.currentIndex().isEmpty()) {
            return Optional.of("graph store unavailable and no index built");
        }
        return Optional.empty();
    }

    @Override
    public TierAnswer answer(ResolutionContext context) {
        return answerWith(RetrievalMode.NAIVE, context);
    }
}
