package com.machining.kg.resolver.tier;

import com.machining.kg.resolver.ResolutionContext;
import com.machining.kg.resolver.RetrievalEngine;
import com.machining.kg.resolver.TierAnswer;
import com.machining.kg.service.GenerationService;
import com.machining.kg.service.GraphTraversalService;
import com.machining.kg.service.KnowledgeIndexService;
import com.machining.kg.service.PromptTemplateService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(1)
public class RequestedModeTier extends RetrievalGenerationTier {

    public RequestedModeTier(KnowledgeIndexService knowledgeIndexService,
                             RetrievalEngine retrievalEngine,
                             GraphTraversalService graphTraversalService,
                             PromptTemplateService promptTemplateService,
                             GenerationService generationService) {
        super(knowledgeIndexService, retrievalEngine, graphTraversalService, promptTemplateService, generationService);
    }

    @Override
    public int tier() {
        return 1;
    }

    @Override
    public String name() {
        return "retrieval+generation";
    }

    @Override
    public Optional<String> skipReason(ResolutionContext context) {
        return Optional.empty();
    }

    @Override
    public TierAnswer answer(ResolutionContext context) {
        return answerWith(context.getRequestedMode(), context);
    }
}
