package com.machining.kg.resolver.tier;

import com.machining.kg.dto.GraphFact;
import com.machining.kg.exception.ResolutionFailureException;
import com.machining.kg.exception.RetrievalServiceUnavailableException;
import com.machining.kg.exception.StoreUnavailableException;
import com.machining.kg.index.KnowledgeIndex;
import com.machining.kg.index.ScoredUnit;
import com.machining.kg.resolver.AnswerTier;
import com.machining.kg.resolver.QueryState;
import com.machining.kg.resolver.ResolutionContext;
import com.machining.kg.resolver.RetrievalEngine;
import com.machining.kg.resolver.RetrievalMode;
import com.machining.kg.resolver.TierAnswer;
import com.machining.kg.service.GenerationService;
import com.machining.kg.service.GraphTraversalService;
import com.machining.kg.service.KnowledgeIndexService;
import com.machining.kg.service.PromptTemplateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

import static com.machining.kg.exception.RetrievalServiceUnavailableException.Service.GENERATION;

/**
 * Index retrieval plus graph facts as context, answered by the generation service.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class RetrievalGenerationTier implements AnswerTier {

    protected final KnowledgeIndexService knowledgeIndexService;
    protected final RetrievalEngine retrievalEngine;
    protected final GraphTraversalService graphTraversalService;
    protected final PromptTemplateService promptTemplateService;
    protected final GenerationService generationService;

    protected TierAnswer answerWith(RetrievalMode mode, ResolutionContext context) {
        context.selectMode(mode);

        KnowledgeIndex index = knowledgeIndexService.ensureIndex();
        List<ScoredUnit> units = retrievalEngine.retrieve(index, context.getQuestion(), mode);
        List<GraphFact> facts = graphFacts(context);
        if (units.isEmpty() && facts.isEmpty()) {
            throw new ResolutionFailureException("No indexed unit or graph fact matches the question");
        }
        context.transition(QueryState.CONTEXT_ASSEMBLED);
        log.debug("Assembled {} units and {} graph facts in {} mode", units.size(), facts.size(), mode.value());

        String systemPrompt = promptTemplateService.systemPrompt(units, facts);
        context.checkCancelled();
        String answer = generationService.generate(systemPrompt, context.getQuestion());
        if (answer == null || answer.isBlank()) {
            throw new RetrievalServiceUnavailableException(GENERATION, "Generation service returned an empty answer");
        }
        return TierAnswer.builder()
                .answer(answer.trim())
                .state(QueryState.ANSWERED)
                .mode(mode)
                .units(units)
                .facts(facts)
                .build();
    }

    /**
     * Graph facts are optional context here: a lost store leaves them out.
     */
    private List<GraphFact> graphFacts(ResolutionContext context) {
        if (context.hasFacts()) {
            return context.getFacts();
        }
        try {
            context.rememberFacts(graphTraversalService.factsFor(context.getQuestion()));
            return context.getFacts();
        } catch (StoreUnavailableException e) {
            context.markStoreUnavailable();
            log.warn("Graph facts unavailable, continuing with index context only: {}", e.getMessage());
            return List.of();
        }
    }
}
