package com.machining.kg.resolver.tier;

import com.machining.kg.dto.GraphFact;
import com.machining.kg.exception.ResolutionFailureException;
import com.machining.kg.index.KnowledgeIndex;
import com.machining.kg.index.ScoredUnit;
import com.machining.kg.resolver.AnswerTier;
import com.machining.kg.resolver.QueryState;
import com.machining.kg.resolver.ResolutionContext;
import com.machining.kg.resolver.RetrievalEngine;
import com.machining.kg.resolver.RetrievalMode;
import com.machining.kg.resolver.TierAnswer;
import com.machining.kg.service.GraphTraversalService;
import com.machining.kg.service.KnowledgeIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Templated answer without the generation service.
 * <p>
 * Structured questions are answered from graph traversal facts. Other questions get the
 * best lexical matches from an index that already exists; this tier never builds one.
 */
@Component
@Order(3)
@Slf4j
@RequiredArgsConstructor
public class GraphTraversalTier implements AnswerTier {

    private final GraphTraversalService graphTraversalService;
    private final KnowledgeIndexService knowledgeIndexService;
    private final RetrievalEngine retrievalEngine;

    @Override
    public int tier() {
        return 3;
    }

    @Override
    public String name() {
        return "graph-traversal";
    }

    @Override
    public Optional<String> skipReason(ResolutionContext context) {
        if (context.isStoreUnavailable() && knowledgeIndexService.currentIndex().isEmpty()) {
            return Optional.of("graph store unavailable and no index built");
        }
        return Optional.empty();
    }

    @Override
    public TierAnswer answer(ResolutionContext context) {
        context.selectMode(null);

        List<GraphFact> facts = context.isStoreUnavailable() && !context.hasFacts()
                ? List.of()
                : traverse(context);
        if (!facts.isEmpty()) {
            context.transition(QueryState.CONTEXT_ASSEMBLED);
            return TierAnswer.builder()
                    .answer(renderFacts(facts))
                    .state(QueryState.ANSWERED)
                    .facts(facts)
                    .build();
        }

        Optional<KnowledgeIndex> index = knowledgeIndexService.currentIndex();
        if (index.isPresent()) {
            List<ScoredUnit> units = retrievalEngine.retrieve(index.get(), context.getQuestion(), RetrievalMode.NAIVE);
            if (!units.isEmpty()) {
                context.transition(QueryState.CONTEXT_ASSEMBLED);
                return TierAnswer.builder()
                        .answer(renderUnits(units))
                        .state(QueryState.ANSWERED)
                        .mode(RetrievalMode.NAIVE)
                        .units(units)
                        .build();
            }
        }
        throw new ResolutionFailureException("Question names no known entity and matches no indexed unit");
    }

    private List<GraphFact> traverse(ResolutionContext context) {
        if (!context.hasFacts()) {
            context.rememberFacts(graphTraversalService.factsFor(context.getQuestion()));
        }
        return context.getFacts();
    }

    static String renderFacts(List<GraphFact> facts) {
        StringBuilder answer = new StringBuilder("根据知识图谱：\n");
        for (GraphFact fact : facts) {
            answer.append(fact.getText()).append('\n');
        }
        return answer.toString().trim();
    }

    static String renderUnits(List<ScoredUnit> units) {
        StringBuilder answer = new StringBuilder("根据知识库检索结果：\n");
        int n = 1;
        for (ScoredUnit scored : units) {
            answer.append('[').append(n++).append("] ")
                    .append(scored.getUnit().getText().replace('\n', '；'))
                    .append('\n');
        }
        return answer.toString().trim();
    }
}
