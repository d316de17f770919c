package com.machining.kg.resolver;

import com.machining.kg.config.RetrievalProperties;
import com.machining.kg.exception.RetrievalServiceUnavailableException;
import com.machining.kg.index.KnowledgeIndex;
import com.machining.kg.index.RetrievalUnit;
import com.machining.kg.index.ScoredUnit;
import com.machining.kg.index.TextTokenizer;
import com.machining.kg.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.machining.kg.exception.RetrievalServiceUnavailableException.Service.EMBEDDING;

/**
 * Selects the top-k retrieval units for a question in one of the four retrieval modes.
 * <p>
 * Ranking is total: score descending, then lexical score descending, then unit id ascending.
 * Units without an embedding are scored lexically in every mode.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RetrievalEngine {

    static final Comparator<ScoredUnit> RANKING = Comparator
            .comparingDouble(ScoredUnit::getScore).reversed()
            .thenComparing(Comparator.comparingDouble(ScoredUnit::getLexicalScore).reversed())
            .thenComparing(scored -> scored.getUnit().getUnitId());

    private final EmbeddingService embeddingService;
    private final RetrievalProperties retrievalProperties;

    /**
     * @throws RetrievalServiceUnavailableException when the mode needs an embedding and none can be had
     */
    public List<ScoredUnit> retrieve(KnowledgeIndex index, String question, RetrievalMode mode) {
        Map<String, Double> lexical = normalisedLexicalScores(index, question);
        Set<String> linked = index.unitsMentionedIn(question);

        float[] queryVector = null;
        if (mode.requiresEmbedding()) {
            if (!index.hasEmbeddings()) {
                throw new RetrievalServiceUnavailableException(EMBEDDING,
                        "Index has no embeddings, " + mode.value() + " retrieval needs them");
            }
            queryVector = embeddingService.embed(question);
        }

        Set<String> candidates = new TreeSet<>();
        switch (mode) {
            case NAIVE:
                candidates.addAll(lexical.keySet());
                break;
            case LOCAL:
                candidates.addAll(linked);
                break;
            case GLOBAL:
                candidates.addAll(index.getUnits().keySet());
                break;
            case HYBRID:
                candidates.addAll(linked);
                candidates.addAll(index.getUnits().keySet());
                break;
            default:
                throw new IllegalStateException("Unhandled retrieval mode " + mode);
        }

        List<ScoredUnit> scored = new ArrayList<>();
        for (String unitId : candidates) {
            ScoredUnit unit = score(index, unitId, mode, queryVector, lexical, linked);
            if (unit != null) {
                scored.add(unit);
            }
        }
        scored.sort(RANKING);

        List<ScoredUnit> top = scored.size() > retrievalProperties.getTopK()
                ? new ArrayList<>(scored.subList(0, retrievalProperties.getTopK()))
                : scored;
        log.debug("{} retrieval: {} candidates, returning {}", mode.value(), scored.size(), top.size());
        return top;
    }

    /**
     * @return the scored unit, or null when it does not qualify as a candidate for the mode
     */
    private ScoredUnit score(KnowledgeIndex index,
                             String unitId,
                             RetrievalMode mode,
                             float[] queryVector,
                             Map<String, Double> lexical,
                             Set<String> linked) {
        RetrievalUnit unit = index.getUnits().get(unitId);
        double lexicalScore = lexical.getOrDefault(unitId, 0.0);
        boolean entityLinked = linked.contains(unitId);
        boolean lexicalOnly = index.isLexicalOnly(unitId);
        Double similarity = queryVector == null ? null : index.similarity(unitId, queryVector);
        double semanticScore = similarity == null ? 0.0 : similarity;

        double score;
        switch (mode) {
            case NAIVE:
                score = lexicalScore;
                break;
            case LOCAL:
                score = similarity != null ? semanticScore : lexicalScore;
                break;
            case GLOBAL:
                if (similarity != null && semanticScore < retrievalProperties.getMinSimilarity()) {
                    return null;
                }
                score = similarity != null ? semanticScore : lexicalScore;
                break;
            case HYBRID:
                boolean semanticCandidate = similarity != null && semanticScore >= retrievalProperties.getMinSimilarity();
                if (!entityLinked && !semanticCandidate && lexicalScore <= 0) {
                    return null;
                }
                score = retrievalProperties.getLexicalWeight() * lexicalScore
                        + retrievalProperties.getSemanticWeight() * (semanticCandidate ? semanticScore : 0.0)
                        + (entityLinked ? retrievalProperties.getEntityWeight() : 0.0);
                break;
            default:
                throw new IllegalStateException("Unhandled retrieval mode " + mode);
        }
        if (score <= 0) {
            return null;
        }
        return ScoredUnit.builder()
                .unit(unit)
                .lexicalScore(lexicalScore)
                .semanticScore(semanticScore)
                .entityLinked(entityLinked)
                .lexicalOnly(lexicalOnly)
                .score(score)
                .build();
    }

    /**
     * BM25 scores divided by the best one, so every score falls in (0, 1].
     */
    private Map<String, Double> normalisedLexicalScores(KnowledgeIndex index, String question) {
        Map<String, Double> scores = index.lexicalScores(TextTokenizer.tokenize(question));
        double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        if (max > 0) {
            scores.replaceAll((unitId, score) -> score / max);
        }
        scores.values().removeIf(score -> score <= 0);
        return scores;
    }
}
