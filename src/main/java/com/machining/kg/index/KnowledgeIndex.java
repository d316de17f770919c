package com.machining.kg.index;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Hybrid retrieval index over the process units.
 * <p>
 * All maps are sorted by key, so the lexical part serialises identically whenever it is
 * built from the same units. Units missing from {@link #embeddings} are lexical-only.
 * Instances are immutable once built and safe to share between queries.
 */
@Data
@NoArgsConstructor
public class KnowledgeIndex {

    private static final double BM25_K1 = 1.2;
    private static final double BM25_B = 0.75;

    private SortedMap<String, RetrievalUnit> units = new TreeMap<>();

    /** token -> (unit id -> term frequency) */
    private SortedMap<String, SortedMap<String, Integer>> postings = new TreeMap<>();

    /** unit id -> number of tokens */
    private SortedMap<String, Integer> unitLengths = new TreeMap<>();

    /** lower-cased entity name (feature, stage, type, surface, template id, tool id) -> unit ids */
    private SortedMap<String, SortedSet<String>> entities = new TreeMap<>();

    private SortedMap<String, float[]> embeddings = new TreeMap<>();

    private String embeddingModel;
    private String lexicalDigest;
    private String contentFingerprint;
    private Instant builtAt;

    public int size() {
        return units.size();
    }

    @JsonIgnore
    public int getEmbeddedCount() {
        return embeddings.size();
    }

    @JsonIgnore
    public boolean hasEmbeddings() {
        return !embeddings.isEmpty();
    }

    public boolean isLexicalOnly(String unitId) {
        return !embeddings.containsKey(unitId);
    }

    /**
     * BM25 score of every unit sharing at least one token with the query.
     */
    public Map<String, Double> lexicalScores(List<String> queryTokens) {
        Map<String, Double> scores = new HashMap<>();
        if (units.isEmpty()) {
            return scores;
        }
        double averageLength = unitLengths.values().stream().mapToInt(Integer::intValue).average().orElse(1.0);
        int unitCount = units.size();

        for (String token : new LinkedHashSet<>(queryTokens)) {
            SortedMap<String, Integer> posting = postings.get(token);
            if (posting == null) {
                continue;
            }
            int documentFrequency = posting.size();
            double idf = Math.log(1.0 + (unitCount - documentFrequency + 0.5) / (documentFrequency + 0.5));
            for (Map.Entry<String, Integer> entry : posting.entrySet()) {
                int tf = entry.getValue();
                double length = unitLengths.getOrDefault(entry.getKey(), 0);
                double termScore = idf * (tf * (BM25_K1 + 1))
                        / (tf + BM25_K1 * (1 - BM25_B + BM25_B * length / averageLength));
                scores.merge(entry.getKey(), termScore, Double::sum);
            }
        }
        return scores;
    }

    /**
     * Cosine similarity between a unit's embedding and the query vector, or null when
     * the unit is lexical-only or the dimensions differ.
     */
    public Double similarity(String unitId, float[] query) {
        float[] vector = embeddings.get(unitId);
        if (vector == null || query == null || vector.length != query.length) {
            return null;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < vector.length; i++) {
            dot += vector[i] * query[i];
            normA += vector[i] * vector[i];
            normB += query[i] * query[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Units linked to any entity whose name occurs in the question.
     */
    public Set<String> unitsMentionedIn(String question) {
        Set<String> linked = new TreeSet<>();
        if (question == null) {
            return linked;
        }
        String lower = question.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, SortedSet<String>> entry : entities.entrySet()) {
            if (lower.contains(entry.getKey())) {
                linked.addAll(entry.getValue());
            }
        }
        return linked;
    }

    public List<RetrievalUnit> unitsInOrder() {
        return new ArrayList<>(units.values());
    }
}
