package com.machining.kg.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A retrieval candidate with its component scores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredUnit {

    private RetrievalUnit unit;

    /** BM25 divided by the best BM25 among the candidates, 0..1 */
    private double lexicalScore;

    /** Cosine similarity to the question embedding, 0 for lexical-only units */
    private double semanticScore;

    /** True when the unit is linked to an entity named in the question */
    private boolean entityLinked;

    /** True when the unit has no embedding and was found lexically */
    private boolean lexicalOnly;

    private double score;
}
