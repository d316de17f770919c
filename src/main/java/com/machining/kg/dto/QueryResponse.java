package com.machining.kg.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.machining.kg.resolver.QueryState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Answer to a question, annotated with how it was produced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {

    private String question;

    /**
     * Never empty: generated text, a templated graph answer or a fixed message
     */
    private String answer;

    private QueryState state;

    /**
     * Retrieval mode actually used; null when no retrieval tier answered
     */
    private String mode;

    /**
     * 1 = requested mode + generation, 2 = naive + generation, 3 = graph traversal template, 4 = static message
     */
    private int tier;
    private String tierName;
    private boolean degraded;

    @Builder.Default
    private List<CitedUnit> citedUnits = new ArrayList<>();

    @Builder.Default
    private List<GraphFact> graphFacts = new ArrayList<>();

    @Builder.Default
    private List<TierDescent> descents = new ArrayList<>();

    /**
     * Set only for FAILED
     */
    private String error;
}
