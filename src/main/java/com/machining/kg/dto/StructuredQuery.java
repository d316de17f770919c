package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Entities and dimensions recognised in a question.
 * Dimensions are millimetres; null when not mentioned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuredQuery {

    private String featureName;
    private String toolId;
    private String stage;
    private String surface;

    private Double diameter;
    private Double length;
    private Double width;
    private Double height;

    private boolean toolQuestion;

    @Builder.Default
    private Set<GraphFact.Kind> intents = EnumSet.noneOf(GraphFact.Kind.class);

    public boolean isStructured() {
        return !intents.isEmpty();
    }
}
