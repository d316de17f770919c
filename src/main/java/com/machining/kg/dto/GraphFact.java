package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a direct graph traversal, cited alongside retrieved units.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphFact {

    public enum Kind {
        FEATURE_CATALOG,
        TOOLS_BY_DIAMETER,
        TOOLS_FOR_FEATURE,
        PROCESSES_FOR_FEATURE,
        MACHINING_RECOMMENDATION,
        TOOL_DETAILS
    }

    private Kind kind;

    /** What was looked up, e.g. the feature name or "10mm" */
    private String subject;

    /** Feature names, tool ids or template ids, in graph order */
    @Builder.Default
    private List<String> items = new ArrayList<>();

    /** Human-readable rendering used both as prompt context and in templated answers */
    private String text;
}
