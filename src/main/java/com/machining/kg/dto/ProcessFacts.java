package com.machining.kg.dto;

import com.machining.kg.graph.node.ToolNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A Process with everything it links to, flattened for indexing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessFacts {

    private String processKey;
    private String templateId;
    private String featureId;
    private String componentSurface;
    private String featureSurface;
    private String surfaceType;
    private Boolean sidewallFeature;
    private Double allowance;

    private String featureName;
    private String featureCategory;
    private String stage;
    private String processType;

    /**
     * Tools recommended for this process, ordered by tool id
     */
    @Builder.Default
    private List<ToolNode> tools = new ArrayList<>();
}
