package com.machining.kg.dto;

import com.machining.kg.graph.node.ProcessNode;
import com.machining.kg.graph.node.ToolNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Process templates and tools suggested for a feature of given dimensions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MachiningRecommendation {

    private String featureName;
    private String surface;
    private String stage;
    private Double length;
    private Double width;
    private Double height;

    @Builder.Default
    private List<ProcessNode> templates = new ArrayList<>();

    @Builder.Default
    private List<ToolNode> tools = new ArrayList<>();

    /** "推荐模板ID：X  推荐加工工艺：Y  推荐刀具ID：Z" */
    private String summary;
}
