package com.machining.kg.service;

import com.machining.kg.dto.MachiningRecommendation;
import com.machining.kg.graph.node.ProcessNode;
import com.machining.kg.graph.node.ToolNode;
import com.machining.kg.graph.store.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rule-based machining recommendation straight from the graph.
 * <p>
 * Templates: processes of the feature, narrowed by surface and stage, ordered by template id.
 * Tools: when the pocket size is known, every tool that fits ({@code diameter <= min(length, width)})
 * and reaches the bottom ({@code stickOutLength > height}), widest first; otherwise the tools
 * recommended for the feature's processes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MachiningAdvisorService {

    static final String NONE = "无";

    private final GraphStore graphStore;

    public MachiningRecommendation recommend(String featureName,
                                             String surface,
                                             String stage,
                                             Double length,
                                             Double width,
                                             Double height) {
        if (featureName == null || featureName.isBlank()) {
            throw new IllegalArgumentException("Feature name is required for a recommendation");
        }

        List<ProcessNode> templates = graphStore.findProcesses(featureName, surface, stage);

        Double diameterLimit = diameterLimit(length, width);
        List<ToolNode> tools;
        if (diameterLimit != null) {
            double reach = height != null ? height : 0.0;
            tools = graphStore.findSuitableTools(diameterLimit, reach);
        } else {
            tools = graphStore.findToolsForFeature(featureName);
        }

        log.info("Recommendation for {} (surface={}, stage={}, limit={}): {} templates, {} tools",
                featureName, surface, stage, diameterLimit, templates.size(), tools.size());

        return MachiningRecommendation.builder()
                .featureName(featureName)
                .surface(surface)
                .stage(stage)
                .length(length)
                .width(width)
                .height(height)
                .templates(templates)
                .tools(tools)
                .summary(summary(templates, tools))
                .build();
    }

    static String summary(List<ProcessNode> templates, List<ToolNode> tools) {
        String templateId = templates.isEmpty() ? NONE : templates.get(0).getTemplateId();
        String processType = templates.isEmpty() || templates.get(0).getProcessType() == null
                ? NONE : templates.get(0).getProcessType();
        String toolId = tools.isEmpty() ? NONE : tools.get(0).getToolId();
        return String.format("推荐模板ID：%s  推荐加工工艺：%s  推荐刀具ID：%s", templateId, processType, toolId);
    }

    private Double diameterLimit(Double length, Double width) {
        if (length != null && width != null) {
            return Math.min(length, width);
        }
        return length != null ? length : width;
    }
}
