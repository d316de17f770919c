package com.machining.kg.service;

import com.machining.kg.config.RetrievalProperties;
import com.machining.kg.dto.GraphFact;
import com.machining.kg.dto.MachiningRecommendation;
import com.machining.kg.dto.StructuredQuery;
import com.machining.kg.graph.node.FeatureNode;
import com.machining.kg.graph.node.ProcessNode;
import com.machining.kg.graph.node.ToolNode;
import com.machining.kg.graph.store.GraphStore;
import com.machining.kg.schema.FeatureCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Answers structured questions by walking the graph directly, without the index.
 * Each recognised intent becomes one {@link GraphFact}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphTraversalService {

    private final GraphStore graphStore;
    private final QuestionInterpreter questionInterpreter;
    private final MachiningAdvisorService machiningAdvisorService;
    private final RetrievalProperties retrievalProperties;

    /**
     * Interpret the question against the entity names currently in the graph.
     */
    public StructuredQuery interpret(String question) {
        List<String> featureNames = graphStore.findFeatures().stream().map(FeatureNode::getName).toList();
        List<String> toolIds = graphStore.findTools().stream().map(ToolNode::getToolId).toList();
        QuestionInterpreter.Vocabulary vocabulary =
                new QuestionInterpreter.Vocabulary(featureNames, graphStore.findStageNames(), toolIds);
        return questionInterpreter.interpret(question, vocabulary);
    }

    /**
     * Graph facts for a question; empty when it names no known entity.
     */
    public List<GraphFact> factsFor(String question) {
        StructuredQuery query = interpret(question);
        if (!query.isStructured()) {
            return List.of();
        }
        List<GraphFact> facts = traverse(query);
        log.info("Structured question {} resolved to {} graph facts", query.getIntents(), facts.size());
        return facts;
    }

    public List<GraphFact> traverse(StructuredQuery query) {
        List<GraphFact> facts = new ArrayList<>();
        for (GraphFact.Kind intent : query.getIntents()) {
            switch (intent) {
                case FEATURE_CATALOG:
                    facts.add(featureCatalog());
                    break;
                case TOOLS_BY_DIAMETER:
                    facts.add(toolsByDiameter(query.getDiameter()));
                    break;
                case TOOLS_FOR_FEATURE:
                    facts.add(toolsForFeature(query.getFeatureName()));
                    break;
                case PROCESSES_FOR_FEATURE:
                    facts.add(processesForFeature(query));
                    break;
                case MACHINING_RECOMMENDATION:
                    facts.add(recommendation(query));
                    break;
                case TOOL_DETAILS:
                    toolDetails(query.getToolId()).ifPresent(facts::add);
                    break;
                default:
                    log.warn("No traversal for intent {}", intent);
            }
        }
        return facts;
    }

    private GraphFact featureCatalog() {
        List<FeatureNode> features = graphStore.findFeatures();
        List<String> names = features.stream().map(FeatureNode::getName).toList();

        Map<FeatureCategory, List<String>> byCategory = new EnumMap<>(FeatureCategory.class);
        for (FeatureNode feature : features) {
            byCategory.computeIfAbsent(category(feature.getCategory()), c -> new ArrayList<>()).add(feature.getName());
        }
        String grouped = byCategory.entrySet().stream()
                .map(e -> e.getKey().getLabel() + "：" + String.join("、", e.getValue()))
                .collect(Collectors.joining("；"));

        String text = names.isEmpty()
                ? "知识图谱中还没有特征。"
                : String.format("知识图谱中共有%d种特征：%s。按类别：%s。", names.size(), join(names), grouped);
        return fact(GraphFact.Kind.FEATURE_CATALOG, "Feature", names, text);
    }

    private GraphFact toolsByDiameter(double diameter) {
        String size = KnowledgeIndexService.formatNumber(diameter) + "mm";
        List<ToolNode> tools = graphStore.findToolsByDiameter(diameter);
        String text = tools.isEmpty()
                ? "没有直径为" + size + "的刀具。"
                : "直径为" + size + "的刀具：" + describeTools(tools) + "。";
        return fact(GraphFact.Kind.TOOLS_BY_DIAMETER, size, toolIds(tools), text);
    }

    private GraphFact toolsForFeature(String featureName) {
        List<ToolNode> tools = graphStore.findToolsForFeature(featureName);
        String text = tools.isEmpty()
                ? "没有为" + featureName + "推荐的刀具。"
                : featureName + "的推荐刀具：" + describeTools(tools) + "。";
        return fact(GraphFact.Kind.TOOLS_FOR_FEATURE, featureName, toolIds(tools), text);
    }

    private GraphFact processesForFeature(StructuredQuery query) {
        List<ProcessNode> processes =
                graphStore.findProcesses(query.getFeatureName(), query.getSurface(), query.getStage());
        List<String> templateIds = processes.stream().map(ProcessNode::getTemplateId).distinct().toList();

        String scope = query.getFeatureName()
                + (query.getStage() != null ? "（" + query.getStage() + "）" : "")
                + (query.getSurface() != null ? "（" + query.getSurface() + "）" : "");
        String text = processes.isEmpty()
                ? "没有找到" + scope + "的工艺模板。"
                : scope + "的工艺模板：" + processes.stream().limit(retrievalProperties.getMaxFactItems())
                        .map(this::describeProcess).collect(Collectors.joining("；")) + "。";
        return fact(GraphFact.Kind.PROCESSES_FOR_FEATURE, query.getFeatureName(), templateIds, text);
    }

    private GraphFact recommendation(StructuredQuery query) {
        MachiningRecommendation recommendation = machiningAdvisorService.recommend(
                query.getFeatureName(), query.getSurface(), query.getStage(),
                query.getLength(), query.getWidth(), query.getHeight());

        StringBuilder text = new StringBuilder(recommendation.getSummary());
        if (!recommendation.getTools().isEmpty()) {
            text.append("。可选刀具：").append(describeTools(recommendation.getTools()));
        }
        List<String> items = new ArrayList<>();
        recommendation.getTemplates().stream().findFirst().ifPresent(p -> items.add(p.getTemplateId()));
        recommendation.getTools().stream().findFirst().ifPresent(t -> items.add(t.getToolId()));
        return fact(GraphFact.Kind.MACHINING_RECOMMENDATION, query.getFeatureName(), items, text.toString());
    }

    private Optional<GraphFact> toolDetails(String toolId) {
        Optional<ToolNode> tool = graphStore.findTool(toolId);
        if (tool.isEmpty()) {
            return Optional.empty();
        }
        List<ProcessNode> processes = graphStore.findProcessesForTool(toolId);
        String usage = processes.isEmpty()
                ? "暂无推荐工艺模板"
                : "推荐用于：" + processes.stream().limit(retrievalProperties.getMaxFactItems())
                        .map(p -> p.getTemplateId() + " " + p.getFeatureName() + " " + p.getStage())
                        .collect(Collectors.joining("；"));
        String text = "刀具" + KnowledgeIndexService.describeTool(tool.get()) + "，" + usage + "。";
        return Optional.of(fact(GraphFact.Kind.TOOL_DETAILS, toolId, List.of(toolId), text));
    }

    private String describeProcess(ProcessNode process) {
        StringBuilder text = new StringBuilder(process.getTemplateId())
                .append("（").append(process.getStage()).append("，").append(process.getProcessType());
        if (process.getSurfaceType() != null) {
            text.append("，面类型 ").append(process.getSurfaceType());
        }
        if (process.getAllowance() != null) {
            text.append("，余量 ").append(KnowledgeIndexService.formatNumber(process.getAllowance())).append("mm");
        }
        return text.append("）").toString();
    }

    private String describeTools(List<ToolNode> tools) {
        return tools.stream().limit(retrievalProperties.getMaxFactItems())
                .map(KnowledgeIndexService::describeTool)
                .collect(Collectors.joining("；"));
    }

    private List<String> toolIds(List<ToolNode> tools) {
        return tools.stream().map(ToolNode::getToolId).toList();
    }

    private String join(List<String> names) {
        int limit = retrievalProperties.getMaxFactItems();
        if (names.size() <= limit) {
            return String.join("、", names);
        }
        return String.join("、", names.subList(0, limit)) + "等";
    }

    private GraphFact fact(GraphFact.Kind kind, String subject, List<String> items, String text) {
        return GraphFact.builder()
                .kind(kind)
                .subject(subject)
                .items(new ArrayList<>(items))
                .text(text)
                .build();
    }

    private static FeatureCategory category(String name) {
        if (name == null) {
            return FeatureCategory.CONTOUR;
        }
        try {
            return FeatureCategory.valueOf(name);
        } catch (IllegalArgumentException e) {
            return FeatureCategory.CONTOUR;
        }
    }
}
