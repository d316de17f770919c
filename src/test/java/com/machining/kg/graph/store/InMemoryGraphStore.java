package com.machining.kg.graph.store;

import com.machining.kg.dto.GraphStatistics;
import com.machining.kg.dto.ProcessFacts;
import com.machining.kg.dto.ProcessRecord;
import com.machining.kg.dto.ToolRecord;
import com.machining.kg.dto.WriteCounts;
import com.machining.kg.exception.StoreUnavailableException;
import com.machining.kg.graph.node.FeatureNode;
import com.machining.kg.graph.node.ProcessNode;
import com.machining.kg.graph.node.ToolNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Graph store backed by maps, with the same MERGE semantics as the Cypher statements.
 * Batches are applied to a copy and swapped in on success, so a failing batch leaves nothing behind.
 * {@link #failAfterBatches(int)} and {@link #setAvailable(boolean)} simulate a lost connection.
 */
public class InMemoryGraphStore implements GraphStore {

    private State state = new State();
    private boolean available = true;
    private int batchesBeforeFailure = -1;

    /** Nodes of labels this application does not manage; must survive a full rebuild */
    private final Map<String, Long> unmanagedNodes = new TreeMap<>();

    private static class State {
        final Map<String, FeatureNode> features = new TreeMap<>();
        final Map<String, ProcessNode> processes = new TreeMap<>();
        final Set<String> stages = new TreeSet<>();
        final Set<String> types = new TreeSet<>();
        final Map<String, ToolNode> tools = new TreeMap<>();
        /** tool id -> process keys */
        final Map<String, Set<String>> recommendedFor = new TreeMap<>();

        State copy() {
            State copy = new State();
            features.forEach((k, v) -> copy.features.put(k, copyOf(v)));
            processes.forEach((k, v) -> copy.processes.put(k, copyOf(v)));
            copy.stages.addAll(stages);
            copy.types.addAll(types);
            tools.forEach((k, v) -> copy.tools.put(k, copyOf(v)));
            recommendedFor.forEach((k, v) -> copy.recommendedFor.put(k, new TreeSet<>(v)));
            return copy;
        }
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    /**
     * Let {@code batches} more write batches succeed, then lose the connection.
     */
    public void failAfterBatches(int batches) {
        this.batchesBeforeFailure = batches;
    }

    public void addUnmanagedNode(String label) {
        unmanagedNodes.merge(label, 1L, Long::sum);
    }

    public long unmanagedNodeCount(String label) {
        return unmanagedNodes.getOrDefault(label, 0L);
    }

    /**
     * The Process with its single Feature link, for referential checks.
     */
    public Optional<ProcessNode> process(String key) {
        return Optional.ofNullable(state.processes.get(key)).map(InMemoryGraphStore::copyOf);
    }

    @Override
    public void verifyConnectivity() {
        checkAvailable();
    }

    @Override
    public WriteCounts deleteManagedGraph() {
        beginWrite();
        GraphStatistics before = statistics();
        state = new State();
        return WriteCounts.builder()
                .nodesDeleted(before.getTotalNodes())
                .relationshipsDeleted(before.getTotalRelationships())
                .build();
    }

    @Override
    public WriteCounts upsertProcesses(List<ProcessRecord> batch) {
        beginWrite();
        State next = state.copy();
        WriteCounts counts = new WriteCounts();
        for (ProcessRecord row : batch) {
            ProcessNode process = next.processes.get(row.getProcessKey());
            if (process == null) {
                process = new ProcessNode();
                process.setKey(row.getProcessKey());
                next.processes.put(row.getProcessKey(), process);
            }
            process.setTemplateId(row.getTemplateId());
            process.setFeatureId(row.getFeatureId());
            process.setFeatureName(row.getFeatureName());
            process.setComponentSurface(row.getComponentSurface());
            process.setFeatureSurface(row.getFeatureSurface());
            process.setSurfaceType(row.getSurfaceType());
            process.setSidewallFeature(row.isSidewallFeature());
            process.setAllowance(row.getAllowance());
            process.setStage(row.getStage());
            process.setProcessType(row.getProcessType());
            counts.setPropertiesSet(counts.getPropertiesSet() + 10);

            FeatureNode feature = next.features.computeIfAbsent(row.getFeatureKey(), key -> FeatureNode.builder()
                    .key(key)
                    .name(row.getFeatureName())
                    .featureId(row.getFeatureId())
                    .category(row.getFeatureCategory())
                    .build());
            process.setFeature(feature);
            next.stages.add(row.getStage());
            next.types.add(row.getProcessType());
        }
        // shared Feature, stage and type nodes are merged, so count what actually appeared
        counts.setNodesCreated(nodeTotal(next) - nodeTotal(state));
        counts.setRelationshipsCreated(Math.max(0, relationshipTotal(next) - relationshipTotal(state)));
        state = next;
        return counts;
    }

    @Override
    public WriteCounts upsertTools(List<ToolRecord> batch) {
        beginWrite();
        State next = state.copy();
        long relationshipsBefore = relationshipTotal(next);
        long nodesBefore = nodeTotal(next);
        for (ToolRecord row : batch) {
            next.tools.put(row.getToolId(), ToolNode.builder()
                    .toolId(row.getToolId())
                    .name(row.getName())
                    .diameter(row.getDiameter())
                    .cornerRadius(row.getCornerRadius())
                    .fluteCount(row.getFluteCount())
                    .stickOutLength(row.getStickOutLength())
                    .build());
            Set<String> linked = new TreeSet<>();
            for (ProcessNode process : next.processes.values()) {
                if (row.getRecommendedTemplateIds().contains(process.getTemplateId())) {
                    linked.add(process.getKey());
                }
            }
            next.recommendedFor.put(row.getToolId(), linked);
        }
        WriteCounts counts = WriteCounts.builder()
                .nodesCreated(nodeTotal(next) - nodesBefore)
                .relationshipsCreated(Math.max(0, relationshipTotal(next) - relationshipsBefore))
                .propertiesSet(batch.size() * 6L)
                .build();
        state = next;
        return counts;
    }

    @Override
    public void ensureIndexes() {
        checkAvailable();
    }

    @Override
    public GraphStatistics statistics() {
        checkAvailable();
        GraphStatistics statistics = GraphStatistics.builder().build();
        statistics.getNodes().put("Feature", (long) state.features.size());
        statistics.getNodes().put("Process", (long) state.processes.size());
        statistics.getNodes().put("ProcessStage", (long) state.stages.size());
        statistics.getNodes().put("ProcessType", (long) state.types.size());
        statistics.getNodes().put("Tool", (long) state.tools.size());
        long processes = state.processes.size();
        statistics.getRelationships().put("PROCESSES", processes);
        statistics.getRelationships().put("IN_STAGE", processes);
        statistics.getRelationships().put("HAS_TYPE", processes);
        statistics.getRelationships().put("RECOMMENDED_FOR",
                state.recommendedFor.values().stream().mapToLong(Set::size).sum());
        return statistics;
    }

    @Override
    public List<ProcessFacts> processSnapshot() {
        checkAvailable();
        List<ProcessFacts> snapshot = new ArrayList<>();
        for (ProcessNode process : state.processes.values()) {
            snapshot.add(ProcessFacts.builder()
                    .processKey(process.getKey())
                    .templateId(process.getTemplateId())
                    .featureId(process.getFeatureId())
                    .componentSurface(process.getComponentSurface())
                    .featureSurface(process.getFeatureSurface())
                    .surfaceType(process.getSurfaceType())
                    .sidewallFeature(process.getSidewallFeature())
                    .allowance(process.getAllowance())
                    .featureName(process.getFeature().getName())
                    .featureCategory(process.getFeature().getCategory())
                    .stage(process.getStage())
                    .processType(process.getProcessType())
                    .tools(toolsFor(process.getKey()))
                    .build());
        }
        return snapshot;
    }

    @Override
    public List<FeatureNode> findFeatures() {
        checkAvailable();
        return state.features.values().stream()
                .map(InMemoryGraphStore::copyOf)
                .sorted(Comparator.comparing(FeatureNode::getName))
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findStageNames() {
        checkAvailable();
        return new ArrayList<>(state.stages);
    }

    @Override
    public List<String> findProcessTypeNames() {
        checkAvailable();
        return new ArrayList<>(state.types);
    }

    @Override
    public List<ToolNode> findTools() {
        checkAvailable();
        return state.tools.values().stream().map(InMemoryGraphStore::copyOf).collect(Collectors.toList());
    }

    @Override
    public Optional<ToolNode> findTool(String toolId) {
        checkAvailable();
        return Optional.ofNullable(state.tools.get(toolId)).map(InMemoryGraphStore::copyOf);
    }

    @Override
    public List<ToolNode> findToolsByDiameter(double diameter) {
        return findTools().stream()
                .filter(tool -> Math.abs(tool.getDiameter() - diameter) <= 1e-6)
                .collect(Collectors.toList());
    }

    @Override
    public List<ToolNode> findToolsForFeature(String featureName) {
        checkAvailable();
        Set<String> toolIds = new TreeSet<>();
        state.recommendedFor.forEach((toolId, processKeys) -> {
            for (String key : processKeys) {
                if (featureName.equals(state.processes.get(key).getFeature().getName())) {
                    toolIds.add(toolId);
                }
            }
        });
        return toolIds.stream().map(id -> copyOf(state.tools.get(id))).collect(Collectors.toList());
    }

    @Override
    public List<ToolNode> findSuitableTools(double diameterLimit, double height) {
        return findTools().stream()
                .filter(tool -> tool.getDiameter() <= diameterLimit && tool.getStickOutLength() > height)
                .sorted(Comparator.comparing(ToolNode::getDiameter).reversed()
                        .thenComparing(ToolNode::getStickOutLength)
                        .thenComparing(ToolNode::getToolId))
                .collect(Collectors.toList());
    }

    @Override
    public List<ProcessNode> findProcesses(String featureName, String surface, String stage) {
        checkAvailable();
        return state.processes.values().stream()
                .filter(p -> featureName.equals(p.getFeature().getName()))
                .filter(p -> surface == null || surface.equals(p.getSurfaceType()) || surface.equals(p.getFeatureSurface()))
                .filter(p -> stage == null || Objects.equals(stage, p.getStage()))
                .sorted(Comparator.comparing(ProcessNode::getTemplateId).thenComparing(ProcessNode::getFeatureId))
                .map(InMemoryGraphStore::copyOf)
                .collect(Collectors.toList());
    }

    @Override
    public List<ProcessNode> findProcessesForTool(String toolId) {
        checkAvailable();
        return state.recommendedFor.getOrDefault(toolId, Set.of()).stream()
                .map(state.processes::get)
                .sorted(Comparator.comparing(ProcessNode::getTemplateId).thenComparing(ProcessNode::getFeatureId))
                .map(InMemoryGraphStore::copyOf)
                .collect(Collectors.toList());
    }

    private List<ToolNode> toolsFor(String processKey) {
        List<ToolNode> tools = new ArrayList<>();
        state.recommendedFor.forEach((toolId, keys) -> {
            if (keys.contains(processKey)) {
                tools.add(copyOf(state.tools.get(toolId)));
            }
        });
        return tools;
    }

    private void beginWrite() {
        checkAvailable();
        if (batchesBeforeFailure == 0) {
            available = false;
            throw new StoreUnavailableException("Connection to the graph store was lost", null);
        }
        if (batchesBeforeFailure > 0) {
            batchesBeforeFailure--;
        }
    }

    private void checkAvailable() {
        if (!available) {
            throw new StoreUnavailableException("Graph store unavailable", null);
        }
    }

    private static long nodeTotal(State state) {
        return state.features.size() + state.processes.size() + state.stages.size()
                + state.types.size() + state.tools.size();
    }

    private static long relationshipTotal(State state) {
        return state.processes.size() * 3L + state.recommendedFor.values().stream().mapToLong(Set::size).sum();
    }

    private static ProcessNode copyOf(ProcessNode process) {
        return ProcessNode.builder()
                .key(process.getKey())
                .templateId(process.getTemplateId())
                .featureId(process.getFeatureId())
                .featureName(process.getFeatureName())
                .componentSurface(process.getComponentSurface())
                .featureSurface(process.getFeatureSurface())
                .surfaceType(process.getSurfaceType())
                .sidewallFeature(process.getSidewallFeature())
                .allowance(process.getAllowance())
                .stage(process.getStage())
                .processType(process.getProcessType())
                .feature(process.getFeature())
                .build();
    }

    private static ToolNode copyOf(ToolNode tool) {
        return ToolNode.builder()
                .toolId(tool.getToolId())
                .name(tool.getName())
                .diameter(tool.getDiameter())
                .cornerRadius(tool.getCornerRadius())
                .fluteCount(tool.getFluteCount())
                .stickOutLength(tool.getStickOutLength())
                .build();
    }

    private static FeatureNode copyOf(FeatureNode feature) {
        return FeatureNode.builder()
                .key(feature.getKey())
                .name(feature.getName())
                .featureId(feature.getFeatureId())
                .category(feature.getCategory())
                .build();
    }
}
