package com.machining.kg.graph.store;

import com.machining.kg.dto.GraphStatistics;
import com.machining.kg.dto.ProcessFacts;
import com.machining.kg.dto.ProcessRecord;
import com.machining.kg.dto.ToolRecord;
import com.machining.kg.dto.WriteCounts;
import com.machining.kg.graph.node.FeatureNode;
import com.machining.kg.graph.node.ProcessNode;
import com.machining.kg.graph.node.ToolNode;

import java.util.List;
import java.util.Optional;

/**
 * Upsert and traversal operations on the machining property graph.
 * <p>
 * Every method throws {@link com.machining.kg.exception.StoreUnavailableException}
 * when the store cannot be reached or the operation times out. Batch writes are atomic:
 * a failed batch leaves no partial nodes or relationships behind.
 */
public interface GraphStore {

    /** Labels owned by this application; nothing else is ever deleted */
    List<String> MANAGED_LABELS = List.of("Feature", "Process", "ProcessType", "ProcessStage", "Tool");

    List<String> RELATIONSHIP_TYPES = List.of("PROCESSES", "HAS_TYPE", "IN_STAGE", "RECOMMENDED_FOR");

    void verifyConnectivity();

    /**
     * Delete all nodes carrying a managed label, with their relationships.
     */
    WriteCounts deleteManagedGraph();

    /**
     * Upsert a batch of process rows with their Feature, ProcessStage and ProcessType,
     * replacing stale PROCESSES / IN_STAGE / HAS_TYPE edges so each Process keeps exactly one of each.
     */
    WriteCounts upsertProcesses(List<ProcessRecord> batch);

    /**
     * Upsert a batch of tools and link them to the processes of their recommended templates.
     */
    WriteCounts upsertTools(List<ToolRecord> batch);

    /**
     * Create the identity-key and lookup indexes if they do not exist yet.
     */
    void ensureIndexes();

    GraphStatistics statistics();

    /**
     * Every Process with its Feature, stage, type and recommended tools, ordered by process key.
     */
    List<ProcessFacts> processSnapshot();

    List<FeatureNode> findFeatures();

    List<String> findStageNames();

    List<String> findProcessTypeNames();

    List<ToolNode> findTools();

    Optional<ToolNode> findTool(String toolId);

    List<ToolNode> findToolsByDiameter(double diameter);

    List<ToolNode> findToolsForFeature(String featureName);

    /**
     * Tools with {@code diameter <= diameterLimit} and {@code stickOutLength > height},
     * widest first, then shortest stick-out.
     */
    List<ToolNode> findSuitableTools(double diameterLimit, double height);

    /**
     * Processes of a feature; {@code surface} and {@code stage} are optional filters.
     */
    List<ProcessNode> findProcesses(String featureName, String surface, String stage);

    List<ProcessNode> findProcessesForTool(String toolId);
}
