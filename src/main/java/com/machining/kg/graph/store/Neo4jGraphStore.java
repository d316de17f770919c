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
import com.machining.kg.graph.repository.FeatureNodeRepository;
import com.machining.kg.graph.repository.ProcessNodeRepository;
import com.machining.kg.graph.repository.ProcessStageNodeRepository;
import com.machining.kg.graph.repository.ProcessTypeNodeRepository;
import com.machining.kg.graph.repository.ToolNodeRepository;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.summary.ResultSummary;
import org.neo4j.driver.summary.SummaryCounters;
import org.neo4j.driver.types.Node;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Neo4j-backed graph store.
 * Writes go through {@link Neo4jClient} so the result counters can be reported;
 * reads use the Spring Data repositories. Connectivity failures and timeouts are
 * translated to {@link StoreUnavailableException}.
 */
@Slf4j
@Component
public class Neo4jGraphStore implements GraphStore {

    private static final double DIAMETER_TOLERANCE = 1e-6;
    private static final int DELETE_BATCH_SIZE = 5000;

    private static final String UPSERT_PROCESSES = """
            UNWIND $rows AS row
            MERGE (p:Process {key: row.processKey})
            SET p += row.props
            WITH p, row
            CALL {
              WITH p, row
              OPTIONAL MATCH (p)-[old]->(n)
              WHERE (type(old) = 'PROCESSES' AND n.key <> row.featureKey)
                 OR (type(old) = 'IN_STAGE' AND n.name <> row.stage)
                 OR (type(old) = 'HAS_TYPE' AND n.name <> row.processType)
              DELETE old
            }
            MERGE (f:Feature {key: row.featureKey})
              ON CREATE SET f.name = row.featureName, f.featureId = row.featureId, f.category = row.featureCategory
            MERGE (st:ProcessStage {name: row.stage})
            MERGE (pt:ProcessType {name: row.processType})
            MERGE (p)-[:PROCESSES]->(f)
            MERGE (p)-[:IN_STAGE]->(st)
            MERGE (p)-[:HAS_TYPE]->(pt)
            """;

    private static final String UPSERT_TOOLS = """
            UNWIND $rows AS row
            MERGE (t:Tool {toolId: row.toolId})
            SET t.name = row.name, t.diameter = row.diameter, t.cornerRadius = row.cornerRadius,
                t.fluteCount = row.fluteCount, t.stickOutLength = row.stickOutLength
            WITH t, row
            CALL {
              WITH t, row
              OPTIONAL MATCH (t)-[old:RECOMMENDED_FOR]->(p:Process)
              WHERE NOT p.templateId IN row.templateIds
              DELETE old
            }
            WITH t, row
            UNWIND row.templateIds AS templateId
            MATCH (p:Process {templateId: templateId})
            MERGE (t)-[:RECOMMENDED_FOR]->(p)
            """;

    private static final String DELETE_MANAGED = """
            MATCH (n)
            WHERE n:Feature OR n:Process OR n:ProcessType OR n:ProcessStage OR n:Tool
            WITH n LIMIT $limit
            DETACH DELETE n
            """;

    private static final String PROCESS_SNAPSHOT = """
            MATCH (p:Process)-[:PROCESSES]->(f:Feature)
            MATCH (p)-[:IN_STAGE]->(st:ProcessStage)
            MATCH (p)-[:HAS_TYPE]->(pt:ProcessType)
            OPTIONAL MATCH (t:Tool)-[:RECOMMENDED_FOR]->(p)
            WITH p, f, st, pt, t ORDER BY t.toolId
            WITH p, f, st, pt, collect(t) AS tools
            RETURN p, f, st.name AS stage, pt.name AS processType, tools
            ORDER BY p.key
            """;

    private static final List<String> INDEX_STATEMENTS = List.of(
            "CREATE INDEX feature_key IF NOT EXISTS FOR (n:Feature) ON (n.key)",
            "CREATE INDEX feature_name IF NOT EXISTS FOR (n:Feature) ON (n.name)",
            "CREATE INDEX process_key IF NOT EXISTS FOR (n:Process) ON (n.key)",
            "CREATE INDEX process_template_id IF NOT EXISTS FOR (n:Process) ON (n.templateId)",
            "CREATE INDEX process_type_name IF NOT EXISTS FOR (n:ProcessType) ON (n.name)",
            "CREATE INDEX process_stage_name IF NOT EXISTS FOR (n:ProcessStage) ON (n.name)",
            "CREATE INDEX tool_id IF NOT EXISTS FOR (n:Tool) ON (n.toolId)",
            "CREATE INDEX tool_name IF NOT EXISTS FOR (n:Tool) ON (n.name)");

    private final Neo4jClient neo4jClient;
    private final TransactionTemplate batchTransactionTemplate;
    private final TransactionTemplate readTransactionTemplate;
    private final FeatureNodeRepository featureRepository;
    private final ProcessNodeRepository processRepository;
    private final ProcessStageNodeRepository stageRepository;
    private final ProcessTypeNodeRepository typeRepository;
    private final ToolNodeRepository toolRepository;

    public Neo4jGraphStore(Neo4jClient neo4jClient,
                           @Qualifier("batchTransactionTemplate") TransactionTemplate batchTransactionTemplate,
                           @Qualifier("readTransactionTemplate") TransactionTemplate readTransactionTemplate,
                           FeatureNodeRepository featureRepository,
                           ProcessNodeRepository processRepository,
                           ProcessStageNodeRepository stageRepository,
                           ProcessTypeNodeRepository typeRepository,
                           ToolNodeRepository toolRepository) {
        this.neo4jClient = neo4jClient;
        this.batchTransactionTemplate = batchTransactionTemplate;
        this.readTransactionTemplate = readTransactionTemplate;
        this.featureRepository = featureRepository;
        this.processRepository = processRepository;
        this.stageRepository = stageRepository;
        this.typeRepository = typeRepository;
        this.toolRepository = toolRepository;
    }

    @Override
    public void verifyConnectivity() {
        withStore("verifyConnectivity", () -> neo4jClient.query("RETURN 1").fetchAs(Long.class).one());
    }

    @Override
    public WriteCounts deleteManagedGraph() {
        return withStore("deleteManagedGraph", () -> {
            WriteCounts total = WriteCounts.empty();
            while (true) {
                WriteCounts round = inWriteTransaction(() -> toCounts(neo4jClient.query(DELETE_MANAGED)
                        .bind(DELETE_BATCH_SIZE).to("limit")
                        .run()));
                total.add(round);
                if (round.getNodesDeleted() == 0) {
                    break;
                }
                log.debug("Deleted {} managed nodes", round.getNodesDeleted());
            }
            return total;
        });
    }

    @Override
    public WriteCounts upsertProcesses(List<ProcessRecord> batch) {
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (ProcessRecord record : batch) {
            Map<String, Object> props = new HashMap<>();
            props.put("templateId", record.getTemplateId());
            props.put("featureId", record.getFeatureId());
            props.put("featureName", record.getFeatureName());
            props.put("componentSurface", record.getComponentSurface());
            props.put("featureSurface", record.getFeatureSurface());
            props.put("surfaceType", record.getSurfaceType());
            props.put("sidewallFeature", record.isSidewallFeature());
            props.put("allowance", record.getAllowance());
            props.put("stage", record.getStage());
            props.put("processType", record.getProcessType());

            Map<String, Object> row = new HashMap<>();
            row.put("processKey", record.getProcessKey());
            row.put("props", props);
            row.put("featureKey", record.getFeatureKey());
            row.put("featureName", record.getFeatureName());
            row.put("featureId", record.getFeatureId());
            row.put("featureCategory", record.getFeatureCategory());
            row.put("stage", record.getStage());
            row.put("processType", record.getProcessType());
            rows.add(row);
        }
        return withStore("upsertProcesses", () -> inWriteTransaction(() -> toCounts(
                neo4jClient.query(UPSERT_PROCESSES).bind(rows).to("rows").run())));
    }

    @Override
    public WriteCounts upsertTools(List<ToolRecord> batch) {
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (ToolRecord record : batch) {
            Map<String, Object> row = new HashMap<>();
            row.put("toolId", record.getToolId());
            row.put("name", record.getName());
            row.put("diameter", record.getDiameter());
            row.put("cornerRadius", record.getCornerRadius());
            row.put("fluteCount", record.getFluteCount());
            row.put("stickOutLength", record.getStickOutLength());
            row.put("templateIds", record.getRecommendedTemplateIds());
            rows.add(row);
        }
        return withStore("upsertTools", () -> inWriteTransaction(() -> toCounts(
                neo4jClient.query(UPSERT_TOOLS).bind(rows).to("rows").run())));
    }

    @Override
    public void ensureIndexes() {
        withStore("ensureIndexes", () -> {
            for (String statement : INDEX_STATEMENTS) {
                neo4jClient.query(statement).run();
            }
            log.info("Ensured {} indexes on managed labels", INDEX_STATEMENTS.size());
            return null;
        });
    }

    @Override
    public GraphStatistics statistics() {
        return withStore("statistics", () -> inReadTransaction(() -> {
            Map<String, Long> nodes = new TreeMap<>();
            for (String label : MANAGED_LABELS) {
                Long count = neo4jClient.query("MATCH (n:`" + label + "`) RETURN count(n)")
                        .fetchAs(Long.class).one().orElse(0L);
                nodes.put(label, count);
            }
            Map<String, Long> relationships = new TreeMap<>();
            for (String type : RELATIONSHIP_TYPES) {
                Long count = neo4jClient.query("MATCH ()-[r:`" + type + "`]->() RETURN count(r)")
                        .fetchAs(Long.class).one().orElse(0L);
                relationships.put(type, count);
            }
            return GraphStatistics.builder().nodes(nodes).relationships(relationships).build();
        }));
    }

    @Override
    public List<ProcessFacts> processSnapshot() {
        return withStore("processSnapshot", () -> inReadTransaction(() -> new ArrayList<>(
                neo4jClient.query(PROCESS_SNAPSHOT)
                        .fetchAs(ProcessFacts.class)
                        .mappedBy((typeSystem, record) -> {
                            Node process = record.get("p").asNode();
                            Node feature = record.get("f").asNode();
                            List<ToolNode> tools = record.get("tools").asList(value -> toToolNode(value.asNode()));
                            return ProcessFacts.builder()
                                    .processKey(process.get("key").asString())
                                    .templateId(stringOrNull(process.get("templateId")))
                                    .featureId(stringOrNull(process.get("featureId")))
                                    .componentSurface(stringOrNull(process.get("componentSurface")))
                                    .featureSurface(stringOrNull(process.get("featureSurface")))
                                    .surfaceType(stringOrNull(process.get("surfaceType")))
                                    .sidewallFeature(process.get("sidewallFeature").isNull() ? null
                                            : process.get("sidewallFeature").asBoolean())
                                    .allowance(doubleOrNull(process.get("allowance")))
                                    .featureName(stringOrNull(feature.get("name")))
                                    .featureCategory(stringOrNull(feature.get("category")))
                                    .stage(record.get("stage").asString())
                                    .processType(record.get("processType").asString())
                                    .tools(new ArrayList<>(tools))
                                    .build();
                        })
                        .all())));
    }

    @Override
    public List<FeatureNode> findFeatures() {
        return withStore("findFeatures", () -> inReadTransaction(featureRepository::findAllOrderByName));
    }

    @Override
    public List<String> findStageNames() {
        return withStore("findStageNames", () -> inReadTransaction(stageRepository::findAllNames));
    }

    @Override
    public List<String> findProcessTypeNames() {
        return withStore("findProcessTypeNames", () -> inReadTransaction(typeRepository::findAllNames));
    }

    @Override
    public List<ToolNode> findTools() {
        return withStore("findTools", () -> inReadTransaction(toolRepository::findAllOrderByToolId));
    }

    @Override
    public Optional<ToolNode> findTool(String toolId) {
        return withStore("findTool", () -> inReadTransaction(() -> toolRepository.findById(toolId)));
    }

    @Override
    public List<ToolNode> findToolsByDiameter(double diameter) {
        return withStore("findToolsByDiameter", () -> inReadTransaction(
                () -> toolRepository.findByDiameter(diameter, DIAMETER_TOLERANCE)));
    }

    @Override
    public List<ToolNode> findToolsForFeature(String featureName) {
        return withStore("findToolsForFeature", () -> inReadTransaction(
                () -> toolRepository.findRecommendedForFeature(featureName)));
    }

    @Override
    public List<ToolNode> findSuitableTools(double diameterLimit, double height) {
        return withStore("findSuitableTools", () -> inReadTransaction(
                () -> toolRepository.findSuitable(diameterLimit, height)));
    }

    @Override
    public List<ProcessNode> findProcesses(String featureName, String surface, String stage) {
        return withStore("findProcesses", () -> inReadTransaction(
                () -> processRepository.findByFeature(featureName, surface, stage)));
    }

    @Override
    public List<ProcessNode> findProcessesForTool(String toolId) {
        return withStore("findProcessesForTool", () -> inReadTransaction(
                () -> processRepository.findRecommendedForTool(toolId)));
    }

    private <T> T inWriteTransaction(Supplier<T> work) {
        return batchTransactionTemplate.execute(status -> work.get());
    }

    private <T> T inReadTransaction(Supplier<T> work) {
        return readTransactionTemplate.execute(status -> work.get());
    }

    private <T> T withStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException | TransactionException
                 | ServiceUnavailableException | SessionExpiredException e) {
            log.error("Graph store unavailable during {}: {}", operation, e.getMessage());
            throw new StoreUnavailableException("Graph store unavailable during " + operation + ": " + e.getMessage(), e);
        }
    }

    private static WriteCounts toCounts(ResultSummary summary) {
        SummaryCounters counters = summary.counters();
        return WriteCounts.builder()
                .nodesCreated(counters.nodesCreated())
                .nodesDeleted(counters.nodesDeleted())
                .relationshipsCreated(counters.relationshipsCreated())
                .relationshipsDeleted(counters.relationshipsDeleted())
                .propertiesSet(counters.propertiesSet())
                .build();
    }

    private static ToolNode toToolNode(Node node) {
        return ToolNode.builder()
                .toolId(node.get("toolId").asString())
                .name(stringOrNull(node.get("name")))
                .diameter(doubleOrNull(node.get("diameter")))
                .cornerRadius(doubleOrNull(node.get("cornerRadius")))
                .fluteCount(node.get("fluteCount").isNull() ? null : node.get("fluteCount").asInt())
                .stickOutLength(doubleOrNull(node.get("stickOutLength")))
                .build();
    }

    private static String stringOrNull(Value value) {
        return value.isNull() ? null : value.asString();
    }

    private static Double doubleOrNull(Value value) {
        return value.isNull() ? null : value.asDouble();
    }
}
