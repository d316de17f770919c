package com.machining.kg.graph.store;

import com.machining.kg.dto.GraphStatistics;
import com.machining.kg.dto.LoadMode;
import com.machining.kg.dto.LoadReport;
import com.machining.kg.dto.ProcessFacts;
import com.machining.kg.dto.ProcessRecord;
import com.machining.kg.dto.SourceFiles;
import com.machining.kg.dto.ToolRecord;
import com.machining.kg.dto.WriteCounts;
import com.machining.kg.graph.node.ProcessNode;
import com.machining.kg.graph.node.ToolNode;
import com.machining.kg.schema.SchemaMapper;
import com.machining.kg.service.GraphLoaderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the Cypher behind {@link Neo4jGraphStore} against a real Neo4j.
 * Skipped when no Docker daemon is available.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class Neo4jGraphStoreTest {

    @Container
    static Neo4jContainer<?> neo4jContainer = new Neo4jContainer<>("neo4j:5.18")
            .withAdminPassword("machining-kg-test");

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.neo4j.uri", neo4jContainer::getBoltUrl);
        registry.add("spring.neo4j.authentication.username", () -> "neo4j");
        registry.add("spring.neo4j.authentication.password", neo4jContainer::getAdminPassword);
        registry.add("machining.loader.load-on-startup", () -> "false");
        registry.add("machining.loader.batch-size", () -> "10");
        registry.add("machining.index.persist", () -> "false");
        registry.add("machining.index.rebuild-after-load", () -> "false");
    }

    @Autowired
    private Neo4jGraphStore graphStore;

    @Autowired
    private GraphLoaderService loader;

    @Autowired
    private SchemaMapper schemaMapper;

    @Autowired
    private Neo4jClient neo4jClient;

    @BeforeEach
    void cleanDatabase() {
        neo4jClient.query("MATCH (n) DETACH DELETE n").run();
    }

    @Test
    void testReferenceLoadProducesExactCounts() {
        loader.load(fixtures(), LoadMode.FULL_REBUILD);

        GraphStatistics statistics = graphStore.statistics();
        assertEquals(28, statistics.nodeCount("Feature"));
        assertEquals(60, statistics.nodeCount("Process"));
        assertEquals(13, statistics.nodeCount("Tool"));
        assertEquals(60, statistics.relationshipCount("PROCESSES"));
        assertEquals(60, statistics.relationshipCount("IN_STAGE"));
        assertEquals(60, statistics.relationshipCount("HAS_TYPE"));
    }

    @Test
    void testFullRebuildTwiceGivesEqualCounts() {
        loader.load(fixtures(), LoadMode.FULL_REBUILD);
        GraphStatistics first = graphStore.statistics();

        loader.load(fixtures(), LoadMode.FULL_REBUILD);
        GraphStatistics second = graphStore.statistics();

        assertEquals(first.getNodes(), second.getNodes());
        assertEquals(first.getRelationships(), second.getRelationships());
    }

    @Test
    void testIncrementalReloadCreatesNothing() {
        loader.load(fixtures(), LoadMode.INCREMENTAL);
        GraphStatistics first = graphStore.statistics();

        LoadReport again = loader.load(fixtures(), LoadMode.INCREMENTAL);

        assertEquals(0, again.getWrites().getNodesCreated());
        assertEquals(0, again.getWrites().getRelationshipsCreated());
        assertEquals(0, again.getWrites().getNodesDeleted());
        assertEquals(first.getRelationships(), graphStore.statistics().getRelationships());
    }

    @Test
    void testFullRebuildLeavesUnmanagedNodesAlone() {
        neo4jClient.query("CREATE (:Customer {name: 'acme'})-[:ORDERS]->(:Order {no: 1})").run();

        loader.load(fixtures(), LoadMode.FULL_REBUILD);
        WriteCounts deleted = graphStore.deleteManagedGraph();

        assertEquals(60 + 28 + 13 + 3 + 6, deleted.getNodesDeleted());
        assertEquals(1L, neo4jClient.query("MATCH (c:Customer)-[:ORDERS]->(:Order) RETURN count(c)")
                .fetchAs(Long.class).one().orElse(0L));
    }

    @Test
    void testIncrementalStageChangeReplacesEdges() {
        loader.load(fixtures(), LoadMode.INCREMENTAL);

        ProcessRecord changed = ProcessRecord.builder()
                .processKey(schemaMapper.processKey("TPL-003", "F02"))
                .templateId("TPL-003")
                .featureId("F02")
                .featureKey(schemaMapper.featureKey("矩形通孔"))
                .featureName("矩形通孔")
                .featureCategory("SLOT")
                .componentSurface("侧面;底面")
                .featureSurface("垂直面")
                .surfaceType("垂直面")
                .sidewallFeature(true)
                .allowance(0.2)
                .stage("半精加工")
                .processType("插铣")
                .build();
        WriteCounts counts = graphStore.upsertProcesses(List.of(changed));

        // the new ProcessType node; the stage already exists
        assertEquals(1, counts.getNodesCreated());
        assertEquals(2, counts.getRelationshipsDeleted());
        GraphStatistics statistics = graphStore.statistics();
        assertEquals(60, statistics.nodeCount("Process"));
        assertEquals(60, statistics.relationshipCount("IN_STAGE"));
        assertEquals(60, statistics.relationshipCount("HAS_TYPE"));
        ProcessFacts facts = snapshotOf("TPL-003");
        assertEquals("半精加工", facts.getStage());
        assertEquals("插铣", facts.getProcessType());
        assertEquals(0.2, facts.getAllowance());
        assertEquals(List.of("T-101"), toolIds(facts.getTools()));
    }

    @Test
    void testToolUpsertRelinksRecommendations() {
        loader.load(fixtures(), LoadMode.INCREMENTAL);
        long before = graphStore.statistics().relationshipCount("RECOMMENDED_FOR");

        graphStore.upsertTools(List.of(ToolRecord.builder()
                .toolId("T-101")
                .name("D10平底立铣刀")
                .diameter(10)
                .cornerRadius(0)
                .fluteCount(4)
                .stickOutLength(40)
                .recommendedTemplateIds(List.of("TPL-003", "TPL-004"))
                .build()));

        assertEquals(before - 5, graphStore.statistics().relationshipCount("RECOMMENDED_FOR"));
        assertTrue(graphStore.findToolsForFeature("矩形凹槽").isEmpty());
        assertEquals(List.of("T-101"), toolIds(graphStore.findToolsForFeature("矩形通孔")));
    }

    @Test
    void testSnapshotRoundTripsToolProperties() {
        loader.load(fixtures(), LoadMode.FULL_REBUILD);

        List<ProcessFacts> snapshot = graphStore.processSnapshot();

        assertEquals(60, snapshot.size());
        ProcessFacts facts = snapshotOf("TPL-003");
        assertEquals("矩形通孔", facts.getFeatureName());
        assertEquals("粗加工", facts.getStage());
        assertEquals("铣削", facts.getProcessType());
        assertEquals(Boolean.TRUE, facts.getSidewallFeature());
        ToolNode tool = facts.getTools().get(0);
        assertEquals("T-101", tool.getToolId());
        assertEquals("D10平底立铣刀", tool.getName());
        assertEquals(10.0, tool.getDiameter());
        assertEquals(4, tool.getFluteCount());
        assertEquals(40.0, tool.getStickOutLength());
    }

    @Test
    void testToolQueries() {
        loader.load(fixtures(), LoadMode.FULL_REBUILD);

        assertEquals(List.of("T-101"), toolIds(graphStore.findToolsByDiameter(10.0)));
        assertEquals(List.of("T-110"), toolIds(graphStore.findToolsByDiameter(6.35)));
        assertTrue(graphStore.findToolsByDiameter(7.0).isEmpty());
        assertEquals(List.of("T-104", "T-109", "T-108"), toolIds(graphStore.findSuitableTools(12.0, 45.0)));
        assertEquals(List.of("T-101"), toolIds(graphStore.findToolsForFeature("矩形凹槽")));
        assertEquals(13, graphStore.findTools().size());
        assertTrue(graphStore.findTool("T-113").isPresent());
    }

    @Test
    void testProcessQueries() {
        loader.load(fixtures(), LoadMode.FULL_REBUILD);

        List<String> templates = graphStore.findProcesses("矩形凹槽", null, null).stream()
                .map(ProcessNode::getTemplateId).toList();
        assertEquals(List.of("TPL-007", "TPL-008", "TPL-009"), templates);
        assertEquals(List.of("TPL-009"), graphStore.findProcesses("矩形凹槽", null, "精加工").stream()
                .map(ProcessNode::getTemplateId).toList());
        assertEquals(List.of("TPL-023"), graphStore.findProcessesForTool("T-110").stream()
                .map(ProcessNode::getTemplateId).toList());
        assertEquals(28, graphStore.findFeatures().size());
        assertEquals(List.of("半精加工", "粗加工", "精加工"), graphStore.findStageNames());
        assertEquals(6, graphStore.findProcessTypeNames().size());
    }

    private ProcessFacts snapshotOf(String templateId) {
        return graphStore.processSnapshot().stream()
                .filter(facts -> templateId.equals(facts.getTemplateId()))
                .findFirst().orElseThrow();
    }

    private static List<String> toolIds(List<ToolNode> tools) {
        return tools.stream().map(ToolNode::getToolId).toList();
    }

    private static SourceFiles fixtures() {
        return SourceFiles.builder()
                .processes(new ClassPathResource("fixtures/processes.csv"))
                .tools(new ClassPathResource("fixtures/tools.csv"))
                .build();
    }
}
