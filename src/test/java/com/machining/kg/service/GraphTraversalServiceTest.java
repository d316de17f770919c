package com.machining.kg.service;

import com.machining.kg.TestGraphs;
import com.machining.kg.config.RetrievalProperties;
import com.machining.kg.dto.GraphFact;
import com.machining.kg.graph.node.FeatureNode;
import com.machining.kg.graph.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphTraversalServiceTest {

    private InMemoryGraphStore graphStore;
    private RetrievalProperties retrievalProperties;
    private GraphTraversalService service;

    @BeforeEach
    void setUp() {
        graphStore = TestGraphs.referenceGraph();
        retrievalProperties = new RetrievalProperties();
        service = new GraphTraversalService(graphStore, new QuestionInterpreter(retrievalProperties),
                new MachiningAdvisorService(graphStore), retrievalProperties);
    }

    @Test
    void testFeatureCatalogListsEveryFeature() {
        List<GraphFact> facts = service.factsFor("feature类型都有哪些");

        assertEquals(1, facts.size());
        GraphFact catalog = facts.get(0);
        assertEquals(GraphFact.Kind.FEATURE_CATALOG, catalog.getKind());
        List<String> expected = graphStore.findFeatures().stream().map(FeatureNode::getName).toList();
        assertEquals(28, expected.size());
        assertEquals(expected, catalog.getItems());
        assertTrue(catalog.getText().startsWith("知识图谱中共有28种特征："));
        assertTrue(catalog.getText().contains("孔特征："));
    }

    @Test
    void testCatalogTextIsCappedButItemsAreNot() {
        retrievalProperties.setMaxFactItems(5);

        GraphFact catalog = service.factsFor("所有特征").get(0);

        assertEquals(28, catalog.getItems().size());
        assertTrue(catalog.getText().contains("等。"));
    }

    @Test
    void testToolsByDiameter() {
        List<GraphFact> facts = service.factsFor("直径10mm的刀具");

        assertEquals(1, facts.size());
        GraphFact fact = facts.get(0);
        assertEquals(GraphFact.Kind.TOOLS_BY_DIAMETER, fact.getKind());
        assertEquals("10mm", fact.getSubject());
        assertEquals(List.of("T-101"), fact.getItems());
        assertTrue(fact.getText().contains("D10平底立铣刀"));
    }

    @Test
    void testNoToolOfDiameter() {
        GraphFact fact = service.factsFor("直径7mm的刀具").get(0);

        assertTrue(fact.getItems().isEmpty());
        assertEquals("没有直径为7mm的刀具。", fact.getText());
    }

    @Test
    void testProcessesForFeature() {
        List<GraphFact> facts = service.factsFor("矩形凹槽有哪些工艺");

        assertEquals(1, facts.size());
        assertEquals(GraphFact.Kind.PROCESSES_FOR_FEATURE, facts.get(0).getKind());
        assertEquals(List.of("TPL-007", "TPL-008", "TPL-009"), facts.get(0).getItems());
    }

    @Test
    void testToolsForFeatureAndStage() {
        List<GraphFact> facts = service.factsFor("圆柱通孔精加工用什么刀具");

        GraphFact tools = facts.stream().filter(f -> f.getKind() == GraphFact.Kind.TOOLS_FOR_FEATURE)
                .findFirst().orElseThrow();
        assertEquals(List.of("T-108"), tools.getItems());
        GraphFact processes = facts.stream().filter(f -> f.getKind() == GraphFact.Kind.PROCESSES_FOR_FEATURE)
                .findFirst().orElseThrow();
        assertEquals(List.of("TPL-002"), processes.getItems());
    }

    @Test
    void testRecommendationForPocketSize() {
        List<GraphFact> facts = service.factsFor("矩形凹槽 长度40 宽度20 深度15 推荐");

        GraphFact recommendation = facts.stream()
                .filter(f -> f.getKind() == GraphFact.Kind.MACHINING_RECOMMENDATION)
                .findFirst().orElseThrow();
        assertEquals(List.of("TPL-007", "T-105"), recommendation.getItems());
        assertTrue(recommendation.getText().startsWith("推荐模板ID：TPL-007  推荐加工工艺：铣削  推荐刀具ID：T-105"));
    }

    @Test
    void testToolDetails() {
        List<GraphFact> facts = service.factsFor("T-110是什么");

        assertEquals(1, facts.size());
        GraphFact fact = facts.get(0);
        assertEquals(GraphFact.Kind.TOOL_DETAILS, fact.getKind());
        assertTrue(fact.getText().contains("M6丝锥"));
        assertTrue(fact.getText().contains("TPL-023 螺纹孔 精加工"));
    }

    @Test
    void testUnstructuredQuestionHasNoFacts() {
        assertTrue(service.factsFor("今天天气怎么样").isEmpty());
    }
}
