package com.machining.kg.resolver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.machining.kg.TestGraphs;
import com.machining.kg.config.EmbeddingProperties;
import com.machining.kg.config.IndexProperties;
import com.machining.kg.config.RetrievalProperties;
import com.machining.kg.dto.GraphFact;
import com.machining.kg.dto.QueryRequest;
import com.machining.kg.dto.QueryResponse;
import com.machining.kg.exception.QueryCancelledException;
import com.machining.kg.exception.RetrievalServiceUnavailableException;
import com.machining.kg.graph.node.FeatureNode;
import com.machining.kg.graph.store.InMemoryGraphStore;
import com.machining.kg.index.IndexCacheStore;
import com.machining.kg.resolver.tier.GraphTraversalTier;
import com.machining.kg.resolver.tier.NaiveTier;
import com.machining.kg.resolver.tier.RequestedModeTier;
import com.machining.kg.resolver.tier.StaticMessageTier;
import com.machining.kg.service.ContentHashService;
import com.machining.kg.service.EmbeddingService;
import com.machining.kg.service.GenerationService;
import com.machining.kg.service.GraphTraversalService;
import com.machining.kg.service.KnowledgeIndexService;
import com.machining.kg.service.MachiningAdvisorService;
import com.machining.kg.service.PromptTemplateService;
import com.machining.kg.service.QuestionInterpreter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryResolverTest {

    private static final String ANSWER = "建议使用T-101 D10平底立铣刀。";

    private InMemoryGraphStore graphStore;
    private EmbeddingService embeddingService;
    private GenerationService generationService;
    private RetrievalProperties retrievalProperties;
    private KnowledgeIndexService knowledgeIndexService;
    private QueryResolver resolver;

    @BeforeEach
    void setUp() {
        graphStore = TestGraphs.referenceGraph();
        embeddingService = mock(EmbeddingService.class);
        generationService = mock(GenerationService.class);
        retrievalProperties = new RetrievalProperties();

        when(embeddingService.isConfigured()).thenReturn(true);
        when(embeddingService.embed(anyString())).thenAnswer(invocation -> TestGraphs.embed(invocation.getArgument(0)));
        when(generationService.generate(anyString(), anyString())).thenReturn(ANSWER);

        resolver = newResolver();
    }

    @Test
    void testAnswersInRequestedMode() {
        QueryResponse response = resolver.resolve(request("矩形通孔粗加工用什么刀具", "hybrid"));

        assertEquals(QueryState.ANSWERED, response.getState());
        assertEquals(1, response.getTier());
        assertEquals("hybrid", response.getMode());
        assertEquals(ANSWER, response.getAnswer());
        assertFalse(response.isDegraded());
        assertFalse(response.getCitedUnits().isEmpty());
        assertTrue(response.getDescents().isEmpty());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generationService).generate(prompt.capture(), eq("矩形通孔粗加工用什么刀具"));
        assertTrue(prompt.getValue().contains("基于以下知识库信息回答问题："));
        assertTrue(prompt.getValue().contains("[1] "));
    }

    @Test
    void testFeatureCatalogContextListsEveryFeature() {
        QueryResponse response = resolver.resolve(request("feature类型都有哪些", "hybrid"));

        assertEquals(QueryState.ANSWERED, response.getState());
        GraphFact catalog = response.getGraphFacts().stream()
                .filter(f -> f.getKind() == GraphFact.Kind.FEATURE_CATALOG)
                .findFirst().orElseThrow();
        List<String> featureNames = graphStore.findFeatures().stream().map(FeatureNode::getName).toList();
        assertEquals(featureNames, catalog.getItems());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generationService).generate(prompt.capture(), anyString());
        featureNames.forEach(name -> assertTrue(prompt.getValue().contains(name), name));
    }

    @Test
    void testToolsByDiameterReachTheGenerator() {
        QueryResponse response = resolver.resolve(request("直径10mm的刀具有哪些", null));

        GraphFact fact = response.getGraphFacts().get(0);
        assertEquals(GraphFact.Kind.TOOLS_BY_DIAMETER, fact.getKind());
        assertEquals(List.of("T-101"), fact.getItems());
        assertEquals("hybrid", response.getMode());
    }

    @Test
    void testEmbeddingOutageFallsBackToNaive() {
        when(embeddingService.isConfigured()).thenReturn(false);

        QueryResponse response = resolver.resolve(request("矩形通孔粗加工", "hybrid"));

        assertEquals(QueryState.ANSWERED, response.getState());
        assertEquals(2, response.getTier());
        assertEquals("naive", response.getMode());
        assertEquals(ANSWER, response.getAnswer());
        assertTrue(response.isDegraded());
        assertFalse(response.getCitedUnits().isEmpty());
        assertEquals(1, response.getDescents().size());
        assertTrue(response.getDescents().get(0).getReason().startsWith("embedding service unavailable"));
    }

    @Test
    void testQueryEmbeddingFailureFallsBackToNaive() {
        knowledgeIndexService.build();
        when(embeddingService.embed("圆柱通孔精加工")).thenThrow(
                new RetrievalServiceUnavailableException(RetrievalServiceUnavailableException.Service.EMBEDDING, "timeout"));

        QueryResponse response = resolver.resolve(request("圆柱通孔精加工", "global"));

        assertEquals(2, response.getTier());
        assertEquals("naive", response.getMode());
    }

    @Test
    void testGenerationOutageAnswersFromGraph() {
        when(generationService.generate(anyString(), anyString())).thenThrow(
                new RetrievalServiceUnavailableException(RetrievalServiceUnavailableException.Service.GENERATION, "503"));

        QueryResponse response = resolver.resolve(request("直径10mm的刀具", "hybrid"));

        assertEquals(QueryState.ANSWERED, response.getState());
        assertEquals(3, response.getTier());
        assertTrue(response.isDegraded());
        assertNull(response.getMode());
        assertTrue(response.getAnswer().startsWith("根据知识图谱：\n直径为10mm的刀具：T-101 D10平底立铣刀"));
        assertEquals(2, response.getDescents().size());
        assertEquals("skipped: generation service unavailable", response.getDescents().get(1).getReason());
    }

    @Test
    void testGenerationOutageWithoutEntitiesAnswersFromIndex() {
        when(generationService.generate(anyString(), anyString())).thenThrow(
                new RetrievalServiceUnavailableException(RetrievalServiceUnavailableException.Service.GENERATION, "503"));

        QueryResponse response = resolver.resolve(request("余量0.5mm铣削", "naive"));

        assertEquals(3, response.getTier());
        assertEquals("naive", response.getMode());
        assertTrue(response.getAnswer().startsWith("根据知识库检索结果：\n[1] "));
        assertFalse(response.getCitedUnits().isEmpty());
    }

    @Test
    void testLostStoreKeepsIndexContext() {
        knowledgeIndexService.build();
        graphStore.setAvailable(false);

        QueryResponse response = resolver.resolve(request("直径10mm的刀具", "hybrid"));

        assertEquals(QueryState.ANSWERED, response.getState());
        assertEquals(1, response.getTier());
        assertTrue(response.getGraphFacts().isEmpty());
        assertFalse(response.getCitedUnits().isEmpty());
    }

    @Test
    void testTotalOutageReturnsStaticMessage() {
        graphStore.setAvailable(false);
        when(embeddingService.isConfigured()).thenReturn(false);
        when(generationService.generate(anyString(), anyString())).thenThrow(
                new RetrievalServiceUnavailableException(RetrievalServiceUnavailableException.Service.GENERATION, "down"));

        QueryResponse response = resolver.resolve(request("矩形通孔粗加工", "hybrid"));

        assertEquals(QueryState.DEGRADED, response.getState());
        assertEquals(4, response.getTier());
        assertEquals("抱歉，查询系统暂时不可用。", response.getAnswer());
        assertTrue(response.isDegraded());
        assertEquals(3, response.getDescents().size());
        assertTrue(response.getDescents().get(0).getReason().startsWith("graph store unavailable"));
        assertTrue(response.getDescents().get(1).getReason().startsWith("skipped: "));
        assertTrue(response.getDescents().get(2).getReason().startsWith("skipped: "));
        verify(generationService, never()).generate(anyString(), anyString());
    }

    @Test
    void testEmptyGraphReturnsNoKnowledgeMessage() {
        graphStore = new InMemoryGraphStore();
        resolver = newResolver();

        QueryResponse response = resolver.resolve(request("螺纹孔怎么加工", "hybrid"));

        assertEquals(QueryState.DEGRADED, response.getState());
        assertEquals(4, response.getTier());
        assertEquals("未在知识库中找到相关信息。", response.getAnswer());
        assertTrue(response.getDescents().get(0).getReason().startsWith("no knowledge indexed: "));
    }

    @Test
    void testUnmatchedQuestionReturnsNoKnowledgeMessage() {
        QueryResponse response = resolver.resolve(request("xyzzy", "naive"));

        assertEquals(4, response.getTier());
        assertEquals("未在知识库中找到相关信息。", response.getAnswer());
        assertEquals("skipped: naive mode already tried", response.getDescents().get(1).getReason());
    }

    @Test
    void testBlankStaticMessageFailsTheQuery() {
        retrievalProperties.setStaticFallbackMessage(" ");
        graphStore.setAvailable(false);

        QueryResponse response = resolver.resolve(request("矩形通孔粗加工", "hybrid"));

        assertEquals(QueryState.FAILED, response.getState());
        assertTrue(response.getError().startsWith("No fallback tier produced an answer"));
        assertEquals(response.getError(), response.getAnswer());
        assertEquals(4, response.getDescents().size());
    }

    @Test
    void testCancellationBeforeStartPropagates() {
        QueryCancelledException e = assertThrows(QueryCancelledException.class,
                () -> resolver.resolve(request("矩形通孔粗加工", "hybrid"), () -> true));

        assertEquals(QueryState.RECEIVED, e.getState());
    }

    @Test
    void testCancellationDuringGenerationPropagates() {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(generationService.generate(anyString(), anyString())).thenAnswer(invocation -> {
            cancelled.set(true);
            return ANSWER;
        });

        QueryCancelledException e = assertThrows(QueryCancelledException.class,
                () -> resolver.resolve(request("矩形通孔粗加工", "hybrid"), cancelled::get));

        assertEquals(QueryState.CONTEXT_ASSEMBLED, e.getState());
    }

    @Test
    void testUnknownModeUsesDefault() {
        QueryResponse response = resolver.resolve(request("矩形通孔粗加工", "fuzzy"));

        assertEquals("hybrid", response.getMode());
        assertEquals(1, response.getTier());
    }

    private QueryResolver newResolver() {
        EmbeddingProperties embeddingProperties = new EmbeddingProperties();
        embeddingProperties.setModel("test-model");
        IndexProperties indexProperties = new IndexProperties();
        indexProperties.setPersist(false);
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        knowledgeIndexService = new KnowledgeIndexService(graphStore, embeddingService, embeddingProperties,
                indexProperties, new IndexCacheStore(indexProperties, objectMapper), new ContentHashService(),
                objectMapper);

        RetrievalEngine retrievalEngine = new RetrievalEngine(embeddingService, retrievalProperties);
        GraphTraversalService graphTraversalService = new GraphTraversalService(graphStore,
                new QuestionInterpreter(retrievalProperties), new MachiningAdvisorService(graphStore),
                retrievalProperties);
        PromptTemplateService promptTemplateService = new PromptTemplateService(new DefaultResourceLoader());
        ReflectionTestUtils.setField(promptTemplateService, "answerPromptPath",
                "classpath:prompts/answer-system-prompt.txt");
        promptTemplateService.loadPromptTemplate();

        List<AnswerTier> tiers = List.of(
                new RequestedModeTier(knowledgeIndexService, retrievalEngine, graphTraversalService,
                        promptTemplateService, generationService),
                new NaiveTier(knowledgeIndexService, retrievalEngine, graphTraversalService,
                        promptTemplateService, generationService),
                new GraphTraversalTier(graphTraversalService, knowledgeIndexService, retrievalEngine),
                new StaticMessageTier(retrievalProperties));
        return new QueryResolver(tiers, retrievalProperties);
    }

    private static QueryRequest request(String question, String mode) {
        return QueryRequest.builder().question(question).mode(mode).build();
    }
}
