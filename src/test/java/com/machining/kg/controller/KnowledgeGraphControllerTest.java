package com.machining.kg.controller;

import com.machining.kg.dto.LoadMode;
import com.machining.kg.dto.LoadReport;
import com.machining.kg.exception.GlobalExceptionHandler;
import com.machining.kg.exception.StoreUnavailableException;
import com.machining.kg.graph.node.ToolNode;
import com.machining.kg.graph.store.GraphStore;
import com.machining.kg.service.GraphLoaderService;
import com.machining.kg.service.MachiningAdvisorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class KnowledgeGraphControllerTest {

    private GraphLoaderService graphLoaderService;
    private GraphStore graphStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        graphLoaderService = mock(GraphLoaderService.class);
        graphStore = mock(GraphStore.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new KnowledgeGraphController(graphLoaderService, graphStore,
                        new MachiningAdvisorService(graphStore)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testLoadDefaultsToIncremental() throws Exception {
        when(graphLoaderService.loadConfiguredSources(LoadMode.INCREMENTAL)).thenReturn(new LoadReport(LoadMode.INCREMENTAL));

        mockMvc.perform(post("/api/graph/load"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("INCREMENTAL"))
                .andExpect(jsonPath("$.status").value("COMPLETED"));

        verify(graphLoaderService).loadConfiguredSources(LoadMode.INCREMENTAL);
    }

    @Test
    void testFullRebuildMode() throws Exception {
        when(graphLoaderService.loadConfiguredSources(LoadMode.FULL_REBUILD)).thenReturn(new LoadReport(LoadMode.FULL_REBUILD));

        mockMvc.perform(post("/api/graph/load").param("mode", "full-rebuild"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("FULL_REBUILD"));
    }

    @Test
    void testUnknownLoadModeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/graph/load").param("mode", "append"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(graphLoaderService);
    }

    @Test
    void testUnreachableStoreIsServiceUnavailable() throws Exception {
        when(graphLoaderService.loadConfiguredSources(LoadMode.INCREMENTAL))
                .thenThrow(new StoreUnavailableException("Connection refused", null));

        mockMvc.perform(post("/api/graph/load"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
    }

    @Test
    void testToolsByDiameter() throws Exception {
        when(graphStore.findToolsByDiameter(10.0)).thenReturn(List.of(ToolNode.builder()
                .toolId("T-101").name("D10平底立铣刀").diameter(10.0).fluteCount(4).stickOutLength(40.0).build()));

        mockMvc.perform(get("/api/graph/tools").param("diameter", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].toolId").value("T-101"))
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void testRecommendationRequiresFeature() throws Exception {
        mockMvc.perform(get("/api/graph/recommendation").param("feature", " "))
                .andExpect(status().isBadRequest());
    }
}
