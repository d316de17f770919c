package com.machining.kg.controller;

import com.machining.kg.dto.GraphStatistics;
import com.machining.kg.dto.LoadMode;
import com.machining.kg.dto.LoadReport;
import com.machining.kg.dto.MachiningRecommendation;
import com.machining.kg.graph.node.FeatureNode;
import com.machining.kg.graph.node.ProcessNode;
import com.machining.kg.graph.node.ToolNode;
import com.machining.kg.graph.store.GraphStore;
import com.machining.kg.service.GraphLoaderService;
import com.machining.kg.service.MachiningAdvisorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for loading and querying the knowledge graph
 */
@RestController
@RequestMapping("/api/graph")
@Tag(name = "Knowledge Graph", description = "Load source tables and look up features, processes and tools")
@RequiredArgsConstructor
@Slf4j
public class KnowledgeGraphController {

    private final GraphLoaderService graphLoaderService;
    private final GraphStore graphStore;
    private final MachiningAdvisorService machiningAdvisorService;

    /**
     * Load the configured process and tool tables
     */
    @PostMapping("/load")
    @Operation(summary = "Load source tables",
            description = "mode=full_rebuild deletes the managed graph first; mode=incremental only upserts")
    public ResponseEntity<LoadReport> load(@RequestParam(defaultValue = "incremental") String mode) {
        LoadMode loadMode = LoadMode.fromValue(mode);
        log.info("Graph load requested via API: {}", loadMode);
        return ResponseEntity.ok(graphLoaderService.loadConfiguredSources(loadMode));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Node and relationship counts per label and type")
    public GraphStatistics statistics() {
        return graphStore.statistics();
    }

    @GetMapping("/features")
    @Operation(summary = "All features, ordered by name")
    public List<FeatureNode> features() {
        return graphStore.findFeatures();
    }

    @GetMapping("/stages")
    public List<String> stages() {
        return graphStore.findStageNames();
    }

    @GetMapping("/process-types")
    public List<String> processTypes() {
        return graphStore.findProcessTypeNames();
    }

    /**
     * All tools, or tools of one diameter
     */
    @GetMapping("/tools")
    public List<ToolNode> tools(@RequestParam(required = false) Double diameter) {
        if (diameter != null) {
            return graphStore.findToolsByDiameter(diameter);
        }
        return graphStore.findTools();
    }

    @GetMapping("/features/{name}/tools")
    public List<ToolNode> toolsForFeature(@PathVariable String name) {
        return graphStore.findToolsForFeature(name);
    }

    @GetMapping("/features/{name}/processes")
    public List<ProcessNode> processesForFeature(@PathVariable String name,
                                                 @RequestParam(required = false) String surface,
                                                 @RequestParam(required = false) String stage) {
        return graphStore.findProcesses(name, surface, stage);
    }

    /**
     * Template and tool recommendation for a feature of given size.
     * Example: feature=矩形凹槽&stage=粗加工&length=40&width=20&height=15
     */
    @GetMapping("/recommendation")
    @Operation(summary = "Recommend a process template and tool for a feature")
    public MachiningRecommendation recommendation(@RequestParam String feature,
                                                  @RequestParam(required = false) String surface,
                                                  @RequestParam(required = false) String stage,
                                                  @RequestParam(required = false) Double length,
                                                  @RequestParam(required = false) Double width,
                                                  @RequestParam(required = false) Double height) {
        return machiningAdvisorService.recommend(feature, surface, stage, length, width, height);
    }
}
