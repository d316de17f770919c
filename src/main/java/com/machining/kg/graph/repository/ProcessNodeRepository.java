package com.machining.kg.graph.repository;

import com.machining.kg.graph.node.ProcessNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProcessNodeRepository extends Neo4jRepository<ProcessNode, String> {

    /**
     * Process templates of a feature, optionally narrowed by surface and stage.
     * A surface matches either the surface type or the feature surface column.
     */
    @Query("MATCH (p:Process)-[:PROCESSES]->(f:Feature {name: $featureName}) " +
           "WHERE ($surface IS NULL OR p.surfaceType = $surface OR p.featureSurface = $surface) " +
           "AND ($stage IS NULL OR p.stage = $stage) " +
           "RETURN p ORDER BY p.templateId, p.featureId")
    List<ProcessNode> findByFeature(
            @Param("featureName") String featureName,
            @Param("surface") String surface,
            @Param("stage") String stage);

    @Query("MATCH (:Tool {toolId: $toolId})-[:RECOMMENDED_FOR]->(p:Process) " +
           "RETURN p ORDER BY p.templateId, p.featureId")
    List<ProcessNode> findRecommendedForTool(@Param("toolId") String toolId);
}
