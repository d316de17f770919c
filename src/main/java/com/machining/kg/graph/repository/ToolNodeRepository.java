package com.machining.kg.graph.repository;

import com.machining.kg.graph.node.ToolNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ToolNodeRepository extends Neo4jRepository<ToolNode, String> {

    @Query("MATCH (t:Tool) RETURN t ORDER BY t.toolId")
    List<ToolNode> findAllOrderByToolId();

    @Query("MATCH (t:Tool) WHERE abs(t.diameter - $diameter) <= $tolerance RETURN t ORDER BY t.toolId")
    List<ToolNode> findByDiameter(@Param("diameter") double diameter, @Param("tolerance") double tolerance);

    @Query("MATCH (t:Tool)-[:RECOMMENDED_FOR]->(:Process)-[:PROCESSES]->(:Feature {name: $featureName}) " +
           "RETURN DISTINCT t ORDER BY t.toolId")
    List<ToolNode> findRecommendedForFeature(@Param("featureName") String featureName);

    /**
     * Tools that fit a pocket of the given width and reach its depth:
     * widest first, then shortest stick-out
     */
    @Query("MATCH (t:Tool) WHERE t.diameter <= $diameterLimit AND t.stickOutLength > $height " +
           "RETURN t ORDER BY t.diameter DESC, t.stickOutLength ASC, t.toolId")
    List<ToolNode> findSuitable(@Param("diameterLimit") double diameterLimit, @Param("height") double height);
}
