package com.machining.kg.graph.repository;

import com.machining.kg.graph.node.ProcessStageNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProcessStageNodeRepository extends Neo4jRepository<ProcessStageNode, String> {

    @Query("MATCH (s:ProcessStage) RETURN s.name ORDER BY s.name")
    List<String> findAllNames();
}
