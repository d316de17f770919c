package com.machining.kg.graph.repository;

import com.machining.kg.graph.node.ProcessTypeNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProcessTypeNodeRepository extends Neo4jRepository<ProcessTypeNode, String> {

    @Query("MATCH (t:ProcessType) RETURN t.name ORDER BY t.name")
    List<String> findAllNames();
}
