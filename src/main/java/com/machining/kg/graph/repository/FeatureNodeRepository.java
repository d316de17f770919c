package com.machining.kg.graph.repository;

import com.machining.kg.graph.node.FeatureNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FeatureNodeRepository extends Neo4jRepository<FeatureNode, String> {

    @Query("MATCH (f:Feature) RETURN f ORDER BY f.name")
    List<FeatureNode> findAllOrderByName();
}
