package com.machining.kg.graph.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;

/**
 * Cutting tool. Dimensions are millimetres.
 * The RECOMMENDED_FOR relationships are read through traversal queries rather than
 * mapped here, so loading a tool never pulls its processes.
 */
@Node("Tool")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolNode {

    @Id
    private String toolId;

    private String name;
    private Double diameter;
    private Double cornerRadius;
    private Integer fluteCount;
    private Double stickOutLength;
}
