package com.machining.kg.graph.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;

@Node("ProcessStage")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessStageNode {

    @Id
    private String name; // e.g., "粗加工", "半精加工", "精加工", "清根"
}
