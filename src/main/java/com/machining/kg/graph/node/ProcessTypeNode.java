package com.machining.kg.graph.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;

@Node("ProcessType")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessTypeNode {

    @Id
    private String name; // e.g., "底壁铣", "平面轮廓铣" - serves as natural key
}
