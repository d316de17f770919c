package com.machining.kg.graph.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;

/**
 * Machining feature type, e.g. "圆柱通孔" or "矩形凹槽".
 */
@Node("Feature")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureNode {

    @Id
    private String key; // hash of the normalised name

    private String name;
    private String featureId; // feature id of the first row that introduced this feature
    private String category;  // FeatureCategory name, e.g. HOLE
}
