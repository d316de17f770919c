package com.machining.kg.graph.node;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;
import org.springframework.data.neo4j.core.schema.Relationship;

/**
 * One process-template row: how a feature is machined in one stage.
 * Stage and type are kept as properties as well as relationships so traversal
 * queries can filter without an extra hop.
 */
@Node("Process")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessNode {

    @Id
    private String key; // hash of (templateId, featureId)

    private String templateId;
    private String featureId;
    private String featureName;
    private String componentSurface;
    private String featureSurface;
    private String surfaceType;
    private Boolean sidewallFeature;
    private Double allowance;
    private String stage;
    private String processType;

    @Relationship(type = "PROCESSES", direction = Relationship.Direction.OUTGOING)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private FeatureNode feature;

    @Relationship(type = "IN_STAGE", direction = Relationship.Direction.OUTGOING)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ProcessStageNode stageNode;

    @Relationship(type = "HAS_TYPE", direction = Relationship.Direction.OUTGOING)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ProcessTypeNode typeNode;
}
