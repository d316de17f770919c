package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A mapped process-template row: one Process node plus the Feature, ProcessStage
 * and ProcessType it links to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessRecord {

    private long rowNumber;

    private String processKey;
    private String templateId;
    private String featureId;
    private String componentSurface;
    private String featureSurface;
    private String surfaceType;
    private boolean sidewallFeature;
    private Double allowance; // null when the source cell is blank

    private String featureKey;
    private String featureName;
    private String featureCategory;

    private String stage;
    private String processType;
}
