package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CitedUnit {
    private String unitId;
    private String templateId;
    private String featureName;
    private String stage;
    private String processType;
    private double score;
    private boolean lexicalOnly;
}
