package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A mapped tool row. Dimensions are millimetres.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolRecord {

    private long rowNumber;

    private String toolId;
    private String name;
    private double diameter;
    private double cornerRadius;
    private int fluteCount;
    private double stickOutLength;

    /**
     * Template ids of the processes this tool is recommended for
     */
    @Builder.Default
    private List<String> recommendedTemplateIds = new ArrayList<>();
}
