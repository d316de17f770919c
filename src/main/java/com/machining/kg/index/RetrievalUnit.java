package com.machining.kg.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One indexed passage: a Process denormalised with its Feature, stage, type and tools.
 * The unit id is the process key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalUnit {

    private String unitId;
    private String templateId;
    private String featureName;
    private String featureCategory;
    private String stage;
    private String processType;
    private String surfaceType;

    @Builder.Default
    private List<String> toolIds = new ArrayList<>();

    private String text;

    /** SHA-256 of {@link #text}, used to reuse embeddings across rebuilds */
    private String contentHash;
}
