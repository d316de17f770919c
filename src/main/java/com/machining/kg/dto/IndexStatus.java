package com.machining.kg.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * State of the knowledge index; build fields are filled only right after a build.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexStatus {

    private boolean available;
    private boolean stale;
    private int units;
    private int embeddedUnits;
    private int lexicalOnlyUnits;
    private String embeddingModel;
    private String lexicalDigest;
    private Instant builtAt;

    private Long buildDurationMs;
    private Integer reusedEmbeddings;
    private Integer failedEmbeddings;
}
