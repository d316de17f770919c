package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.core.io.Resource;

/**
 * The two source tables of a load. A null table is not read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceFiles {
    private Resource processes;
    private Resource tools;
}
