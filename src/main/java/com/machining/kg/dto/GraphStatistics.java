package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Node counts per managed label and relationship counts per type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStatistics {

    @Builder.Default
    private Map<String, Long> nodes = new TreeMap<>();

    @Builder.Default
    private Map<String, Long> relationships = new TreeMap<>();

    public long nodeCount(String label) {
        return nodes.getOrDefault(label, 0L);
    }

    public long relationshipCount(String type) {
        return relationships.getOrDefault(type, 0L);
    }

    public long getTotalNodes() {
        return nodes.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getTotalRelationships() {
        return relationships.values().stream().mapToLong(Long::longValue).sum();
    }
}
