package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Store-side counters of one or more write statements.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WriteCounts {

    private long nodesCreated;
    private long nodesDeleted;
    private long relationshipsCreated;
    private long relationshipsDeleted;
    private long propertiesSet;

    public static WriteCounts empty() {
        return new WriteCounts();
    }

    public void add(WriteCounts other) {
        nodesCreated += other.nodesCreated;
        nodesDeleted += other.nodesDeleted;
        relationshipsCreated += other.relationshipsCreated;
        relationshipsDeleted += other.relationshipsDeleted;
        propertiesSet += other.propertiesSet;
    }

    public boolean containsUpdates() {
        return nodesCreated + nodesDeleted + relationshipsCreated + relationshipsDeleted + propertiesSet > 0;
    }
}
