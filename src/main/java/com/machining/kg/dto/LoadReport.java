package com.machining.kg.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one graph load.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoadReport {

    public enum Status {
        COMPLETED,
        ABORTED
    }

    private LoadMode mode;
    private Status status = Status.COMPLETED;
    private Instant startedAt = Instant.now();
    private long durationMs;

    private Map<String, TableLoadStats> tables = new LinkedHashMap<>();
    private WriteCounts writes = WriteCounts.empty();

    private long violationCount;
    /** First violations only, see machining.loader.max-reported-violations */
    private List<String> violations = new ArrayList<>();

    private String error;

    public LoadReport(LoadMode mode) {
        this.mode = mode;
    }

    public TableLoadStats table(String tableName) {
        return tables.computeIfAbsent(tableName, name -> new TableLoadStats());
    }

    public long getRowsSkipped() {
        return tables.values().stream().mapToLong(TableLoadStats::getRowsSkipped).sum();
    }

    public long getRowsWritten() {
        return tables.values().stream().mapToLong(TableLoadStats::getRowsWritten).sum();
    }
}
