package com.machining.kg.schema;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

/**
 * One data row of a source table, cells keyed by column.
 * {@code rowNumber} is the 1-based line in the file (the header is line 1).
 */
@Getter
@ToString
public class SourceRow {

    private final SourceTable table;
    private final long rowNumber;
    private final Map<SourceColumn, String> cells;

    public SourceRow(SourceTable table, long rowNumber, Map<SourceColumn, String> cells) {
        this.table = table;
        this.rowNumber = rowNumber;
        this.cells = Collections.unmodifiableMap(cells);
    }

    public String get(SourceColumn column) {
        return cells.get(column);
    }
}
