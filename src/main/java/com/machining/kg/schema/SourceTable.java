package com.machining.kg.schema;

import com.machining.kg.exception.SchemaViolationException;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The two tabular sources the graph is built from.
 */
public enum SourceTable {

    PROCESSES("processes", ProcessColumn.values()),
    TOOLS("tools", ToolColumn.values());

    private final String tableName;
    private final List<SourceColumn> columns;

    SourceTable(String tableName, SourceColumn[] columns) {
        this.tableName = tableName;
        this.columns = List.of(columns);
    }

    public String tableName() {
        return tableName;
    }

    public List<SourceColumn> columns() {
        return columns;
    }

    /**
     * Match a header line against the documented columns.
     * Unknown header cells are ignored, optional columns may be absent.
     *
     * @return position of every recognised column in the header
     * @throws SchemaViolationException if a required column is missing
     */
    public Map<SourceColumn, Integer> resolveHeader(String[] header) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < header.length; i++) {
            positions.putIfAbsent(normalizeHeader(header[i]), i);
        }

        Map<SourceColumn, Integer> resolved = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (SourceColumn column : columns) {
            Integer position = column.headerNames().stream()
                    .map(SourceTable::normalizeHeader)
                    .map(positions::get)
                    .filter(p -> p != null)
                    .findFirst()
                    .orElse(null);
            if (position != null) {
                resolved.put(column, position);
            } else if (column.isRequired()) {
                missing.add(column.canonicalName());
            }
        }

        if (!missing.isEmpty()) {
            throw new SchemaViolationException(tableName, 1, String.join(",", missing),
                    String.format("Table '%s' header %s is missing required column(s) %s",
                            tableName, Arrays.toString(header), missing));
        }
        return resolved;
    }

    static String normalizeHeader(String cell) {
        if (cell == null) {
            return "";
        }
        String value = cell.replace("\uFEFF", "");
        return Normalizer.normalize(value, Normalizer.Form.NFKC).trim().toLowerCase(Locale.ROOT);
    }
}
