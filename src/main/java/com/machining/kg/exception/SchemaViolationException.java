package com.machining.kg.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A source row (or a table header) that cannot be mapped to graph nodes.
 */
@Getter
public class SchemaViolationException extends MachiningKgException {

    private final String table;
    private final long rowNumber;
    private final String column;

    public SchemaViolationException(String table, long rowNumber, String column, String message) {
        super(ErrorCode.SCHEMA_VIOLATION, message, context(table, rowNumber, column), null);
        this.table = table;
        this.rowNumber = rowNumber;
        this.column = column;
    }

    private static Map<String, Object> context(String table, long rowNumber, String column) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("table", table);
        context.put("row", rowNumber);
        if (column != null) {
            context.put("column", column);
        }
        return context;
    }
}
