package com.machining.kg.dto;

import java.util.Locale;

public enum LoadMode {

    /** Delete every managed node and relationship, then upsert all rows */
    FULL_REBUILD,

    /** Upsert by key, never delete */
    INCREMENTAL;

    /**
     * Parse "full_rebuild", "full-rebuild", "INCREMENTAL" ...
     */
    public static LoadMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FULL_REBUILD;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (LoadMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown load mode '" + value + "', expected full_rebuild or incremental");
    }
}
