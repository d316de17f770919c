package com.machining.kg.schema;

import java.util.List;

/**
 * A documented column of a source table.
 * The first header name is the canonical one; the rest are accepted aliases.
 */
public interface SourceColumn {

    List<String> headerNames();

    boolean isRequired();

    default String canonicalName() {
        return headerNames().get(0);
    }
}
