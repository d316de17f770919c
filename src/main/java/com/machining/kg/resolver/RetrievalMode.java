package com.machining.kg.resolver;

import java.util.Locale;

public enum RetrievalMode {

    /** Lexical BM25 top-k */
    NAIVE(false),

    /** Embedding similarity over units linked to entities named in the question */
    LOCAL(true),

    /** Embedding similarity over every unit */
    GLOBAL(true),

    /** Local, global and lexical candidates re-ranked by a combined score */
    HYBRID(true);

    private final boolean requiresEmbedding;

    RetrievalMode(boolean requiresEmbedding) {
        this.requiresEmbedding = requiresEmbedding;
    }

    public boolean requiresEmbedding() {
        return requiresEmbedding;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the matching mode, or {@code defaultMode} for null/blank input
     * @throws IllegalArgumentException for an unknown mode name
     */
    public static RetrievalMode fromValue(String value, RetrievalMode defaultMode) {
        if (value == null || value.isBlank()) {
            return defaultMode;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown retrieval mode '" + value
                    + "', expected naive, local, global or hybrid");
        }
    }
}
