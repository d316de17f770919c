package com.machining.kg.resolver;

/**
 * Lifecycle of one query.
 * MODE_SELECTED may be re-entered when the resolver descends to a simpler tier.
 */
public enum QueryState {
    RECEIVED,
    MODE_SELECTED,
    CONTEXT_ASSEMBLED,
    ANSWERED,
    DEGRADED,
    FAILED;

    public boolean isTerminal() {
        return this == ANSWERED || this == DEGRADED || this == FAILED;
    }
}
