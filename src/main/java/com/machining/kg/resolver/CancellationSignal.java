package com.machining.kg.resolver;

/**
 * Lets a caller abandon a query; checked at every state boundary.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();
}
