package com.machining.kg.resolver;

import java.util.Optional;

/**
 * One step of the fallback chain. Tiers are tried in {@link org.springframework.core.annotation.Order}
 * order; a tier that throws hands the query to the next one.
 */
public interface AnswerTier {

    int tier();

    String name();

    /**
     * @return why this tier cannot help given what earlier tiers found out, or empty to run it
     */
    Optional<String> skipReason(ResolutionContext context);

    /**
     * Produce an answer. Leaves the context in MODE_SELECTED or CONTEXT_ASSEMBLED;
     * the resolver enters the terminal state.
     */
    TierAnswer answer(ResolutionContext context);
}
