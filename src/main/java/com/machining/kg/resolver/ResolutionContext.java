package com.machining.kg.resolver;

import com.machining.kg.dto.GraphFact;
import com.machining.kg.dto.TierDescent;
import com.machining.kg.exception.QueryCancelledException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-query state shared by the answer tiers. Lives only for one {@link QueryResolver#resolve} call.
 */
@Slf4j
@Getter
public class ResolutionContext {

    private final String question;
    private final RetrievalMode requestedMode;
    private final CancellationSignal cancellationSignal;

    private QueryState state = QueryState.RECEIVED;
    private RetrievalMode selectedMode;
    private final List<TierDescent> descents = new ArrayList<>();

    private boolean generationUnavailable;
    private boolean storeUnavailable;
    private boolean lastFailureUnresolved;

    /** Graph facts for the question, null until looked up successfully */
    private List<GraphFact> facts;

    public ResolutionContext(String question, RetrievalMode requestedMode, CancellationSignal cancellationSignal) {
        this.question = question;
        this.requestedMode = requestedMode;
        this.cancellationSignal = cancellationSignal != null ? cancellationSignal : CancellationSignal.NONE;
    }

    /**
     * Enter a state, abandoning the query first if the caller cancelled it.
     *
     * @throws QueryCancelledException if the caller cancelled
     * @throws IllegalStateException if the query already terminated
     */
    public void transition(QueryState next) {
        checkCancelled();
        if (state.isTerminal()) {
            throw new IllegalStateException("Query already terminated in " + state + ", cannot enter " + next);
        }
        log.debug("Query state {} -> {}", state, next);
        state = next;
    }

    /**
     * Enter MODE_SELECTED with the given mode; null for tiers that do not retrieve from the index.
     */
    public void selectMode(RetrievalMode mode) {
        transition(QueryState.MODE_SELECTED);
        selectedMode = mode;
    }

    public void checkCancelled() {
        if (cancellationSignal.isCancelled()) {
            throw new QueryCancelledException(state);
        }
    }

    void skipped(AnswerTier tier, String reason) {
        descents.add(TierDescent.builder().tier(tier.tier()).tierName(tier.name()).reason("skipped: " + reason).build());
    }

    void failed(AnswerTier tier, String reason, boolean unresolved) {
        descents.add(TierDescent.builder().tier(tier.tier()).tierName(tier.name()).reason(reason).build());
        lastFailureUnresolved = unresolved;
    }

    public void markGenerationUnavailable() {
        generationUnavailable = true;
    }

    public void markStoreUnavailable() {
        storeUnavailable = true;
    }

    public void rememberFacts(List<GraphFact> facts) {
        this.facts = Collections.unmodifiableList(new ArrayList<>(facts));
    }

    public boolean hasFacts() {
        return facts != null;
    }
}
