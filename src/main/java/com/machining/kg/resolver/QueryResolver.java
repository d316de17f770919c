package com.machining.kg.resolver;

import com.machining.kg.config.RetrievalProperties;
import com.machining.kg.dto.CitedUnit;
import com.machining.kg.dto.QueryRequest;
import com.machining.kg.dto.QueryResponse;
import com.machining.kg.exception.IndexBuildException;
import com.machining.kg.exception.QueryCancelledException;
import com.machining.kg.exception.ResolutionFailureException;
import com.machining.kg.exception.RetrievalServiceUnavailableException;
import com.machining.kg.exception.StoreUnavailableException;
import com.machining.kg.index.ScoredUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Answers questions through the fallback chain of {@link AnswerTier}s.
 * <p>
 * Tiers run in order until one answers. Service, store and resolution failures send the query
 * down one tier and are reported as descents. Only caller cancellation escapes as an exception.
 */
@Service
@Slf4j
public class QueryResolver {

    private final List<AnswerTier> tiers;
    private final RetrievalProperties retrievalProperties;

    public QueryResolver(List<AnswerTier> tiers, RetrievalProperties retrievalProperties) {
        this.tiers = List.copyOf(tiers);
        this.retrievalProperties = retrievalProperties;
        log.info("Query fallback chain: {}", this.tiers.stream()
                .map(tier -> tier.tier() + ":" + tier.name())
                .collect(Collectors.joining(" -> ")));
    }

    public QueryResponse resolve(QueryRequest request) {
        return resolve(request, CancellationSignal.NONE);
    }

    /**
     * @throws QueryCancelledException if the signal fires at a state boundary
     */
    public QueryResponse resolve(QueryRequest request, CancellationSignal cancellationSignal) {
        String question = request.getQuestion() == null ? "" : request.getQuestion().trim();
        ResolutionContext context = new ResolutionContext(question, requestedMode(request), cancellationSignal);
        context.checkCancelled();
        log.info("Resolving question in {} mode: {}", context.getRequestedMode().value(), question);

        String lastError = null;
        for (AnswerTier tier : tiers) {
            String skipReason = tier.skipReason(context).orElse(null);
            if (skipReason != null) {
                context.skipped(tier, skipReason);
                log.info("Skipping tier {} ({}): {}", tier.tier(), tier.name(), skipReason);
                continue;
            }
            try {
                TierAnswer answer = tier.answer(context);
                context.transition(answer.getState());
                log.info("Question answered by tier {} ({}) in state {}", tier.tier(), tier.name(), answer.getState());
                return response(context, tier, answer);
            } catch (QueryCancelledException e) {
                log.info("Query cancelled at {}", e.getState());
                throw e;
            } catch (ResolutionFailureException e) {
                descend(context, tier, e.getMessage(), true);
            } catch (IndexBuildException e) {
                descend(context, tier, "no knowledge indexed: " + e.getMessage(), true);
            } catch (RetrievalServiceUnavailableException e) {
                if (e.getService() == RetrievalServiceUnavailableException.Service.GENERATION) {
                    context.markGenerationUnavailable();
                }
                descend(context, tier, e.getService().name().toLowerCase(Locale.ROOT) + " service unavailable: " + e.getMessage(), false);
            } catch (StoreUnavailableException e) {
                context.markStoreUnavailable();
                descend(context, tier, "graph store unavailable: " + e.getMessage(), false);
            } catch (RuntimeException e) {
                log.error("Tier {} ({}) failed unexpectedly", tier.tier(), tier.name(), e);
                lastError = e.getMessage();
                descend(context, tier, "unexpected error: " + e.getMessage(), false);
            }
        }

        context.transition(QueryState.FAILED);
        String error = "No fallback tier produced an answer" + (lastError != null ? ": " + lastError : "");
        log.error("Query failed: {}", error);
        return QueryResponse.builder()
                .question(question)
                .answer(error)
                .state(QueryState.FAILED)
                .degraded(true)
                .descents(new ArrayList<>(context.getDescents()))
                .error(error)
                .build();
    }

    private RetrievalMode requestedMode(QueryRequest request) {
        try {
            return RetrievalMode.fromValue(request.getMode(), retrievalProperties.getDefaultMode());
        } catch (IllegalArgumentException e) {
            log.warn("{}; using {}", e.getMessage(), retrievalProperties.getDefaultMode().value());
            return retrievalProperties.getDefaultMode();
        }
    }

    private void descend(ResolutionContext context, AnswerTier tier, String reason, boolean unresolved) {
        context.failed(tier, reason, unresolved);
        log.warn("Descending from tier {} ({}): {}", tier.tier(), tier.name(), reason);
    }

    private QueryResponse response(ResolutionContext context, AnswerTier tier, TierAnswer answer) {
        List<CitedUnit> cited = new ArrayList<>();
        for (ScoredUnit scored : answer.getUnits()) {
            cited.add(CitedUnit.builder()
                    .unitId(scored.getUnit().getUnitId())
                    .templateId(scored.getUnit().getTemplateId())
                    .featureName(scored.getUnit().getFeatureName())
                    .stage(scored.getUnit().getStage())
                    .processType(scored.getUnit().getProcessType())
                    .score(scored.getScore())
                    .lexicalOnly(scored.isLexicalOnly())
                    .build());
        }
        return QueryResponse.builder()
                .question(context.getQuestion())
                .answer(answer.getAnswer())
                .state(answer.getState())
                .mode(answer.getMode() != null ? answer.getMode().value() : null)
                .tier(tier.tier())
                .tierName(tier.name())
                .degraded(tier.tier() > 1 || answer.getState() != QueryState.ANSWERED)
                .citedUnits(cited)
                .graphFacts(new ArrayList<>(answer.getFacts()))
                .descents(new ArrayList<>(context.getDescents()))
                .build();
    }
}
