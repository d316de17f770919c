package com.machining.kg.resolver.tier;

import com.machining.kg.config.RetrievalProperties;
import com.machining.kg.resolver.AnswerTier;
import com.machining.kg.resolver.QueryState;
import com.machining.kg.resolver.ResolutionContext;
import com.machining.kg.resolver.TierAnswer;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last resort: a configured message. "No relevant knowledge" when the tier before gave up
 * because nothing matched, the apology otherwise.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class StaticMessageTier implements AnswerTier {

    private final RetrievalProperties retrievalProperties;

    @Override
    public int tier() {
        return 4;
    }

    @Override
    public String name() {
        return "static-message";
    }

    @Override
    public Optional<String> skipReason(ResolutionContext context) {
        return Optional.empty();
    }

    @Override
    public TierAnswer answer(ResolutionContext context) {
        String message = context.isLastFailureUnresolved()
                ? retrievalProperties.getNoKnowledgeMessage()
                : retrievalProperties.getStaticFallbackMessage();
        if (message == null || message.isBlank()) {
            throw new IllegalStateException("No static fallback message configured");
        }
        return TierAnswer.builder()
                .answer(message)
                .state(QueryState.DEGRADED)
                .build();
    }
}
