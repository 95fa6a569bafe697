package fr.lapetina.aigateway.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Canonical completion result. Immutable; the {@code with*} methods return modified copies.
 */
public record CompletionResult(
        String requestId,
        String provider,
        String model,
        String content,
        TokenUsage usage,
        BigDecimal cost,
        long latencyMs,
        boolean cached,
        String finishReason,
        boolean budgetWarning
) {
    public CompletionResult {
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(content, "Content is required");
        if (usage == null) {
            usage = TokenUsage.EMPTY;
        }
        if (cost == null) {
            cost = BigDecimal.ZERO;
        }
    }

    /**
     * Result freshly returned by a provider, before pricing.
     */
    public static CompletionResult fromProvider(
            String requestId,
            String provider,
            String model,
            String content,
            TokenUsage usage,
            long latencyMs,
            String finishReason
    ) {
        return new CompletionResult(requestId, provider, model, content, usage,
                BigDecimal.ZERO, latencyMs, false, finishReason, false);
    }

    public CompletionResult withCost(BigDecimal newCost) {
        return new CompletionResult(requestId, provider, model, content, usage,
                newCost, latencyMs, cached, finishReason, budgetWarning);
    }

    public CompletionResult withBudgetWarning(boolean warning) {
        return new CompletionResult(requestId, provider, model, content, usage,
                cost, latencyMs, cached, finishReason, warning);
    }

    /**
     * Copy served from cache to another request: no provider contact, no latency, no cost.
     */
    public CompletionResult asCachedFor(String newRequestId, long lookupLatencyMs) {
        return new CompletionResult(newRequestId, provider, model, content, usage,
                BigDecimal.ZERO, lookupLatencyMs, true, finishReason, false);
    }
}
