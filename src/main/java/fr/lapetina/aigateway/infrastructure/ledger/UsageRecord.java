package fr.lapetina.aigateway.infrastructure.ledger;

import fr.lapetina.aigateway.domain.model.CompletionResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One row of the usage ledger. Append-only; identified by the request id.
 */
public record UsageRecord(
        String requestId,
        String providerId,
        String model,
        int inputTokens,
        int outputTokens,
        BigDecimal cost,
        long latencyMs,
        Instant timestamp,
        boolean success
) {
    public UsageRecord {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(timestamp, "Timestamp is required");
        if (cost == null) {
            cost = BigDecimal.ZERO;
        }
        if (cost.signum() < 0) {
            throw new IllegalArgumentException("Cost must be non-negative: " + cost);
        }
    }

    /**
     * Ledger row for a priced, successful completion.
     */
    public static UsageRecord of(CompletionResult result, Instant timestamp) {
        return new UsageRecord(
                result.requestId(),
                result.provider(),
                result.model(),
                result.usage().inputTokens(),
                result.usage().outputTokens(),
                result.cost(),
                result.latencyMs(),
                timestamp,
                true
        );
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
