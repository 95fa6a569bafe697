package fr.lapetina.aigateway.infrastructure.ledger;

import java.math.BigDecimal;

/**
 * Usage aggregated per provider and model over a time range.
 */
public record UsageSummary(
        String providerId,
        String model,
        long requests,
        long inputTokens,
        long outputTokens,
        BigDecimal cost
) {
    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
