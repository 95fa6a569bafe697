package fr.lapetina.aigateway.infrastructure.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Raised once per window when consumption crosses the alert threshold.
 */
public record BudgetAlert(
        BudgetPeriod period,
        BigDecimal consumed,
        BigDecimal limit,
        double threshold,
        Instant triggeredAt
) {
}
