package fr.lapetina.aigateway.infrastructure.ledger;

import java.math.BigDecimal;

/**
 * Snapshot of one budget window.
 *
 * @param limit     configured limit, or null when the period is unlimited
 * @param remaining limit minus used, floored at zero; null when unlimited
 */
public record BudgetWindowStatus(
        BudgetPeriod period,
        BigDecimal used,
        BigDecimal limit,
        BigDecimal remaining,
        double percentUsed,
        boolean alertTriggered,
        boolean exceeded
) {
}
