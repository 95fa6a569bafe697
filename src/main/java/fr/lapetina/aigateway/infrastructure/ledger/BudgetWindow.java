package fr.lapetina.aigateway.infrastructure.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Running total of one budget period. Not thread-safe; guarded by the owning tracker's lock.
 */
final class BudgetWindow {

    private final BudgetPeriod period;
    private final BigDecimal limit;
    private final BigDecimal alertLevel;
    private Instant start;
    private BigDecimal consumed = BigDecimal.ZERO;
    private boolean alertTriggered;

    BudgetWindow(BudgetPeriod period, BigDecimal limit, double alertThreshold) {
        this.period = period;
        this.limit = limit;
        this.alertLevel = limit != null ? limit.multiply(BigDecimal.valueOf(alertThreshold)) : null;
    }

    BudgetPeriod getPeriod() {
        return period;
    }

    BigDecimal getLimit() {
        return limit;
    }

    Instant getStart() {
        return start;
    }

    BigDecimal getConsumed() {
        return consumed;
    }

    boolean hasLimit() {
        return limit != null;
    }

    /**
     * Starts the window at the given instant with an already consumed amount.
     */
    void reset(Instant newStart, BigDecimal alreadyConsumed) {
        this.start = newStart;
        this.consumed = alreadyConsumed;
        this.alertTriggered = alertLevel != null && consumed.compareTo(alertLevel) >= 0;
    }

    boolean contains(Instant instant) {
        return start != null && !instant.isBefore(start);
    }

    void add(BigDecimal cost) {
        consumed = consumed.add(cost);
    }

    /**
     * Marks the alert as triggered the first time consumption reaches the alert level.
     *
     * @return true exactly once per window
     */
    boolean checkAlertCrossing() {
        if (alertTriggered || alertLevel == null || consumed.compareTo(alertLevel) < 0) {
            return false;
        }
        alertTriggered = true;
        return true;
    }

    boolean wouldExceed(BigDecimal estimatedCost) {
        return limit != null
                && (consumed.compareTo(limit) >= 0 || consumed.add(estimatedCost).compareTo(limit) > 0);
    }

    BudgetWindowStatus status() {
        if (limit == null) {
            return new BudgetWindowStatus(period, consumed, null, null, 0.0, false, false);
        }
        BigDecimal remaining = limit.subtract(consumed).max(BigDecimal.ZERO);
        double percentUsed = limit.signum() == 0
                ? 100.0
                : consumed.multiply(BigDecimal.valueOf(100)).divide(limit, 4, RoundingMode.HALF_UP).doubleValue();
        return new BudgetWindowStatus(period, consumed, limit, remaining, percentUsed,
                alertTriggered, consumed.compareTo(limit) >= 0);
    }
}
