package fr.lapetina.aigateway.domain.error;

import java.math.BigDecimal;

/**
 * Request rejected before dispatch because a budget window is, or would be, exhausted.
 */
public final class BudgetExceededException extends GatewayException {

    private final String period;
    private final BigDecimal consumed;
    private final BigDecimal limit;
    private final BigDecimal estimatedCost;

    public BudgetExceededException(String period, BigDecimal consumed, BigDecimal limit, BigDecimal estimatedCost) {
        super(ErrorType.BUDGET_EXCEEDED, String.format(
                "%s budget exceeded: consumed=%s, estimated=%s, limit=%s",
                period, consumed.toPlainString(), estimatedCost.toPlainString(), limit.toPlainString()));
        this.period = period;
        this.consumed = consumed;
        this.limit = limit;
        this.estimatedCost = estimatedCost;
    }

    public String getPeriod() {
        return period;
    }

    public BigDecimal getConsumed() {
        return consumed;
    }

    public BigDecimal getLimit() {
        return limit;
    }

    public BigDecimal getEstimatedCost() {
        return estimatedCost;
    }
}
