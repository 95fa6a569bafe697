package fr.lapetina.aigateway.infrastructure.ledger;

/**
 * Daily and monthly budget state.
 */
public record BudgetStatus(BudgetWindowStatus daily, BudgetWindowStatus monthly, BudgetMode mode) {
}
