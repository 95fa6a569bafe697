package fr.lapetina.aigateway.infrastructure.ledger;

@FunctionalInterface
public interface BudgetAlertListener {

    void onBudgetAlert(BudgetAlert alert);
}
