package fr.lapetina.aigateway.infrastructure.ledger;

import java.util.Locale;

/**
 * What happens to a request that would exceed a budget.
 */
public enum BudgetMode {
    /** Reject every non-critical request. */
    HARD_STOP("hard-stop"),
    /** Dispatch and flag the result. */
    SOFT_WARN("soft-warn");

    private final String configName;

    BudgetMode(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static BudgetMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return HARD_STOP;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (BudgetMode mode : values()) {
            if (mode.configName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown budget mode: " + name);
    }
}
