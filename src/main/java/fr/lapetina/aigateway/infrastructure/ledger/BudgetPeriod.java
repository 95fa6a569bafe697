package fr.lapetina.aigateway.infrastructure.ledger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Budget window length. Windows are aligned on calendar boundaries of the configured zone.
 */
public enum BudgetPeriod {
    DAILY("daily"),
    MONTHLY("monthly");

    private final String name;

    BudgetPeriod(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Start of the window containing the given instant.
     */
    public Instant windowStart(Instant instant, ZoneId zone) {
        LocalDate date = instant.atZone(zone).toLocalDate();
        LocalDate start = this == DAILY ? date : date.withDayOfMonth(1);
        return start.atStartOfDay(zone).toInstant();
    }
}
