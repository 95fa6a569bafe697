package fr.lapetina.aigateway.infrastructure.ledger;

import fr.lapetina.aigateway.domain.error.BudgetExceededException;
import fr.lapetina.aigateway.domain.model.Priority;
import fr.lapetina.aigateway.domain.model.ProviderProfile;
import fr.lapetina.aigateway.domain.model.TokenUsage;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;
import fr.lapetina.aigateway.infrastructure.store.H2Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Usage ledger with daily and monthly budget windows.
 *
 * <p>Every tracked record is appended to the store and added to the in-window totals under one
 * lock, so a window's consumption always equals the sum of its ledger rows. Request ids are
 * unique: tracking the same request twice is a no-op.
 *
 * <p>Windows roll over on calendar boundaries of the configured zone and are rebuilt from the
 * ledger at startup. Each window raises at most one {@link BudgetAlert}, which is stored next to
 * the ledger before listeners are notified.
 */
public final class TokenTracker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TokenTracker.class);

    private final UsageStore store;
    private final BudgetMode mode;
    private final double alertThreshold;
    private final ZoneId zone;
    private final Clock clock;
    private final BudgetWindow daily;
    private final BudgetWindow monthly;
    private final List<BudgetAlertListener> alertListeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    public TokenTracker(
            UsageStore store,
            BigDecimal dailyLimit,
            BigDecimal monthlyLimit,
            double alertThreshold,
            BudgetMode mode,
            ZoneId zone,
            Clock clock
    ) {
        this.store = store;
        this.mode = mode;
        this.alertThreshold = alertThreshold;
        this.zone = zone;
        this.clock = clock;
        this.daily = new BudgetWindow(BudgetPeriod.DAILY, dailyLimit, alertThreshold);
        this.monthly = new BudgetWindow(BudgetPeriod.MONTHLY, monthlyLimit, alertThreshold);

        synchronized (lock) {
            rollWindows(clock.instant());
        }
        log.info("Token tracker initialized: mode={}, dailyLimit={}, monthlyLimit={}, alertThreshold={}, zone={}, dailyUsed={}, monthlyUsed={}",
                mode, dailyLimit, monthlyLimit, alertThreshold, zone, daily.getConsumed(), monthly.getConsumed());
    }

    /**
     * Creates a tracker from configuration, opening the ledger store.
     */
    public static TokenTracker create(GatewayConfig.BudgetConfig config, Clock clock) {
        H2Database database = H2Database.open(config.getLedgerPath());
        return new TokenTracker(
                new UsageStore(database),
                config.getDaily() != null ? BigDecimal.valueOf(config.getDaily()) : null,
                config.getMonthly() != null ? BigDecimal.valueOf(config.getMonthly()) : null,
                config.getAlertThreshold(),
                BudgetMode.fromName(config.getMode()),
                ZoneId.of(config.getZone()),
                clock
        );
    }

    public void addAlertListener(BudgetAlertListener listener) {
        alertListeners.add(listener);
    }

    /**
     * Records the usage of one request.
     *
     * @return false if the request was already tracked
     */
    public boolean trackUsage(UsageRecord record) {
        List<BudgetAlert> alerts = new ArrayList<>(2);
        synchronized (lock) {
            Instant now = clock.instant();
            rollWindows(now);
            if (!store.append(record)) {
                return false;
            }
            for (BudgetWindow window : List.of(daily, monthly)) {
                if (window.contains(record.timestamp())) {
                    window.add(record.cost());
                    if (window.checkAlertCrossing()) {
                        alerts.add(new BudgetAlert(window.getPeriod(), window.getConsumed(),
                                window.getLimit(), alertThreshold, now));
                    }
                }
            }
        }

        log.debug("Usage tracked: requestId={}, provider={}, model={}, inputTokens={}, outputTokens={}, cost={}",
                record.requestId(), record.providerId(), record.model(),
                record.inputTokens(), record.outputTokens(), record.cost().toPlainString());
        for (BudgetAlert alert : alerts) {
            log.warn("Budget alert: period={}, consumed={}, limit={}, threshold={}",
                    alert.period().getName(), alert.consumed().toPlainString(),
                    alert.limit().toPlainString(), alert.threshold());
            storeAlert(alert);
            notifyAlert(alert);
        }
        return true;
    }

    private void storeAlert(BudgetAlert alert) {
        try {
            store.appendAlert(alert);
        } catch (H2Database.StoreException e) {
            log.error("Failed to store budget alert: period={}", alert.period().getName(), e);
        }
    }

    private void notifyAlert(BudgetAlert alert) {
        for (BudgetAlertListener listener : alertListeners) {
            try {
                listener.onBudgetAlert(alert);
            } catch (Exception e) {
                log.error("Error notifying budget alert listener", e);
            }
        }
    }

    /**
     * Checks whether a request with the given estimated cost may be dispatched.
     *
     * @return true if the request proceeds over budget and its result must carry a warning
     * @throws BudgetExceededException in hard-stop mode, for non-critical requests that would
     *                                 exceed a window
     */
    public boolean checkBudget(BigDecimal estimatedCost, Priority priority) {
        BigDecimal estimate = estimatedCost != null ? estimatedCost : BigDecimal.ZERO;
        synchronized (lock) {
            rollWindows(clock.instant());
            boolean warning = false;
            for (BudgetWindow window : List.of(daily, monthly)) {
                if (!window.wouldExceed(estimate)) {
                    continue;
                }
                if (mode == BudgetMode.HARD_STOP && priority != Priority.CRITICAL) {
                    log.warn("Request rejected by budget: period={}, consumed={}, estimated={}, limit={}",
                            window.getPeriod().getName(), window.getConsumed().toPlainString(),
                            estimate.toPlainString(), window.getLimit().toPlainString());
                    throw new BudgetExceededException(window.getPeriod().getName(),
                            window.getConsumed(), window.getLimit(), estimate);
                }
                log.info("Request dispatched over budget: period={}, mode={}, priority={}",
                        window.getPeriod().getName(), mode, priority);
                warning = true;
            }
            return warning;
        }
    }

    public BudgetStatus getBudgetStatus() {
        synchronized (lock) {
            rollWindows(clock.instant());
            return new BudgetStatus(daily.status(), monthly.status(), mode);
        }
    }

    /**
     * Usage grouped by provider and model for records in {@code [from, to)}.
     */
    public List<UsageSummary> getUsageStats(Instant from, Instant to) {
        return store.aggregateByProviderModel(from, to);
    }

    /**
     * Per-provider totals and averages for records in {@code [from, to)}, most expensive first.
     */
    public ProviderComparison getProviderComparison(Instant from, Instant to) {
        return ProviderComparison.of(getUsageStats(from, to));
    }

    /**
     * Stored budget alerts raised at or after {@code from}, most recent first.
     */
    public List<BudgetAlert> getAlerts(Instant from, int limit) {
        return store.alertsSince(from, limit);
    }

    /**
     * Cost of the given usage at the provider's price for the model.
     */
    public static BigDecimal calculateCost(ProviderProfile profile, String model, TokenUsage usage) {
        return profile.pricingFor(model).cost(usage);
    }

    /**
     * Deletes ledger rows older than the retention. Rows of the current windows are never deleted.
     *
     * @return number of rows deleted
     */
    public int purgeOlderThan(Duration retention) {
        synchronized (lock) {
            Instant now = clock.instant();
            rollWindows(now);
            Instant cutoff = now.minus(retention);
            Instant monthStart = monthly.getStart();
            if (cutoff.isAfter(monthStart)) {
                cutoff = monthStart;
            }
            int purged = store.purgeOlderThan(cutoff);
            if (purged > 0) {
                log.info("Usage records purged: count={}, cutoff={}", purged, cutoff);
            }
            return purged;
        }
    }

    public BudgetMode getMode() {
        return mode;
    }

    private void rollWindows(Instant now) {
        for (BudgetWindow window : List.of(daily, monthly)) {
            Instant start = window.getPeriod().windowStart(now, zone);
            if (!start.equals(window.getStart())) {
                boolean initial = window.getStart() == null;
                window.reset(start, store.sumCostSince(start));
                if (!initial) {
                    log.info("Budget window rolled over: period={}, start={}",
                            window.getPeriod().getName(), start);
                }
            }
        }
    }

    @Override
    public void close() {
        try {
            store.close();
        } catch (Exception e) {
            log.warn("Error closing token tracker", e);
        }
    }
}
