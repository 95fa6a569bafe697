package fr.lapetina.aigateway.infrastructure.ledger;

import fr.lapetina.aigateway.domain.error.BudgetExceededException;
import fr.lapetina.aigateway.domain.model.ModelPricing;
import fr.lapetina.aigateway.domain.model.Priority;
import fr.lapetina.aigateway.domain.model.ProviderKind;
import fr.lapetina.aigateway.domain.model.ProviderProfile;
import fr.lapetina.aigateway.domain.model.TokenUsage;
import fr.lapetina.aigateway.infrastructure.store.H2Database;
import fr.lapetina.aigateway.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TokenTrackerTest {

    private MutableClock clock;
    private String url;
    private TokenTracker tracker;
    private List<BudgetAlert> alerts;
    private int sequence;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T12:00:00Z");
        url = "jdbc:h2:mem:ledger-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        alerts = new CopyOnWriteArrayList<>();
        tracker = newTracker(BudgetMode.HARD_STOP);
    }

    @AfterEach
    void tearDown() {
        tracker.close();
    }

    private TokenTracker newTracker(BudgetMode mode) {
        TokenTracker created = new TokenTracker(new UsageStore(H2Database.open(url)),
                new BigDecimal("100"), null, 0.9, mode, ZoneOffset.UTC, clock);
        created.addAlertListener(alerts::add);
        return created;
    }

    private UsageRecord record(String requestId, String cost) {
        return new UsageRecord(requestId, "openai", "gpt-4o", 1000, 500,
                new BigDecimal(cost), 120, clock.instant(), true);
    }

    private boolean track(String cost) {
        return tracker.trackUsage(record("req-" + (++sequence), cost));
    }

    @Nested
    @DisplayName("trackUsage")
    class TrackUsage {

        @Test
        @DisplayName("should sum tracked costs into the daily window")
        void shouldSumCosts() {
            track("12.50");
            track("0.75");
            track("30");

            BudgetWindowStatus daily = tracker.getBudgetStatus().daily();

            assertThat(daily.used()).isEqualByComparingTo("43.25");
            assertThat(daily.remaining()).isEqualByComparingTo("56.75");
            assertThat(daily.percentUsed()).isEqualTo(43.25);
            assertThat(daily.exceeded()).isFalse();
        }

        @Test
        @DisplayName("should not count the same request twice")
        void shouldIgnoreDuplicates() {
            assertThat(tracker.trackUsage(record("req-dup", "10"))).isTrue();
            assertThat(tracker.trackUsage(record("req-dup", "10"))).isFalse();

            assertThat(tracker.getBudgetStatus().daily().used()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("should raise exactly one alert when crossing the threshold")
        void shouldAlertOnce() {
            track("50");
            track("35");
            assertThat(alerts).isEmpty();

            track("6");
            track("5");

            assertThat(alerts).hasSize(1);
            assertThat(alerts.get(0).period()).isEqualTo(BudgetPeriod.DAILY);
            assertThat(alerts.get(0).consumed()).isEqualByComparingTo("91");
            assertThat(alerts.get(0).limit()).isEqualByComparingTo("100");
            assertThat(tracker.getBudgetStatus().daily().alertTriggered()).isTrue();
        }

        @Test
        @DisplayName("should keep tracking when an alert listener fails")
        void shouldIsolateListenerFailure() {
            tracker.addAlertListener(alert -> {
                throw new IllegalStateException("listener down");
            });

            assertThat(track("95")).isTrue();
            assertThat(alerts).hasSize(1);
        }

        @Test
        @DisplayName("should store raised alerts across restarts")
        void shouldStoreAlerts() {
            track("95");
            tracker.close();
            clock.advance(Duration.ofMinutes(5));
            tracker = newTracker(BudgetMode.HARD_STOP);

            List<BudgetAlert> stored = tracker.getAlerts(Instant.parse("2025-03-10T00:00:00Z"), 10);

            assertThat(stored).hasSize(1);
            assertThat(stored.get(0).period()).isEqualTo(BudgetPeriod.DAILY);
            assertThat(stored.get(0).consumed()).isEqualByComparingTo("95");
            assertThat(stored.get(0).limit()).isEqualByComparingTo("100");
            assertThat(stored.get(0).threshold()).isEqualTo(0.9);
            assertThat(stored.get(0).triggeredAt()).isEqualTo(Instant.parse("2025-03-10T12:00:00Z"));
        }

        @Test
        @DisplayName("should list stored alerts most recent first")
        void shouldListRecentAlertsFirst() {
            track("95");
            clock.set(Instant.parse("2025-03-11T09:00:00Z"));
            track("92");

            List<BudgetAlert> stored = tracker.getAlerts(Instant.parse("2025-03-01T00:00:00Z"), 10);

            assertThat(stored).extracting(BudgetAlert::triggeredAt).containsExactly(
                    Instant.parse("2025-03-11T09:00:00Z"), Instant.parse("2025-03-10T12:00:00Z"));
            assertThat(tracker.getAlerts(Instant.parse("2025-03-11T00:00:00Z"), 10)).hasSize(1);
            assertThat(tracker.getAlerts(Instant.parse("2025-03-01T00:00:00Z"), 1)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("checkBudget")
    class CheckBudget {

        @Test
        @DisplayName("should allow a request that fits the remaining budget")
        void shouldAllowWithinBudget() {
            track("90");

            assertThat(tracker.checkBudget(new BigDecimal("10"), Priority.NORMAL)).isFalse();
        }

        @Test
        @DisplayName("should reject a request projected past the limit in hard-stop mode")
        void shouldRejectOverLimit() {
            track("100");

            assertThatThrownBy(() -> tracker.checkBudget(new BigDecimal("10"), Priority.HIGH))
                    .isInstanceOf(BudgetExceededException.class)
                    .satisfies(e -> {
                        BudgetExceededException exceeded = (BudgetExceededException) e;
                        assertThat(exceeded.getPeriod()).isEqualTo("daily");
                        assertThat(exceeded.getConsumed()).isEqualByComparingTo("100");
                        assertThat(exceeded.getLimit()).isEqualByComparingTo("100");
                    });
        }

        @Test
        @DisplayName("should let critical requests through with a warning")
        void shouldLetCriticalThrough() {
            track("100");

            assertThat(tracker.checkBudget(new BigDecimal("10"), Priority.CRITICAL)).isTrue();
        }

        @Test
        @DisplayName("should only warn in soft-warn mode")
        void shouldWarnInSoftMode() {
            tracker.close();
            tracker = newTracker(BudgetMode.SOFT_WARN);
            track("100");

            assertThat(tracker.checkBudget(new BigDecimal("10"), Priority.LOW)).isTrue();
        }
    }

    @Nested
    @DisplayName("windows")
    class Windows {

        @Test
        @DisplayName("should start a fresh daily window at midnight")
        void shouldRollDaily() {
            track("80");

            clock.advance(Duration.ofHours(12));

            assertThat(tracker.getBudgetStatus().daily().used()).isEqualByComparingTo("0");
            assertThat(tracker.getBudgetStatus().monthly().used()).isEqualByComparingTo("80");
            assertThat(tracker.checkBudget(new BigDecimal("50"), Priority.NORMAL)).isFalse();
        }

        @Test
        @DisplayName("should rebuild window totals from the ledger on restart")
        void shouldRebuildOnRestart() {
            track("42");
            tracker.close();

            tracker = newTracker(BudgetMode.HARD_STOP);

            assertThat(tracker.getBudgetStatus().daily().used()).isEqualByComparingTo("42");
        }

        @Test
        @DisplayName("should report unlimited windows without a limit")
        void shouldReportUnlimited() {
            BudgetWindowStatus monthly = tracker.getBudgetStatus().monthly();

            assertThat(monthly.limit()).isNull();
            assertThat(monthly.remaining()).isNull();
            assertThat(monthly.exceeded()).isFalse();
        }
    }

    @Test
    @DisplayName("should aggregate usage by provider and model")
    void shouldAggregateUsage() {
        track("1");
        track("2");
        tracker.trackUsage(new UsageRecord("req-other", "anthropic", "claude-4.5-sonnet-20250514",
                200, 100, new BigDecimal("0.5"), 80, clock.instant(), true));

        List<UsageSummary> stats = tracker.getUsageStats(Instant.parse("2025-03-10T00:00:00Z"),
                Instant.parse("2025-03-11T00:00:00Z"));

        assertThat(stats).extracting(UsageSummary::providerId).containsExactly("anthropic", "openai");
        UsageSummary openai = stats.get(1);
        assertThat(openai.requests()).isEqualTo(2);
        assertThat(openai.totalTokens()).isEqualTo(3000);
        assertThat(openai.cost()).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("should compare providers by cost with per-request averages")
    void shouldCompareProviders() {
        track("1");
        track("2");
        tracker.trackUsage(new UsageRecord("req-other", "anthropic", "claude-4.5-sonnet-20250514",
                200, 100, new BigDecimal("0.5"), 80, clock.instant(), true));
        tracker.trackUsage(new UsageRecord("req-mini", "openai", "gpt-4o-mini",
                100, 100, new BigDecimal("1"), 50, clock.instant(), true));

        ProviderComparison comparison = tracker.getProviderComparison(Instant.parse("2025-03-10T00:00:00Z"),
                Instant.parse("2025-03-11T00:00:00Z"));

        assertThat(comparison.providers()).extracting(ProviderComparison.ProviderUsage::providerId)
                .containsExactly("openai", "anthropic");
        ProviderComparison.ProviderUsage openai = comparison.providers().get(0);
        assertThat(openai.requests()).isEqualTo(3);
        assertThat(openai.tokens()).isEqualTo(3200);
        assertThat(openai.cost()).isEqualByComparingTo("4");
        assertThat(openai.averageCostPerRequest()).isEqualByComparingTo("1.3333333333");
        assertThat(openai.averageTokensPerRequest()).isCloseTo(1066.67, within(0.01));
        assertThat(comparison.totalRequests()).isEqualTo(4);
        assertThat(comparison.totalTokens()).isEqualTo(3500);
        assertThat(comparison.totalCost()).isEqualByComparingTo("4.5");
    }

    @Test
    @DisplayName("should return an empty comparison when nothing was tracked")
    void shouldCompareNothing() {
        ProviderComparison comparison = tracker.getProviderComparison(Instant.parse("2025-03-10T00:00:00Z"),
                Instant.parse("2025-03-11T00:00:00Z"));

        assertThat(comparison.providers()).isEmpty();
        assertThat(comparison.totalRequests()).isZero();
        assertThat(comparison.totalCost()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("should never purge records of the current month")
    void shouldKeepCurrentMonthOnPurge() {
        clock.set(Instant.parse("2025-01-15T12:00:00Z"));
        track("5");
        clock.set(Instant.parse("2025-03-02T12:00:00Z"));
        track("7");
        clock.set(Instant.parse("2025-03-20T12:00:00Z"));

        int purged = tracker.purgeOlderThan(Duration.ofDays(1));

        assertThat(purged).isEqualTo(1);
        assertThat(tracker.getBudgetStatus().monthly().used()).isEqualByComparingTo("7");
    }

    @Test
    @DisplayName("should price usage from the provider profile")
    void shouldCalculateCost() {
        ProviderProfile profile = ProviderProfile.builder()
                .id("openai")
                .kind(ProviderKind.OPENAI)
                .defaultModel("gpt-4o")
                .addModel("gpt-4o", ModelPricing.perMillion(2.5, 10.0))
                .maxConcurrentRequests(5)
                .build();

        BigDecimal cost = TokenTracker.calculateCost(profile, "gpt-4o", new TokenUsage(1000, 500));

        assertThat(cost).isEqualByComparingTo("0.0075");
    }
}
