package fr.lapetina.aigateway.infrastructure.health;

import fr.lapetina.aigateway.domain.model.ProviderHealth;
import fr.lapetina.aigateway.infrastructure.health.ProviderRegistry.ProviderEntry;
import fr.lapetina.aigateway.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.aigateway.infrastructure.resilience.ConcurrencyLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Background health monitor for registered providers.
 *
 * Each health check goes through the provider's circuit breaker and concurrency limiter like a
 * routed request. It is skipped while the breaker is OPEN or every slot of the provider is taken,
 * and its outcome is reported back to the breaker. Check latency feeds the provider's latency
 * window.
 */
public final class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ProviderRegistry registry;
    private final ConcurrencyLimiter limiter;
    private final Duration checkInterval;
    private final Duration checkTimeout;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ProviderHealth> lastResults = new ConcurrentHashMap<>();
    private final List<Consumer<ProviderHealth>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthMonitor(ProviderRegistry registry, ConcurrencyLimiter limiter, Duration checkInterval,
                         Duration checkTimeout, Clock clock) {
        this.registry = registry;
        this.limiter = limiter;
        this.checkInterval = checkInterval;
        this.checkTimeout = checkTimeout;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic probing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runScheduledRound,
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started with interval: {}", checkInterval);
        }
    }

    private void runScheduledRound() {
        try {
            checkAll();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the schedule
            log.error("Health check round failed", e);
        }
    }

    /**
     * Checks every enabled provider synchronously.
     */
    public Map<String, ProviderHealth> checkAll() {
        List<ProviderEntry> entries = registry.getEnabled();
        log.debug("Starting health check round: providerCount={}", entries.size());
        Map<String, ProviderHealth> round = new LinkedHashMap<>();
        for (ProviderEntry entry : entries) {
            round.put(entry.getId(), checkProvider(entry));
        }
        return round;
    }

    /**
     * Checks one provider and records the outcome.
     */
    public ProviderHealth checkProvider(ProviderEntry entry) {
        String providerId = entry.getId();
        CircuitBreaker breaker = entry.getCircuitBreaker();

        Optional<CircuitBreaker.Permit> permit = breaker.tryAcquirePermission();
        if (permit.isEmpty()) {
            log.debug("Health check skipped, circuit not accepting calls: providerId={}, state={}",
                    providerId, breaker.getState());
            return publish(new ProviderHealth(providerId, false, -1, breaker.getState(),
                    clock.instant(), "circuit open"));
        }
        if (!limiter.tryAcquire(providerId)) {
            breaker.releasePermission(permit.get());
            log.debug("Health check skipped, provider saturated: providerId={}, inFlight={}",
                    providerId, limiter.inFlight(providerId));
            return lastResults.getOrDefault(providerId, ProviderHealth.unknown(providerId, breaker.getState()));
        }

        try {
            return runCheck(entry, breaker, permit.get());
        } finally {
            limiter.release(providerId);
        }
    }

    private ProviderHealth runCheck(ProviderEntry entry, CircuitBreaker breaker, CircuitBreaker.Permit permit) {
        String providerId = entry.getId();
        long start = System.nanoTime();
        CompletableFuture<Boolean> check = null;
        boolean healthy;
        String error = null;
        try {
            check = entry.getAdapter().healthCheck();
            healthy = Boolean.TRUE.equals(check.get(checkTimeout.toMillis(), TimeUnit.MILLISECONDS));
            if (!healthy) {
                error = "unhealthy response";
            }
        } catch (TimeoutException e) {
            check.cancel(true);
            healthy = false;
            error = "health check timed out after " + checkTimeout.toMillis() + "ms";
        } catch (ExecutionException e) {
            healthy = false;
            error = String.valueOf(e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            breaker.releasePermission(permit);
            Thread.currentThread().interrupt();
            return lastResults.getOrDefault(providerId, ProviderHealth.unknown(providerId, breaker.getState()));
        } catch (RuntimeException e) {
            healthy = false;
            error = String.valueOf(e.getMessage());
        }
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        if (healthy) {
            entry.getLatencyWindow().record(latencyMs);
            breaker.recordSuccess(permit);
            log.debug("Health check passed: providerId={}, latencyMs={}", providerId, latencyMs);
        } else {
            breaker.recordFailure(permit);
            log.warn("Health check failed: providerId={}, latencyMs={}, circuitState={}, error={}",
                    providerId, latencyMs, breaker.getState(), error);
        }

        return publish(new ProviderHealth(providerId, healthy, latencyMs, breaker.getState(),
                clock.instant(), error));
    }

    private ProviderHealth publish(ProviderHealth health) {
        lastResults.put(health.providerId(), health);
        for (Consumer<ProviderHealth> listener : listeners) {
            try {
                listener.accept(health);
            } catch (Exception e) {
                log.error("Error notifying health listener", e);
            }
        }
        return health;
    }

    /**
     * Last known health per provider, in registration order. Providers never checked are reported
     * healthy with their current circuit state.
     */
    public Map<String, ProviderHealth> getProviderHealth() {
        Map<String, ProviderHealth> result = new LinkedHashMap<>();
        for (ProviderEntry entry : registry.getAll()) {
            ProviderHealth last = lastResults.get(entry.getId());
            CircuitBreaker breaker = entry.getCircuitBreaker();
            if (last == null) {
                result.put(entry.getId(), ProviderHealth.unknown(entry.getId(), breaker.getState()));
            } else {
                result.put(entry.getId(), new ProviderHealth(last.providerId(), last.healthy(),
                        last.latencyMs(), breaker.getState(), last.lastCheckedAt(), last.lastError()));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public void addListener(Consumer<ProviderHealth> listener) {
        listeners.add(listener);
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health monitor stopped");
    }
}
