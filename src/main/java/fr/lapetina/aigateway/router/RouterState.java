package fr.lapetina.aigateway.router;

import fr.lapetina.aigateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.aigateway.infrastructure.cache.CacheStats;
import fr.lapetina.aigateway.infrastructure.health.ProviderRegistry;
import fr.lapetina.aigateway.infrastructure.health.ProviderRegistry.ProviderEntry;
import fr.lapetina.aigateway.infrastructure.resilience.ConcurrencyLimiter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable state owned by one {@link ProviderRouter}: the provider registry, the concurrency
 * limiter, the active strategy and the request counters. Thread-safe.
 */
final class RouterState {

    private final ProviderRegistry registry;
    private final ConcurrencyLimiter limiter;
    private final AtomicReference<LoadBalancingStrategy> strategy;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong failovers = new AtomicLong();
    private final AtomicLong circuitTrips = new AtomicLong();
    private final Map<String, ProviderCounters> providerCounters = new ConcurrentHashMap<>();

    RouterState(ProviderRegistry registry, ConcurrencyLimiter limiter, LoadBalancingStrategy initialStrategy) {
        this.registry = registry;
        this.limiter = limiter;
        this.strategy = new AtomicReference<>(initialStrategy);
    }

    ProviderRegistry getRegistry() {
        return registry;
    }

    ConcurrencyLimiter getLimiter() {
        return limiter;
    }

    LoadBalancingStrategy getStrategy() {
        return strategy.get();
    }

    LoadBalancingStrategy swapStrategy(LoadBalancingStrategy newStrategy) {
        return strategy.getAndSet(newStrategy);
    }

    void requestStarted() {
        totalRequests.incrementAndGet();
    }

    void requestSucceeded() {
        successfulRequests.incrementAndGet();
    }

    void requestFailed() {
        failedRequests.incrementAndGet();
    }

    void cacheHit() {
        cacheHits.incrementAndGet();
    }

    void failover() {
        failovers.incrementAndGet();
    }

    void circuitTripped() {
        circuitTrips.incrementAndGet();
    }

    void providerAttempted(String providerId) {
        counters(providerId).requests.incrementAndGet();
    }

    void providerSucceeded(String providerId) {
        counters(providerId).successes.incrementAndGet();
    }

    void providerFailed(String providerId) {
        counters(providerId).failures.incrementAndGet();
    }

    private ProviderCounters counters(String providerId) {
        return providerCounters.computeIfAbsent(providerId, id -> new ProviderCounters());
    }

    RouterStats snapshot(long droppedEvents, CacheStats cacheStats) {
        Map<String, ProviderStats> providers = new LinkedHashMap<>();
        for (ProviderEntry entry : registry.getAll()) {
            ProviderCounters counters = counters(entry.getId());
            providers.put(entry.getId(), new ProviderStats(
                    entry.getId(),
                    counters.requests.get(),
                    counters.successes.get(),
                    counters.failures.get(),
                    entry.getCircuitBreaker().getState(),
                    entry.getLatencyWindow().percentile(0.5),
                    limiter.inFlight(entry.getId())
            ));
        }

        long total = totalRequests.get();
        long successes = successfulRequests.get();
        double successRate = total > 0 ? (double) successes / total : 0.0;

        return new RouterStats(
                total,
                successes,
                failedRequests.get(),
                successRate,
                cacheHits.get(),
                failovers.get(),
                circuitTrips.get(),
                droppedEvents,
                strategy.get().getName(),
                Collections.unmodifiableMap(providers),
                cacheStats
        );
    }

    private static final class ProviderCounters {
        private final AtomicLong requests = new AtomicLong();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
    }
}
