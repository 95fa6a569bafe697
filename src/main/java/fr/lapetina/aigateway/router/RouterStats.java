package fr.lapetina.aigateway.router;

import fr.lapetina.aigateway.infrastructure.cache.CacheStats;

import java.util.Map;

/**
 * Router-wide counters since startup.
 *
 * @param cache cache counters, or null when caching is disabled
 */
public record RouterStats(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double successRate,
        long cacheHits,
        long failovers,
        long circuitTrips,
        long droppedEvents,
        String strategy,
        Map<String, ProviderStats> providers,
        CacheStats cache
) {
}
