package fr.lapetina.aigateway.infrastructure.cache;

/**
 * Cache counters since startup.
 */
public record CacheStats(
        long memoryHits,
        long persistentHits,
        long similarityHits,
        long misses,
        long writes,
        long memorySize,
        long persistentSize
) {
    public long totalHits() {
        return memoryHits + persistentHits + similarityHits;
    }

    public double hitRate() {
        long lookups = totalHits() + misses;
        return lookups == 0 ? 0.0 : (double) totalHits() / lookups;
    }
}
