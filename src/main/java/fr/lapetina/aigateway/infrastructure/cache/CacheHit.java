package fr.lapetina.aigateway.infrastructure.cache;

/**
 * Result of a successful cache lookup.
 *
 * @param similarity cosine similarity for the similarity tier, 1.0 for exact hits
 */
public record CacheHit(CacheEntry entry, CacheTier tier, double similarity) {
}
