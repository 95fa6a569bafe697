/**
 * Response cache.
 *
 * <p>{@link fr.lapetina.aigateway.infrastructure.cache.CacheEngine} serves exact hits from a
 * Caffeine memory tier backed by an H2 table, and near-duplicate hits from an embedding index
 * over the same table.
 */
package fr.lapetina.aigateway.infrastructure.cache;
