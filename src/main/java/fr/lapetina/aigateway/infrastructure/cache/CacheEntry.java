package fr.lapetina.aigateway.infrastructure.cache;

import fr.lapetina.aigateway.domain.model.CompletionResult;

import java.time.Instant;
import java.util.Objects;

/**
 * One cached response. Immutable; hit counts are tracked by the store beside the entry.
 *
 * @param scope     model scope within which the similarity tier may match this entry
 * @param embedding vector of the request text, or null when the similarity tier is off
 */
public record CacheEntry(
        String fingerprint,
        String scope,
        float[] embedding,
        CompletionResult response,
        Instant createdAt,
        Instant expiresAt
) {
    public CacheEntry {
        Objects.requireNonNull(fingerprint, "Fingerprint is required");
        Objects.requireNonNull(scope, "Scope is required");
        Objects.requireNonNull(response, "Response is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
