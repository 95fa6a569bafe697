package fr.lapetina.aigateway.domain.model;

import java.time.Instant;

/**
 * Last known health of a provider as observed by the health monitor.
 *
 * @param latencyMs latency of the last health check, or -1 when none completed yet
 */
public record ProviderHealth(
        String providerId,
        boolean healthy,
        long latencyMs,
        CircuitState circuitState,
        Instant lastCheckedAt,
        String lastError
) {
    public static ProviderHealth unknown(String providerId, CircuitState circuitState) {
        return new ProviderHealth(providerId, true, -1, circuitState, null, null);
    }
}
