package fr.lapetina.aigateway.router;

import fr.lapetina.aigateway.domain.model.CircuitState;

/**
 * Per-provider counters.
 *
 * @param p50LatencyMs rolling median latency, NaN without samples
 */
public record ProviderStats(
        String providerId,
        long requests,
        long successes,
        long failures,
        CircuitState circuitState,
        double p50LatencyMs,
        int inFlight
) {
}
