package fr.lapetina.aigateway.domain.model;

import java.time.Instant;

/**
 * Point-in-time view of one provider's circuit breaker.
 */
public record CircuitSnapshot(
        String providerId,
        CircuitState state,
        int consecutiveFailures,
        int consecutiveSuccesses,
        Instant lastTransitionAt,
        int halfOpenTrialsInFlight
) {
}
