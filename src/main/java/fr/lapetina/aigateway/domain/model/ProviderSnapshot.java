package fr.lapetina.aigateway.domain.model;

import java.util.Objects;

/**
 * Routing-time view of one eligible provider, handed to load balancing strategies.
 *
 * @param p50LatencyMs rolling median latency, or {@link Double#NaN} when no samples exist yet
 * @param registrationIndex position in registration order, used to break ties
 */
public record ProviderSnapshot(
        ProviderProfile profile,
        CircuitState circuitState,
        double p50LatencyMs,
        int registrationIndex
) {
    public ProviderSnapshot {
        Objects.requireNonNull(profile, "Profile is required");
        Objects.requireNonNull(circuitState, "Circuit state is required");
    }

    public String id() {
        return profile.getId();
    }

    public boolean hasLatencySamples() {
        return !Double.isNaN(p50LatencyMs);
    }
}
