package fr.lapetina.aigateway.domain.strategy;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.ProviderSnapshot;

import java.util.Comparator;
import java.util.List;

/**
 * Strategy interface for ordering candidate providers.
 *
 * Implementations must be thread-safe as they are called from concurrent request threads.
 * The input list is in registration order; implementations break ties by registration order.
 */
public interface LoadBalancingStrategy {

    /** Tie-breaker shared by every strategy. */
    Comparator<ProviderSnapshot> REGISTRATION_ORDER =
            Comparator.comparingInt(ProviderSnapshot::registrationIndex);

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Orders eligible providers from most to least preferred for the given request.
     *
     * @param candidates eligible providers, in registration order
     * @param request    the request being routed
     * @return a new list holding every candidate exactly once
     */
    List<ProviderSnapshot> order(List<ProviderSnapshot> candidates, CompletionRequest request);

    /**
     * Resets any internal state. Called when the provider set changes.
     */
    default void reset() {
        // Default no-op
    }
}
