package fr.lapetina.aigateway.infrastructure.resilience;

import fr.lapetina.aigateway.domain.model.CircuitState;

/**
 * Notified after a circuit breaker changes state. Called outside the breaker's lock.
 */
@FunctionalInterface
public interface CircuitTransitionListener {

    void onTransition(String providerId, CircuitState from, CircuitState to);
}
