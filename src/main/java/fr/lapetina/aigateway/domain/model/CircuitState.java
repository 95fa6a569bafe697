package fr.lapetina.aigateway.domain.model;

/**
 * Circuit breaker states.
 */
public enum CircuitState {
    /** Normal operation, requests pass through. */
    CLOSED,

    /** Failure threshold reached, requests are rejected until the open timeout elapses. */
    OPEN,

    /** Recovery probing, a bounded number of requests may pass. */
    HALF_OPEN
}
