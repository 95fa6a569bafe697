package fr.lapetina.aigateway.domain.error;

/**
 * Error taxonomy for routed requests.
 * Retryability is a property of the type; errors are classified once where they arise.
 */
public enum ErrorType {
    /** Credentials rejected by the provider (401/403). */
    AUTH(false),

    /** Provider throttled the request (429). */
    RATE_LIMIT(true),

    /** No answer within the allotted time, or the outcome is unknown. */
    TIMEOUT(true),

    /** Provider unreachable or failing server-side (5xx, connection refused). */
    PROVIDER_UNAVAILABLE(true),

    /** Provider answered with something that is not a usable completion. */
    INVALID_RESPONSE(false),

    /** Circuit breaker denied the call. */
    CIRCUIT_OPEN(false),

    /** Every candidate provider failed or was skipped. */
    ALL_PROVIDERS_UNAVAILABLE(false),

    /** Budget exhausted in hard-stop mode. */
    BUDGET_EXCEEDED(false),

    /** Too many requests waiting for a concurrency slot. */
    QUEUE_FULL(false),

    /** Request rejected before routing. */
    VALIDATION(false);

    private final boolean retryable;

    ErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
