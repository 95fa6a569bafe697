package fr.lapetina.aigateway.domain.error;

/**
 * Raised internally when a provider's breaker denies a call. Surfaces to callers only as a cause.
 */
public final class CircuitOpenException extends GatewayException {

    private final String providerId;

    public CircuitOpenException(String providerId) {
        super(ErrorType.CIRCUIT_OPEN, "Circuit breaker is open for provider: " + providerId);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
