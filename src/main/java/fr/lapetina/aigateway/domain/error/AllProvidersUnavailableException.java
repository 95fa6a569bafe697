package fr.lapetina.aigateway.domain.error;

import java.util.List;

/**
 * Terminal failure: every candidate provider failed or was skipped.
 */
public final class AllProvidersUnavailableException extends GatewayException {

    private final List<String> attemptedProviders;

    public AllProvidersUnavailableException(List<String> attemptedProviders, Throwable lastCause) {
        super(ErrorType.ALL_PROVIDERS_UNAVAILABLE,
                "All providers unavailable, attempted: " + attemptedProviders
                        + (lastCause != null ? ", last error: " + lastCause.getMessage() : ""),
                lastCause);
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }
}
