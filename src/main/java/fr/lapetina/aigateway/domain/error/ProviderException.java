package fr.lapetina.aigateway.domain.error;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure of a single provider call, classified at the adapter boundary.
 */
public final class ProviderException extends GatewayException {

    private final String providerId;
    private final String detail;
    private final Duration retryAfter;
    private final int attempts;

    public ProviderException(String providerId, ErrorType errorType, String message) {
        this(providerId, errorType, message, null, 1, null);
    }

    public ProviderException(String providerId, ErrorType errorType, String message, Throwable cause) {
        this(providerId, errorType, message, null, 1, cause);
    }

    public ProviderException(
            String providerId,
            ErrorType errorType,
            String message,
            Duration retryAfter,
            int attempts,
            Throwable cause
    ) {
        super(errorType, "[" + providerId + "] " + message, cause);
        this.providerId = providerId;
        this.detail = message;
        this.retryAfter = retryAfter;
        this.attempts = attempts;
    }

    /**
     * Rate limit carrying the provider's Retry-After hint, when it sent one.
     */
    public static ProviderException rateLimited(String providerId, String message, Duration retryAfter) {
        return new ProviderException(providerId, ErrorType.RATE_LIMIT, message, retryAfter, 1, null);
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * Message without the provider prefix.
     */
    public String getDetail() {
        return detail;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * Number of attempts made on this provider before giving up.
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Copy of this failure annotated with the number of attempts made.
     */
    public ProviderException withAttempts(int attemptCount) {
        ProviderException copy = new ProviderException(
                providerId, getErrorType(), detail, retryAfter, attemptCount, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
