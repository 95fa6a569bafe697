package fr.lapetina.aigateway.domain.error;

import java.util.Objects;

/**
 * Base class of every error the gateway raises to callers.
 */
public class GatewayException extends RuntimeException {

    private final ErrorType errorType;

    public GatewayException(ErrorType errorType, String message) {
        super(message);
        this.errorType = Objects.requireNonNull(errorType, "Error type is required");
    }

    public GatewayException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "Error type is required");
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
