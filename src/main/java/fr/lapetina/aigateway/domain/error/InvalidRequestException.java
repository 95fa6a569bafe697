package fr.lapetina.aigateway.domain.error;

/**
 * Request rejected before routing.
 */
public final class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(ErrorType.VALIDATION, message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(ErrorType.VALIDATION, message, cause);
    }
}
