package fr.lapetina.aigateway.domain.error;

/**
 * Raised when a request cannot get a provider concurrency slot.
 */
public final class QueueFullException extends GatewayException {

    private final QueueFullReason reason;

    public QueueFullException(QueueFullReason reason, String details) {
        super(ErrorType.QUEUE_FULL, "Queue full: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public QueueFullReason getReason() {
        return reason;
    }

    public enum QueueFullReason {
        WAIT_QUEUE_FULL("Too many requests waiting for a provider slot"),
        SLOT_WAIT_TIMEOUT("Timed out waiting for a provider slot");

        private final String message;

        QueueFullReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
