package fr.lapetina.aigateway.domain.model;

/**
 * Request priority. Only {@link #CRITICAL} requests bypass a hard-stop budget.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
