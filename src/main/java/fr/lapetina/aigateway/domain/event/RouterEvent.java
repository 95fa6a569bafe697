package fr.lapetina.aigateway.domain.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable event delivered to {@link RouterEventListener}s.
 *
 * @param requestId  the request this event belongs to, or null for system events
 * @param providerId the provider concerned, or null
 * @param data       event-specific attributes
 */
public record RouterEvent(
        RouterEventType type,
        Instant timestamp,
        String requestId,
        String providerId,
        Map<String, Object> data
) {
    public static final String MODEL = "model";
    public static final String LATENCY_MS = "latencyMs";
    public static final String CACHED = "cached";
    public static final String INPUT_TOKENS = "inputTokens";
    public static final String OUTPUT_TOKENS = "outputTokens";
    public static final String COST = "cost";
    public static final String ERROR_TYPE = "errorType";
    public static final String ERROR = "error";
    public static final String ATTEMPTS = "attempts";
    public static final String TIER = "tier";
    public static final String SIMILARITY = "similarity";
    public static final String FROM = "from";
    public static final String TO = "to";
    public static final String CANDIDATES = "candidates";
    public static final String STRATEGY = "strategy";
    public static final String PERIOD = "period";
    public static final String CONSUMED = "consumed";
    public static final String LIMIT = "limit";
    public static final String HEALTHY = "healthy";

    public RouterEvent {
        Objects.requireNonNull(type, "Event type is required");
        Objects.requireNonNull(timestamp, "Event timestamp is required");
        data = data != null ? Map.copyOf(data) : Map.of();
    }

    public static RouterEvent of(RouterEventType type, Instant timestamp, String requestId, String providerId,
                                 Map<String, Object> data) {
        return new RouterEvent(type, timestamp, requestId, providerId, data);
    }

    /**
     * Reads an attribute, or returns the fallback when absent.
     */
    @SuppressWarnings("unchecked")
    public <T> T attribute(String key, T fallback) {
        Object value = data.get(key);
        return value != null ? (T) value : fallback;
    }
}
