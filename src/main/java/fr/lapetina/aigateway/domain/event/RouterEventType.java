package fr.lapetina.aigateway.domain.event;

/**
 * Observability events emitted by the router. Events never gate control flow.
 */
public enum RouterEventType {
    ROUTING_DECISION("routing-decision"),
    REQUEST_COMPLETE("request:complete"),
    REQUEST_FAILED("request:failed"),
    CACHE_HIT("cache-hit"),
    USAGE_TRACKED("usage-tracked"),
    BUDGET_ALERT("budget-alert"),
    CIRCUIT_STATE_CHANGED("circuit-state-changed"),
    FAILOVER("failover"),
    STRATEGY_CHANGED("strategy-changed"),
    HEALTH_CHECKED("health-checked");

    private final String eventName;

    RouterEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
