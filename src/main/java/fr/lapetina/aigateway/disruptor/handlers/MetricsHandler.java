package fr.lapetina.aigateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.aigateway.domain.error.ErrorType;
import fr.lapetina.aigateway.domain.event.RouterEvent;
import fr.lapetina.aigateway.domain.event.RouterEventSlot;
import fr.lapetina.aigateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * First stage: turns router events into Micrometer metrics.
 *
 * Sets MDC context for the duration of the event so that any logging carries the request and
 * provider.
 */
public final class MetricsHandler implements EventHandler<RouterEventSlot> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(RouterEventSlot slot, long sequence, boolean endOfBatch) {
        RouterEvent event = slot.getEvent();
        if (event == null) {
            return;
        }
        setupMDC(event);
        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(RouterEvent event) {
        if (event.requestId() != null) {
            MDC.put("requestId", event.requestId());
        }
        if (event.providerId() != null) {
            MDC.put("provider", event.providerId());
        }
        MDC.put("eventType", event.type().getEventName());
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("provider");
        MDC.remove("eventType");
    }

    private void recordMetrics(RouterEvent event) {
        String provider = event.providerId() != null ? event.providerId() : "none";
        String model = event.attribute(RouterEvent.MODEL, "unknown");

        switch (event.type()) {
            case REQUEST_COMPLETE: {
                boolean cached = event.attribute(RouterEvent.CACHED, Boolean.FALSE);
                metricsRegistry.incrementRequestCount(provider, cached ? "cached" : "success");
                long latencyMs = event.attribute(RouterEvent.LATENCY_MS, 0L);
                metricsRegistry.recordLatency(provider, model, Duration.ofMillis(latencyMs));
                if (!cached) {
                    int input = event.attribute(RouterEvent.INPUT_TOKENS, 0);
                    int output = event.attribute(RouterEvent.OUTPUT_TOKENS, 0);
                    BigDecimal cost = event.attribute(RouterEvent.COST, BigDecimal.ZERO);
                    metricsRegistry.recordUsage(provider, model, input, output, cost.doubleValue());
                }
                break;
            }
            case REQUEST_FAILED: {
                metricsRegistry.incrementRequestCount(provider, "failure");
                String errorType = event.attribute(RouterEvent.ERROR_TYPE, null);
                if (errorType != null) {
                    metricsRegistry.incrementErrorCount(provider, ErrorType.valueOf(errorType));
                }
                log.debug("Request failure recorded: provider={}, errorType={}", provider, errorType);
                break;
            }
            case CACHE_HIT:
                metricsRegistry.incrementCacheHit(event.attribute(RouterEvent.TIER, "unknown"));
                break;
            case FAILOVER:
                metricsRegistry.incrementFailover(provider);
                break;
            case CIRCUIT_STATE_CHANGED:
                metricsRegistry.incrementCircuitTransition(provider, event.attribute(RouterEvent.TO, "unknown"));
                break;
            case BUDGET_ALERT:
                metricsRegistry.incrementBudgetAlert(event.attribute(RouterEvent.PERIOD, "unknown"));
                break;
            default:
                break;
        }
    }
}
