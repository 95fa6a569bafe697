package fr.lapetina.aigateway.infrastructure.metrics;

import fr.lapetina.aigateway.domain.error.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters and latency histograms per provider and model
 * - Error counters by provider and error type
 * - Cache, failover, circuit and budget counters
 * - Token and cost totals
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ai_gateway");
    }

    /**
     * Increments the request counter for a provider/outcome combination.
     */
    public void incrementRequestCount(String providerId, String outcome) {
        counter("requests_total", "Total number of routed requests",
                "provider", providerId, "outcome", outcome).increment();
    }

    /**
     * Records provider call latency.
     */
    public void recordLatency(String providerId, String model, Duration latency) {
        String key = providerId + ":" + model;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Provider call latency")
                        .tag("provider", providerId)
                        .tag("model", model)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String providerId, ErrorType errorType) {
        counter("errors_total", "Total number of errors",
                "provider", providerId, "type", errorType.name()).increment();
    }

    public void incrementCacheHit(String tier) {
        counter("cache_hits_total", "Cache hits by tier", "tier", tier).increment();
    }

    public void incrementFailover(String fromProvider) {
        counter("failovers_total", "Failovers away from a provider", "provider", fromProvider).increment();
    }

    public void incrementCircuitTransition(String providerId, String toState) {
        counter("circuit_transitions_total", "Circuit breaker transitions",
                "provider", providerId, "state", toState).increment();
    }

    public void incrementBudgetAlert(String period) {
        counter("budget_alerts_total", "Budget alerts fired", "period", period).increment();
    }

    /**
     * Records tokens and cost of a tracked completion.
     */
    public void recordUsage(String providerId, String model, long inputTokens, long outputTokens, double cost) {
        counter("tokens_total", "Tokens consumed", "provider", providerId, "model", model, "direction", "input")
                .increment(inputTokens);
        counter("tokens_total", "Tokens consumed", "provider", providerId, "model", model, "direction", "output")
                .increment(outputTokens);
        counter("cost_usd_total", "Spend in USD", "provider", providerId, "model", model)
                .increment(cost);
    }

    /**
     * Registers a gauge for a provider's circuit state (0=CLOSED, 1=HALF_OPEN, 2=OPEN).
     */
    public void registerCircuitState(String providerId, Supplier<Number> stateValue) {
        Gauge.builder(prefix + "_circuit_state", stateValue, s -> s.get().doubleValue())
                .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                .tag("provider", providerId)
                .register(registry);
    }

    /**
     * Registers a gauge for a provider's free concurrency slots.
     */
    public void registerAvailableSlots(String providerId, Supplier<Number> slots) {
        Gauge.builder(prefix + "_available_slots", slots, s -> s.get().doubleValue())
                .description("Free concurrency slots per provider")
                .tag("provider", providerId)
                .register(registry);
    }

    /**
     * Registers a global gauge such as dropped events or in-flight requests.
     */
    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(prefix + "_" + name, value, s -> s.get().doubleValue())
                .description(description)
                .register(registry);
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + ":" + String.join(":", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_" + name)
                        .description(description)
                        .tags(tags)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
