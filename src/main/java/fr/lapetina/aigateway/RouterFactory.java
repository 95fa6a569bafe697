package fr.lapetina.aigateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aigateway.disruptor.RouterEventBus;
import fr.lapetina.aigateway.domain.model.CircuitState;
import fr.lapetina.aigateway.domain.model.ModelPricing;
import fr.lapetina.aigateway.domain.model.ProviderKind;
import fr.lapetina.aigateway.domain.model.ProviderProfile;
import fr.lapetina.aigateway.infrastructure.cache.CacheEngine;
import fr.lapetina.aigateway.infrastructure.config.ConfigLoader;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;
import fr.lapetina.aigateway.infrastructure.json.ObjectMappers;
import fr.lapetina.aigateway.infrastructure.ledger.TokenTracker;
import fr.lapetina.aigateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aigateway.infrastructure.provider.AdapterSettings;
import fr.lapetina.aigateway.infrastructure.provider.ProviderAdapter;
import fr.lapetina.aigateway.infrastructure.provider.ProviderAdapters;
import fr.lapetina.aigateway.router.ProviderRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

/**
 * Factory for creating a fully-wired router from configuration.
 * This is the primary entry point for obtaining a configured {@link ProviderRouter}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RouterFactory factory = RouterFactory.create("gateway.yaml").start()) {
 *     ProviderRouter router = factory.getRouter();
 *     RouteResult result = router.route("Hello!");
 * }
 * }</pre>
 */
public class RouterFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterFactory.class);

    private final ConfigLoader configLoader;
    private final GatewayConfig config;
    private final MetricsRegistry metricsRegistry;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProviderRouter router;

    /**
     * @param adapterOverride builds the adapter for a provider instead of the HTTP adapters; may be null
     */
    protected RouterFactory(String configPath, Clock clock, Function<AdapterSettings, ProviderAdapter> adapterOverride) {
        log.info("Initializing RouterFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.objectMapper = ObjectMappers.create();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getRequest().getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        RouterEventBus eventBus = RouterEventBus.builder()
                .fromConfig(config.getEvents())
                .metricsRegistry(metricsRegistry)
                .build();

        ProviderRouter.Builder builder = ProviderRouter.builder()
                .config(config)
                .clock(clock)
                .eventBus(eventBus)
                .tokenTracker(TokenTracker.create(config.getBudgets(), clock));
        if (config.getCache().isEnabled()) {
            builder.cacheEngine(CacheEngine.create(config.getCache(), clock));
        }

        Duration attemptTimeout = Duration.ofMillis(config.getRequest().getAttemptTimeoutMs());
        for (GatewayConfig.ProviderConfig providerConfig : config.getProviders()) {
            AdapterSettings settings = AdapterSettings.fromConfig(providerConfig, attemptTimeout);
            ProviderAdapter adapter = adapterOverride != null
                    ? adapterOverride.apply(settings)
                    : ProviderAdapters.create(settings, httpClient, objectMapper);
            ProviderProfile profile = toProfile(providerConfig, settings.defaultModel(),
                    config.getLoadBalancing().getMaxConcurrentRequests());
            builder.adapter(adapter, profile);
            log.debug("Registered provider: {}", profile);
        }

        this.router = builder.build();

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        registerProviderMetrics();

        log.info("RouterFactory initialized with {} providers", config.getProviders().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static RouterFactory create(String configPath) {
        return new RouterFactory(configPath, Clock.systemUTC(), null);
    }

    /**
     * Creates a factory from the default configuration (gateway.yaml).
     */
    public static RouterFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    /**
     * Starts the router and the configuration watcher.
     */
    public RouterFactory start() {
        router.start();
        configLoader.startWatching();
        log.info("Router started");
        return this;
    }

    public ProviderRouter getRouter() {
        return router;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public GatewayConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    static ProviderProfile toProfile(GatewayConfig.ProviderConfig providerConfig, String defaultModel, int defaultMaxConcurrent) {
        ProviderKind kind = providerConfig.resolveKind();
        ProviderProfile.Builder profile = ProviderProfile.builder()
                .id(providerConfig.getId())
                .kind(kind)
                .weight(providerConfig.getWeight())
                .priority(providerConfig.getPriority())
                .defaultModel(defaultModel)
                .maxConcurrentRequests(providerConfig.getMaxConcurrentRequests() > 0
                        ? providerConfig.getMaxConcurrentRequests()
                        : defaultMaxConcurrent)
                .enabled(providerConfig.isEnabled());
        for (GatewayConfig.ModelConfig model : providerConfig.getModels()) {
            profile.addModel(model.getName(),
                    ModelPricing.perMillion(model.getInputPerMillion(), model.getOutputPerMillion()));
        }
        return profile.build();
    }

    private void registerProviderMetrics() {
        for (GatewayConfig.ProviderConfig providerConfig : config.getProviders()) {
            String providerId = providerConfig.getId();
            metricsRegistry.registerCircuitState(providerId,
                    () -> circuitStateValue(router.getCircuitState(providerId)));
            metricsRegistry.registerAvailableSlots(providerId,
                    () -> router.getAvailableSlots(providerId));
        }
        metricsRegistry.registerGauge("active_requests", "Requests currently being routed",
                router::getActiveRequests);
        metricsRegistry.registerGauge("dropped_events", "Router events dropped because the ring buffer was full",
                () -> router.getStats().droppedEvents());
    }

    private static int circuitStateValue(CircuitState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    /**
     * Applies the runtime-tunable parts of a reloaded configuration. Providers, stores and
     * limits need a restart.
     */
    private void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        if (!oldConfig.getStrategy().equals(newConfig.getStrategy())) {
            router.setStrategy(newConfig.getStrategy());
        }

        for (GatewayConfig.ProviderConfig providerConfig : newConfig.getProviders()) {
            boolean known = router.getProfiles().stream()
                    .anyMatch(profile -> profile.getId().equals(providerConfig.getId()));
            if (!known) {
                log.warn("New provider ignored until restart: providerId={}", providerConfig.getId());
                continue;
            }
            String defaultModel = AdapterSettings.defaultModelOf(providerConfig, providerConfig.resolveKind());
            router.updateProfile(toProfile(providerConfig, defaultModel,
                    newConfig.getLoadBalancing().getMaxConcurrentRequests()));
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down RouterFactory...");

        try {
            router.shutdown();
        } catch (Exception e) {
            log.warn("Error closing router", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("RouterFactory shut down");
    }
}
