package fr.lapetina.aigateway.integration;

import fr.lapetina.aigateway.RouterFactory;
import fr.lapetina.aigateway.support.StubProviderAdapter;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test extension of RouterFactory whose providers are in-memory stubs instead of HTTP adapters.
 */
public final class TestRouterFactory extends RouterFactory {

    private final Map<String, StubProviderAdapter> stubs;

    private TestRouterFactory(String configPath, Map<String, StubProviderAdapter> stubs) {
        super(configPath, Clock.systemUTC(), settings -> stubs.computeIfAbsent(settings.providerId(),
                id -> new StubProviderAdapter(id, settings.kind(), settings.defaultModel())));
        this.stubs = stubs;
    }

    /**
     * Creates a started test factory from the default test configuration.
     */
    public static TestRouterFactory create() {
        return create("test-gateway.yaml");
    }

    /**
     * Creates a started test factory from a custom configuration path.
     */
    public static TestRouterFactory create(String configPath) {
        TestRouterFactory factory = new TestRouterFactory(configPath, new ConcurrentHashMap<>());
        factory.start();
        return factory;
    }

    /**
     * Stub standing in for the configured provider.
     */
    public StubProviderAdapter stub(String providerId) {
        StubProviderAdapter stub = stubs.get(providerId);
        if (stub == null) {
            throw new IllegalArgumentException("No provider configured with id " + providerId);
        }
        return stub;
    }
}
