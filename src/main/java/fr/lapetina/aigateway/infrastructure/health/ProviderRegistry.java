package fr.lapetina.aigateway.infrastructure.health;

import fr.lapetina.aigateway.domain.model.ProviderProfile;
import fr.lapetina.aigateway.domain.model.ProviderSnapshot;
import fr.lapetina.aigateway.infrastructure.provider.ProviderAdapter;
import fr.lapetina.aigateway.infrastructure.resilience.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of configured providers.
 *
 * Keeps registration order, which strategies use to break ties. Each entry binds the adapter,
 * the current profile, the circuit breaker and the latency window of one provider.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderEntry> providers = new ConcurrentHashMap<>();
    private final List<ProviderEntry> ordered = new CopyOnWriteArrayList<>();
    private final List<Consumer<ProviderRegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final int latencyWindowSize;

    public ProviderRegistry(int latencyWindowSize) {
        this.latencyWindowSize = latencyWindowSize;
    }

    public ProviderRegistry() {
        this(100);
    }

    /**
     * Registers a provider. Ids must be unique.
     */
    public synchronized ProviderEntry register(ProviderAdapter adapter, ProviderProfile profile, CircuitBreaker breaker) {
        if (!adapter.getProviderId().equals(profile.getId())) {
            throw new IllegalArgumentException("Adapter id " + adapter.getProviderId()
                    + " does not match profile id " + profile.getId());
        }
        if (providers.containsKey(profile.getId())) {
            throw new IllegalArgumentException("Provider already registered: " + profile.getId());
        }
        ProviderEntry entry = new ProviderEntry(adapter, profile, breaker,
                new LatencyWindow(latencyWindowSize), ordered.size());
        providers.put(profile.getId(), entry);
        ordered.add(entry);
        log.info("Provider registered: {}", profile);
        notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.REGISTERED, profile));
        return entry;
    }

    /**
     * Replaces the profile of a registered provider. Takes effect for the next routed request.
     */
    public ProviderProfile updateProfile(ProviderProfile profile) {
        ProviderEntry entry = providers.get(profile.getId());
        if (entry == null) {
            throw new IllegalArgumentException("Unknown provider: " + profile.getId());
        }
        ProviderProfile previous = entry.profile;
        entry.profile = profile;
        log.info("Provider profile updated: {}", profile);
        notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.PROFILE_UPDATED, profile));
        return previous;
    }

    public Optional<ProviderEntry> get(String providerId) {
        return providerId == null ? Optional.empty() : Optional.ofNullable(providers.get(providerId));
    }

    /**
     * All entries in registration order.
     */
    public List<ProviderEntry> getAll() {
        return new ArrayList<>(ordered);
    }

    /**
     * Entries whose profile is enabled, in registration order.
     */
    public List<ProviderEntry> getEnabled() {
        return ordered.stream()
                .filter(entry -> entry.getProfile().isEnabled())
                .toList();
    }

    public int size() {
        return ordered.size();
    }

    public void addListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ProviderRegistryEvent event) {
        for (Consumer<ProviderRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    /**
     * One registered provider.
     */
    public static final class ProviderEntry {
        private final ProviderAdapter adapter;
        private final CircuitBreaker circuitBreaker;
        private final LatencyWindow latencyWindow;
        private final int registrationIndex;
        private volatile ProviderProfile profile;

        private ProviderEntry(
                ProviderAdapter adapter,
                ProviderProfile profile,
                CircuitBreaker circuitBreaker,
                LatencyWindow latencyWindow,
                int registrationIndex
        ) {
            this.adapter = adapter;
            this.profile = profile;
            this.circuitBreaker = circuitBreaker;
            this.latencyWindow = latencyWindow;
            this.registrationIndex = registrationIndex;
        }

        public String getId() {
            return profile.getId();
        }

        public ProviderAdapter getAdapter() {
            return adapter;
        }

        public ProviderProfile getProfile() {
            return profile;
        }

        public CircuitBreaker getCircuitBreaker() {
            return circuitBreaker;
        }

        public LatencyWindow getLatencyWindow() {
            return latencyWindow;
        }

        public int getRegistrationIndex() {
            return registrationIndex;
        }

        public ProviderSnapshot snapshot() {
            return new ProviderSnapshot(profile, circuitBreaker.getState(),
                    latencyWindow.percentile(0.5), registrationIndex);
        }
    }

    /**
     * Event for registry changes.
     */
    public record ProviderRegistryEvent(Type type, ProviderProfile profile) {
        public enum Type {
            REGISTERED,
            PROFILE_UPDATED
        }
    }
}
