package fr.lapetina.aigateway.domain.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Factory for load balancing strategies, by configuration name.
 *
 * Supports runtime strategy switching without service restart. Every strategy receives a
 * {@link Random}; only randomized strategies use it.
 */
public final class StrategyFactory {

    public static final String DEFAULT_STRATEGY = "cost-based";

    private static final Map<String, Function<Random, LoadBalancingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        // Register built-in strategies
        register("cost-based", random -> new CostBasedStrategy());
        register("performance-based", random -> new PerformanceBasedStrategy());
        register("quality-based", random -> new QualityBasedStrategy());
        register("round-robin", random -> new RoundRobinStrategy());
        register("weighted", WeightedStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name    Strategy name (used in configuration)
     * @param creator Factory for creating strategy instances
     */
    public static void register(String name, Function<Random, LoadBalancingStrategy> creator) {
        REGISTRY.put(name.toLowerCase(), creator);
    }

    /**
     * Creates a strategy by name with an unseeded random source.
     */
    public static Optional<LoadBalancingStrategy> create(String name) {
        return create(name, new Random());
    }

    /**
     * Creates a strategy by name.
     *
     * @param name   Strategy name from configuration
     * @param random Random source for randomized strategies
     * @return Strategy instance, or empty if not found
     */
    public static Optional<LoadBalancingStrategy> create(String name, Random random) {
        if (name == null) {
            return Optional.empty();
        }
        Function<Random, LoadBalancingStrategy> creator = REGISTRY.get(name.toLowerCase());
        if (creator == null) {
            return Optional.empty();
        }
        return Optional.of(creator.apply(random));
    }

    /**
     * Creates a strategy by name, with default fallback.
     */
    public static LoadBalancingStrategy createOrDefault(String name, Random random, LoadBalancingStrategy defaultStrategy) {
        return create(name, random).orElse(defaultStrategy);
    }

    /**
     * Returns all registered strategy names, sorted.
     */
    public static List<String> getRegisteredNames() {
        return REGISTRY.keySet().stream().sorted().toList();
    }
}
