package fr.lapetina.aigateway.domain.strategy;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.ProviderSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Weighted random strategy.
 *
 * Draws providers without replacement with probability proportional to their weight, so the
 * first choice converges to {@code w_i / sum(w)} and the rest of the list remains a usable
 * failover order. Providers with zero weight are only used as a last resort, in registration
 * order. With a seeded {@link Random} the produced orders are reproducible.
 */
public final class WeightedStrategy implements LoadBalancingStrategy {

    private final Random random;

    public WeightedStrategy() {
        this(new Random());
    }

    public WeightedStrategy(Random random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "weighted";
    }

    @Override
    public List<ProviderSnapshot> order(List<ProviderSnapshot> candidates, CompletionRequest request) {
        List<ProviderSnapshot> pool = new ArrayList<>();
        List<ProviderSnapshot> weightless = new ArrayList<>();
        for (ProviderSnapshot candidate : candidates) {
            if (candidate.profile().getWeight() > 0) {
                pool.add(candidate);
            } else {
                weightless.add(candidate);
            }
        }

        List<ProviderSnapshot> ordered = new ArrayList<>(candidates.size());
        synchronized (random) {
            while (!pool.isEmpty()) {
                ordered.add(pool.remove(pick(pool)));
            }
        }
        ordered.addAll(weightless);
        return ordered;
    }

    private int pick(List<ProviderSnapshot> pool) {
        double total = 0;
        for (ProviderSnapshot snapshot : pool) {
            total += snapshot.profile().getWeight();
        }
        double target = random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < pool.size(); i++) {
            cumulative += pool.get(i).profile().getWeight();
            if (target < cumulative) {
                return i;
            }
        }
        // Floating point rounding
        return pool.size() - 1;
    }
}
