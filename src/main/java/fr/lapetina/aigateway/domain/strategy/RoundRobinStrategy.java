package fr.lapetina.aigateway.domain.strategy;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.ProviderSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin strategy.
 *
 * Rotates the starting provider on every call; the remaining candidates keep
 * registration order after it so failover still walks the whole list.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public List<ProviderSnapshot> order(List<ProviderSnapshot> candidates, CompletionRequest request) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        int size = candidates.size();
        int offset = Math.floorMod(counter.getAndIncrement(), size);

        List<ProviderSnapshot> ordered = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ordered.add(candidates.get((offset + i) % size));
        }
        return ordered;
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}
