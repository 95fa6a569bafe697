package fr.lapetina.aigateway.domain.strategy;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.ProviderSnapshot;

import java.util.Comparator;
import java.util.List;

/**
 * Fastest provider first, by rolling median latency.
 * Providers without latency samples sort after measured ones.
 */
public final class PerformanceBasedStrategy implements LoadBalancingStrategy {

    private static final Comparator<ProviderSnapshot> BY_LATENCY = (a, b) -> {
        if (a.hasLatencySamples() != b.hasLatencySamples()) {
            return a.hasLatencySamples() ? -1 : 1;
        }
        if (!a.hasLatencySamples()) {
            return 0;
        }
        return Double.compare(a.p50LatencyMs(), b.p50LatencyMs());
    };

    @Override
    public String getName() {
        return "performance-based";
    }

    @Override
    public List<ProviderSnapshot> order(List<ProviderSnapshot> candidates, CompletionRequest request) {
        return candidates.stream()
                .sorted(BY_LATENCY.thenComparing(REGISTRATION_ORDER))
                .toList();
    }
}
