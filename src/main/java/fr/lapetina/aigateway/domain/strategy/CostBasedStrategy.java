package fr.lapetina.aigateway.domain.strategy;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.ProviderSnapshot;

import java.util.Comparator;
import java.util.List;

/**
 * Cheapest provider first, by estimated cost of the request on each provider's pricing table.
 */
public final class CostBasedStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "cost-based";
    }

    @Override
    public List<ProviderSnapshot> order(List<ProviderSnapshot> candidates, CompletionRequest request) {
        Comparator<ProviderSnapshot> byCost =
                Comparator.comparing(snapshot -> snapshot.profile().estimateCost(request));
        return candidates.stream()
                .sorted(byCost.thenComparing(REGISTRATION_ORDER))
                .toList();
    }
}
