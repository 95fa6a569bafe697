package fr.lapetina.aigateway.domain.strategy;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.ProviderSnapshot;

import java.util.Comparator;
import java.util.List;

/**
 * Highest quality first.
 *
 * Uses the static quality rank of each profile (lower is better), unless the request carries an
 * explicit ranking: providers it names come first in the given order, the rest follow by rank.
 */
public final class QualityBasedStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "quality-based";
    }

    @Override
    public List<ProviderSnapshot> order(List<ProviderSnapshot> candidates, CompletionRequest request) {
        List<String> ranking = request.qualityRanking();
        Comparator<ProviderSnapshot> byExplicitRank = Comparator.comparingInt(snapshot -> {
            int index = ranking.indexOf(snapshot.id());
            return index >= 0 ? index : Integer.MAX_VALUE;
        });
        Comparator<ProviderSnapshot> byStaticRank =
                Comparator.comparingInt(snapshot -> snapshot.profile().getPriority());

        return candidates.stream()
                .sorted(byExplicitRank.thenComparing(byStaticRank).thenComparing(REGISTRATION_ORDER))
                .toList();
    }
}
