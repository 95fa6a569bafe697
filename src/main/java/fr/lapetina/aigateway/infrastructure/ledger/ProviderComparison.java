package fr.lapetina.aigateway.infrastructure.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Usage per provider over a time range, most expensive provider first.
 */
public record ProviderComparison(
        List<ProviderUsage> providers,
        long totalRequests,
        long totalTokens,
        BigDecimal totalCost
) {
    public ProviderComparison {
        providers = List.copyOf(providers);
    }

    /**
     * @param averageCostPerRequest cost divided by requests, zero when there were none
     */
    public record ProviderUsage(
            String providerId,
            long requests,
            long tokens,
            BigDecimal cost,
            BigDecimal averageCostPerRequest,
            double averageTokensPerRequest
    ) {
    }

    /**
     * Folds per-model summaries into one entry per provider.
     */
    public static ProviderComparison of(List<UsageSummary> summaries) {
        Map<String, long[]> counts = new LinkedHashMap<>();
        Map<String, BigDecimal> costs = new LinkedHashMap<>();
        for (UsageSummary summary : summaries) {
            long[] count = counts.computeIfAbsent(summary.providerId(), id -> new long[2]);
            count[0] += summary.requests();
            count[1] += summary.totalTokens();
            costs.merge(summary.providerId(), summary.cost(), BigDecimal::add);
        }

        List<ProviderUsage> providers = new ArrayList<>(counts.size());
        long totalRequests = 0;
        long totalTokens = 0;
        BigDecimal totalCost = BigDecimal.ZERO;
        for (Map.Entry<String, long[]> entry : counts.entrySet()) {
            long requests = entry.getValue()[0];
            long tokens = entry.getValue()[1];
            BigDecimal cost = costs.get(entry.getKey());
            providers.add(new ProviderUsage(
                    entry.getKey(),
                    requests,
                    tokens,
                    cost,
                    requests > 0
                            ? cost.divide(BigDecimal.valueOf(requests), 10, RoundingMode.HALF_UP).stripTrailingZeros()
                            : BigDecimal.ZERO,
                    requests > 0 ? (double) tokens / requests : 0.0
            ));
            totalRequests += requests;
            totalTokens += tokens;
            totalCost = totalCost.add(cost);
        }
        providers.sort(Comparator.comparing(ProviderUsage::cost).reversed()
                .thenComparing(ProviderUsage::providerId));
        return new ProviderComparison(providers, totalRequests, totalTokens, totalCost);
    }
}
