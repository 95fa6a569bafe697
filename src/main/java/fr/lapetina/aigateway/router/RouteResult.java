package fr.lapetina.aigateway.router;

import fr.lapetina.aigateway.domain.model.CompletionResult;

/**
 * Answer of {@link ProviderRouter#route(String, RouteOptions)}.
 */
public record RouteResult(
        String response,
        String provider,
        String model,
        Tokens tokens,
        long latencyMs,
        boolean cached
) {
    public record Tokens(int input, int output) {
    }

    static RouteResult from(CompletionResult result) {
        return new RouteResult(
                result.content(),
                result.provider(),
                result.model(),
                new Tokens(result.usage().inputTokens(), result.usage().outputTokens()),
                result.latencyMs(),
                result.cached()
        );
    }
}
