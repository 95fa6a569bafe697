package fr.lapetina.aigateway.router;

import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.domain.model.TokenUsage;

import java.math.BigDecimal;

/**
 * Answer of {@link ProviderRouter#createChatCompletion(ChatCompletionOptions)} and of its streaming
 * counterpart, which carries the full content once the stream ended.
 */
public record ChatCompletionResult(
        String content,
        String model,
        TokenUsage usage,
        BigDecimal cost,
        long latencyMs,
        String provider,
        boolean cached
) {
    static ChatCompletionResult from(CompletionResult result) {
        return new ChatCompletionResult(
                result.content(),
                result.model(),
                result.usage(),
                result.cost(),
                result.latencyMs(),
                result.provider(),
                result.cached()
        );
    }
}
