package fr.lapetina.aigateway.domain.model;

/**
 * Token counts reported by a provider for one completion.
 */
public record TokenUsage(int inputTokens, int outputTokens) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("Token counts must be non-negative");
        }
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
