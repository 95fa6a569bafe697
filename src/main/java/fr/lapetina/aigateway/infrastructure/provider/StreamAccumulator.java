package fr.lapetina.aigateway.infrastructure.provider;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.TokenUsage;

import java.util.function.Consumer;

/**
 * Collects the pieces of one streamed completion while forwarding text deltas.
 *
 * Usage counters keep the last value a provider reported. When a stream never reports usage,
 * counts fall back to the four-characters-per-token estimate.
 */
final class StreamAccumulator {

    private final Consumer<String> onChunk;
    private final StringBuilder content = new StringBuilder();
    private boolean sawContent;
    private int inputTokens = -1;
    private int outputTokens = -1;
    private String finishReason;
    private String model;
    private boolean done;

    StreamAccumulator(Consumer<String> onChunk) {
        this.onChunk = onChunk;
    }

    void text(String delta) {
        if (delta == null) {
            return;
        }
        sawContent = true;
        if (!delta.isEmpty()) {
            content.append(delta);
            onChunk.accept(delta);
        }
    }

    void inputTokens(int tokens) {
        if (tokens > 0) {
            inputTokens = tokens;
        }
    }

    void outputTokens(int tokens) {
        if (tokens > 0) {
            outputTokens = tokens;
        }
    }

    void finishReason(String reason) {
        if (reason != null) {
            finishReason = reason;
        }
    }

    void model(String reported) {
        if (reported != null) {
            model = reported;
        }
    }

    void markDone() {
        done = true;
    }

    boolean isDone() {
        return done;
    }

    boolean hasContent() {
        return sawContent;
    }

    String content() {
        return content.toString();
    }

    String finishReason() {
        return finishReason;
    }

    String model() {
        return model;
    }

    TokenUsage usage(CompletionRequest request) {
        int input = inputTokens >= 0 ? inputTokens : request.estimatedInputTokens();
        int output = outputTokens >= 0 ? outputTokens : (content.length() + 3) / 4;
        return new TokenUsage(input, output);
    }
}
