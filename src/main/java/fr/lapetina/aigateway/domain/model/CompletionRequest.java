package fr.lapetina.aigateway.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical completion request, independent of any provider's wire format.
 * Immutable and thread-safe.
 *
 * <p>{@code model}, {@code provider}, {@code maxTokens} and {@code temperature} are optional hints;
 * use the {@code effective*} accessors to read them with their defaults applied.
 */
public record CompletionRequest(
        String requestId,
        List<ChatMessage> messages,
        String model,
        String provider,
        Integer maxTokens,
        Double temperature,
        Priority priority,
        List<String> qualityRanking,
        Instant createdAt
) {
    public static final int DEFAULT_MAX_TOKENS = 2048;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    public CompletionRequest {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
            throw new IllegalArgumentException("temperature must be within [0, 2]: " + temperature);
        }
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        if (priority == null) {
            priority = Priority.NORMAL;
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        messages = List.copyOf(messages);
        qualityRanking = qualityRanking != null ? List.copyOf(qualityRanking) : List.of();
    }

    /**
     * Creates a single-turn request from a user prompt.
     */
    public static CompletionRequest ofPrompt(String prompt) {
        return builder().addMessage(ChatMessage.user(prompt)).build();
    }

    public int effectiveMaxTokens() {
        return maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
    }

    public double effectiveTemperature() {
        return temperature != null ? temperature : DEFAULT_TEMPERATURE;
    }

    public boolean hasProviderOverride() {
        return provider != null && !provider.isBlank();
    }

    /**
     * Rough input token estimate (four characters per token).
     */
    public int estimatedInputTokens() {
        long chars = 0;
        for (ChatMessage message : messages) {
            chars += message.content().length();
        }
        return (int) Math.min(Integer.MAX_VALUE, (chars + 3) / 4);
    }

    /**
     * Returns a copy carrying a different request id.
     */
    public CompletionRequest withRequestId(String newRequestId) {
        return new CompletionRequest(newRequestId, messages, model, provider, maxTokens,
                temperature, priority, qualityRanking, createdAt);
    }

    public Builder toBuilder() {
        return new Builder()
                .requestId(requestId)
                .messages(messages)
                .model(model)
                .provider(provider)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .priority(priority)
                .qualityRanking(qualityRanking)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private List<ChatMessage> messages = new ArrayList<>();
        private String model;
        private String provider;
        private Integer maxTokens;
        private Double temperature;
        private Priority priority;
        private List<String> qualityRanking;
        private Instant createdAt;

        private Builder() {
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages = new ArrayList<>(Objects.requireNonNull(messages));
            return this;
        }

        public Builder addMessage(ChatMessage message) {
            this.messages.add(message);
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder qualityRanking(List<String> qualityRanking) {
            this.qualityRanking = qualityRanking;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public CompletionRequest build() {
            return new CompletionRequest(requestId, messages, model, provider, maxTokens,
                    temperature, priority, qualityRanking, createdAt);
        }
    }
}
