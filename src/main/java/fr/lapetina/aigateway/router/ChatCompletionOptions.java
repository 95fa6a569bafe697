package fr.lapetina.aigateway.router;

import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.Priority;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of {@link ProviderRouter#createChatCompletion(ChatCompletionOptions)}.
 */
public final class ChatCompletionOptions {

    private final List<ChatMessage> messages;
    private final Integer maxTokens;
    private final String provider;
    private final String model;
    private final Double temperature;
    private final Priority priority;

    private ChatCompletionOptions(Builder builder) {
        this.messages = List.copyOf(builder.messages);
        this.maxTokens = builder.maxTokens;
        this.provider = builder.provider;
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.priority = builder.priority;
    }

    public List<ChatMessage> getMessages() { return messages; }

    public Integer getMaxTokens() { return maxTokens; }

    public String getProvider() { return provider; }

    public String getModel() { return model; }

    public Double getTemperature() { return temperature; }

    public Priority getPriority() { return priority; }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<ChatMessage> messages = new ArrayList<>();
        private Integer maxTokens;
        private String provider;
        private String model;
        private Double temperature;
        private Priority priority;

        private Builder() {
        }

        public Builder messages(List<ChatMessage> messages) {
            this.messages.clear();
            this.messages.addAll(messages);
            return this;
        }

        public Builder addMessage(ChatMessage message) {
            this.messages.add(message);
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
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

        public ChatCompletionOptions build() {
            return new ChatCompletionOptions(this);
        }
    }
}
