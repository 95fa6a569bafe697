package fr.lapetina.aigateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.router.ChatCompletionOptions;

import java.util.List;

/**
 * Body of {@code POST /v1/chat/completions}, in the OpenAI chat format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiChatRequest {

    private String model;
    private String provider;
    private String priority;
    private List<Message> messages;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    private Double temperature;

    // Getters and setters
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public List<Message> getMessages() { return messages; }
    public void setMessages(List<Message> messages) { this.messages = messages; }

    public Integer getMaxTokens() { return maxTokens; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    /**
     * Converts to router options.
     *
     * @throws IllegalArgumentException if a message lacks a role or content, or the priority is unknown
     */
    public ChatCompletionOptions toOptions() {
        ChatCompletionOptions.Builder builder = ChatCompletionOptions.builder()
                .model(model)
                .provider(provider)
                .priority(ApiPriorities.parse(priority))
                .maxTokens(maxTokens)
                .temperature(temperature);
        if (messages != null) {
            for (Message message : messages) {
                if (message.getRole() == null || message.getContent() == null) {
                    throw new IllegalArgumentException("Each message needs a role and a content");
                }
                builder.addMessage(new ChatMessage(message.getRole(), message.getContent()));
            }
        }
        return builder.build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
    }
}
