package fr.lapetina.aigateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.aigateway.router.RouteOptions;

/**
 * Body of {@code POST /v1/route}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiRouteRequest {

    private String prompt;
    private String model;
    private String provider;
    private String priority;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    private Double temperature;

    @JsonProperty("request_id")
    private String requestId;

    // Getters and setters
    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }

    public Integer getMaxTokens() { return maxTokens; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    /**
     * Converts to router options.
     *
     * @throws IllegalArgumentException if the priority is not a known value
     */
    public RouteOptions toRouteOptions() {
        return RouteOptions.builder()
                .model(model)
                .provider(provider)
                .priority(ApiPriorities.parse(priority))
                .maxTokens(maxTokens)
                .temperature(temperature)
                .requestId(requestId)
                .build();
    }
}
