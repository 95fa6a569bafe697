package fr.lapetina.aigateway.router;

import fr.lapetina.aigateway.domain.model.Priority;

/**
 * Optional hints for {@link ProviderRouter#route(String, RouteOptions)}. All fields may be null.
 */
public final class RouteOptions {

    private static final RouteOptions DEFAULTS = builder().build();

    private final String model;
    private final String provider;
    private final Priority priority;
    private final Integer maxTokens;
    private final Double temperature;
    private final String requestId;

    private RouteOptions(Builder builder) {
        this.model = builder.model;
        this.provider = builder.provider;
        this.priority = builder.priority;
        this.maxTokens = builder.maxTokens;
        this.temperature = builder.temperature;
        this.requestId = builder.requestId;
    }

    public static RouteOptions defaults() {
        return DEFAULTS;
    }

    public String getModel() { return model; }

    public String getProvider() { return provider; }

    public Priority getPriority() { return priority; }

    public Integer getMaxTokens() { return maxTokens; }

    public Double getTemperature() { return temperature; }

    public String getRequestId() { return requestId; }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String model;
        private String provider;
        private Priority priority;
        private Integer maxTokens;
        private Double temperature;
        private String requestId;

        private Builder() {
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
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

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public RouteOptions build() {
            return new RouteOptions(this);
        }
    }
}
