package fr.lapetina.aigateway.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static description of one configured provider: identity, routing weight, quality rank and pricing.
 * Immutable; changed only by replacing the registered profile through an admin call.
 */
public final class ProviderProfile {

    private final String id;
    private final ProviderKind kind;
    private final double weight;
    private final int priority;
    private final String defaultModel;
    private final Map<String, ModelPricing> pricing;
    private final int maxConcurrentRequests;
    private final boolean enabled;

    private ProviderProfile(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.kind = Objects.requireNonNull(builder.kind, "Provider kind is required");
        this.defaultModel = Objects.requireNonNull(builder.defaultModel, "Default model is required");
        if (builder.weight < 0) {
            throw new IllegalArgumentException("Weight must be non-negative: " + builder.weight);
        }
        if (builder.maxConcurrentRequests <= 0) {
            throw new IllegalArgumentException("maxConcurrentRequests must be positive");
        }
        this.weight = builder.weight;
        this.priority = builder.priority;
        this.pricing = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pricing));
        this.maxConcurrentRequests = builder.maxConcurrentRequests;
        this.enabled = builder.enabled;
    }

    public String getId() {
        return id;
    }

    public ProviderKind getKind() {
        return kind;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * Quality rank, lower is better.
     */
    public int getPriority() {
        return priority;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public Map<String, ModelPricing> getPricing() {
        return pricing;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean servesModel(String model) {
        return model != null && (pricing.containsKey(model) || defaultModel.equals(model));
    }

    /**
     * The model this provider will actually serve for a requested model hint.
     */
    public String resolveModel(String requestedModel) {
        return servesModel(requestedModel) ? requestedModel : defaultModel;
    }

    /**
     * Pricing for a model, falling back to the default model's pricing, then to free.
     */
    public ModelPricing pricingFor(String model) {
        ModelPricing modelPricing = model != null ? pricing.get(model) : null;
        if (modelPricing == null) {
            modelPricing = pricing.get(defaultModel);
        }
        return modelPricing != null ? modelPricing : ModelPricing.FREE;
    }

    /**
     * Estimated cost of serving the request here: input approximated from characters,
     * output assumed to use the full token allowance.
     */
    public BigDecimal estimateCost(CompletionRequest request) {
        return pricingFor(resolveModel(request.model()))
                .cost(request.estimatedInputTokens(), request.effectiveMaxTokens());
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .weight(weight)
                .priority(priority)
                .defaultModel(defaultModel)
                .pricing(pricing)
                .maxConcurrentRequests(maxConcurrentRequests)
                .enabled(enabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ProviderProfile{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", weight=" + weight +
                ", priority=" + priority +
                ", defaultModel='" + defaultModel + '\'' +
                ", enabled=" + enabled +
                '}';
    }

    public static final class Builder {
        private String id;
        private ProviderKind kind;
        private double weight = 1.0;
        private int priority = 100;
        private String defaultModel;
        private final Map<String, ModelPricing> pricing = new LinkedHashMap<>();
        private int maxConcurrentRequests = 10;
        private boolean enabled = true;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ProviderKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder pricing(Map<String, ModelPricing> pricing) {
            this.pricing.clear();
            this.pricing.putAll(pricing);
            return this;
        }

        public Builder addModel(String model, ModelPricing modelPricing) {
            this.pricing.put(model, modelPricing);
            return this;
        }

        public Builder maxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public ProviderProfile build() {
            return new ProviderProfile(this);
        }
    }
}
