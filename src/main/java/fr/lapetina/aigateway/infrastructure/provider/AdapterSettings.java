package fr.lapetina.aigateway.infrastructure.provider;

import fr.lapetina.aigateway.domain.model.ProviderKind;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Connection settings of one adapter.
 *
 * @param baseUrl endpoint root; null selects the vendor's public endpoint
 * @param models  models this provider is configured to serve
 */
public record AdapterSettings(
        String providerId,
        ProviderKind kind,
        String baseUrl,
        String apiKey,
        String defaultModel,
        Set<String> models,
        String project,
        String region,
        String deployment,
        String apiVersion,
        Duration requestTimeout
) {
    public AdapterSettings {
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(kind, "Provider kind is required");
        Objects.requireNonNull(defaultModel, "Default model is required");
        Objects.requireNonNull(requestTimeout, "Request timeout is required");
        models = models != null ? Set.copyOf(models) : Set.of();
        if (baseUrl != null && baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    /**
     * Builds settings from a provider configuration, resolving the API key from the environment.
     *
     * @param fallbackTimeout used when the provider does not set its own request timeout
     */
    public static AdapterSettings fromConfig(GatewayConfig.ProviderConfig config, Duration fallbackTimeout) {
        ProviderKind kind = config.resolveKind();
        Set<String> models = new LinkedHashSet<>();
        for (GatewayConfig.ModelConfig model : config.getModels()) {
            models.add(model.getName());
        }
        return new AdapterSettings(
                config.getId(),
                kind,
                config.resolveBaseUrl(),
                config.resolveApiKey(),
                defaultModelOf(config, kind),
                models,
                config.resolveProject(),
                config.getRegion(),
                config.getDeployment(),
                config.getApiVersion(),
                config.getRequestTimeoutMs() > 0 ? Duration.ofMillis(config.getRequestTimeoutMs()) : fallbackTimeout
        );
    }

    /**
     * The configured default model, else the first configured model, else the kind's default.
     */
    public static String defaultModelOf(GatewayConfig.ProviderConfig config, ProviderKind kind) {
        if (config.getDefaultModel() != null && !config.getDefaultModel().isBlank()) {
            return config.getDefaultModel();
        }
        if (!config.getModels().isEmpty()) {
            return config.getModels().get(0).getName();
        }
        return ProviderAdapters.defaultModelFor(kind);
    }

    /**
     * The model to request for a model hint: the hint when this provider serves it, else the default.
     */
    public String resolveModel(String requestedModel) {
        if (requestedModel != null && (models.contains(requestedModel) || defaultModel.equals(requestedModel))) {
            return requestedModel;
        }
        return defaultModel;
    }

    public String baseUrlOr(String fallback) {
        return baseUrl != null && !baseUrl.isBlank() ? baseUrl : fallback;
    }
}
