package fr.lapetina.aigateway.infrastructure.provider;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Microsoft Copilot models deployed on Azure OpenAI.
 *
 * The deployment name selects the model; it defaults to the model name when not configured.
 */
public class CopilotAdapter extends OpenAiAdapter {

    public static final String DEFAULT_MODEL = "copilot-365-gpt4";

    public CopilotAdapter(AdapterSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
        if (settings.baseUrl() == null || settings.baseUrl().isBlank()) {
            throw new IllegalArgumentException("Copilot provider " + settings.providerId()
                    + " requires a baseUrl (the Azure resource endpoint)");
        }
    }

    @Override
    protected String defaultBaseUrl() {
        return settings.baseUrl();
    }

    @Override
    protected URI completionsUri(String model) {
        String deployment = settings.deployment() != null && !settings.deployment().isBlank()
                ? settings.deployment()
                : model;
        return uri("/openai/deployments/" + encode(deployment)
                + "/chat/completions?api-version=" + encode(settings.apiVersion()));
    }

    @Override
    protected HttpRequest.Builder authenticate(HttpRequest.Builder builder) {
        return settings.apiKey() != null ? builder.header("api-key", settings.apiKey()) : builder;
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return pingHealthCheck();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
