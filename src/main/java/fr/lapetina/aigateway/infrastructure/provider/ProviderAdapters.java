package fr.lapetina.aigateway.infrastructure.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aigateway.domain.model.ProviderKind;

import java.net.http.HttpClient;

/**
 * Creates the adapter for a provider kind.
 */
public final class ProviderAdapters {

    private ProviderAdapters() {
    }

    public static ProviderAdapter create(AdapterSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        switch (settings.kind()) {
            case OPENAI:
                return new OpenAiAdapter(settings, httpClient, objectMapper);
            case ANTHROPIC:
                return new AnthropicAdapter(settings, httpClient, objectMapper);
            case VERTEX:
                return new VertexAdapter(settings, httpClient, objectMapper);
            case GROK:
                return new GrokAdapter(settings, httpClient, objectMapper);
            case COPILOT:
                return new CopilotAdapter(settings, httpClient, objectMapper);
            default:
                throw new IllegalArgumentException("Unsupported provider kind: " + settings.kind());
        }
    }

    public static String defaultModelFor(ProviderKind kind) {
        switch (kind) {
            case OPENAI:
                return OpenAiAdapter.DEFAULT_MODEL;
            case ANTHROPIC:
                return AnthropicAdapter.DEFAULT_MODEL;
            case VERTEX:
                return VertexAdapter.DEFAULT_MODEL;
            case GROK:
                return GrokAdapter.DEFAULT_MODEL;
            case COPILOT:
                return CopilotAdapter.DEFAULT_MODEL;
            default:
                throw new IllegalArgumentException("Unsupported provider kind: " + kind);
        }
    }
}
