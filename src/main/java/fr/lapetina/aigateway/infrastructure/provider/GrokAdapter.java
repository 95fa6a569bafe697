package fr.lapetina.aigateway.infrastructure.provider;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;

/**
 * xAI Grok, served through an OpenAI-compatible API.
 */
public class GrokAdapter extends OpenAiAdapter {

    public static final String DEFAULT_BASE_URL = "https://api.x.ai";
    public static final String DEFAULT_MODEL = "grok-4.1-eq";

    public GrokAdapter(AdapterSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }
}
