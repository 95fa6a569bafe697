package fr.lapetina.aigateway.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.TokenUsage;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;

/**
 * Google Vertex AI {@code generateContent} API for Gemini models.
 *
 * The API key is sent as a bearer access token.
 */
public class VertexAdapter extends AbstractHttpProviderAdapter {

    public static final String DEFAULT_MODEL = "gemini-2.5-flash-002";

    public VertexAdapter(AdapterSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
        if (settings.project() == null || settings.project().isBlank()) {
            throw new IllegalArgumentException("Vertex provider " + settings.providerId() + " requires a project");
        }
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://" + settings.region() + "-aiplatform.googleapis.com";
    }

    @Override
    protected HttpRequest.Builder buildRequest(CompletionRequest request, String model) throws JsonProcessingException {
        return post(requestBody(request), model, ":generateContent");
    }

    @Override
    protected HttpRequest.Builder buildStreamingRequest(CompletionRequest request, String model) throws JsonProcessingException {
        return post(requestBody(request), model, ":streamGenerateContent?alt=sse");
    }

    private ObjectNode requestBody(CompletionRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        StringBuilder system = new StringBuilder();
        ArrayNode contents = body.putArray("contents");
        for (ChatMessage message : request.messages()) {
            if (ChatMessage.SYSTEM.equals(message.role())) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.content());
                continue;
            }
            ObjectNode content = contents.addObject();
            content.put("role", ChatMessage.ASSISTANT.equals(message.role()) ? "model" : "user");
            content.putArray("parts").addObject().put("text", message.content());
        }
        if (system.length() > 0) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", system.toString());
        }
        body.putObject("generationConfig")
                .put("maxOutputTokens", request.effectiveMaxTokens())
                .put("temperature", request.effectiveTemperature());
        return body;
    }

    private HttpRequest.Builder post(ObjectNode body, String model, String method) throws JsonProcessingException {
        String path = "/v1/projects/" + encode(settings.project())
                + "/locations/" + encode(settings.region())
                + "/publishers/google/models/" + encode(model) + method;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri(path))
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)));
        if (settings.apiKey() != null) {
            builder.header("Authorization", "Bearer " + settings.apiKey());
        }
        return builder;
    }

    @Override
    protected ParsedCompletion parseResponse(JsonNode body) {
        JsonNode candidate = body.path("candidates").path(0);
        JsonNode parts = candidate.path("content").path("parts");
        String text = null;
        if (parts.isArray()) {
            StringBuilder joined = new StringBuilder();
            boolean found = false;
            for (JsonNode part : parts) {
                if (part.path("text").isTextual()) {
                    joined.append(part.path("text").asText());
                    found = true;
                }
            }
            text = found ? joined.toString() : null;
        }
        JsonNode usage = body.path("usageMetadata");
        return new ParsedCompletion(
                text,
                new TokenUsage(intOrZero(usage.path("promptTokenCount")), intOrZero(usage.path("candidatesTokenCount"))),
                textOrNull(candidate.path("finishReason")),
                textOrNull(body.path("modelVersion"))
        );
    }

    /**
     * Each event is a partial response; usage metadata is cumulative.
     */
    @Override
    void parseStreamEvent(JsonNode event, StreamAccumulator stream) {
        stream.model(textOrNull(event.path("modelVersion")));
        JsonNode candidate = event.path("candidates").path(0);
        JsonNode parts = candidate.path("content").path("parts");
        if (parts.isArray()) {
            for (JsonNode part : parts) {
                stream.text(textOrNull(part.path("text")));
            }
        }
        stream.finishReason(textOrNull(candidate.path("finishReason")));
        JsonNode usage = event.path("usageMetadata");
        stream.inputTokens(intOrZero(usage.path("promptTokenCount")));
        stream.outputTokens(intOrZero(usage.path("candidatesTokenCount")));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
