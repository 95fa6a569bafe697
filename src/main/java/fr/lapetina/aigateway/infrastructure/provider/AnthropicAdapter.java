package fr.lapetina.aigateway.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aigateway.domain.error.ErrorType;
import fr.lapetina.aigateway.domain.error.ProviderException;
import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.TokenUsage;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;

/**
 * Anthropic messages API.
 *
 * System messages are lifted out of the conversation into the top-level {@code system} field.
 */
public class AnthropicAdapter extends AbstractHttpProviderAdapter {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String DEFAULT_MODEL = "claude-4.5-sonnet-20250514";
    public static final String API_VERSION = "2023-06-01";

    public AnthropicAdapter(AdapterSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    @Override
    protected HttpRequest.Builder buildRequest(CompletionRequest request, String model) throws JsonProcessingException {
        return post(requestBody(request, model));
    }

    @Override
    protected HttpRequest.Builder buildStreamingRequest(CompletionRequest request, String model) throws JsonProcessingException {
        ObjectNode body = requestBody(request, model);
        body.put("stream", true);
        return post(body);
    }

    private ObjectNode requestBody(CompletionRequest request, String model) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", request.effectiveMaxTokens());
        body.put("temperature", Math.min(1.0, request.effectiveTemperature()));

        StringBuilder system = new StringBuilder();
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.messages()) {
            if (ChatMessage.SYSTEM.equals(message.role())) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.content());
            } else {
                messages.addObject()
                        .put("role", ChatMessage.ASSISTANT.equals(message.role()) ? "assistant" : "user")
                        .put("content", message.content());
            }
        }
        if (system.length() > 0) {
            body.put("system", system.toString());
        }
        return body;
    }

    private HttpRequest.Builder post(ObjectNode body) throws JsonProcessingException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri("/v1/messages"))
                .header("anthropic-version", API_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)));
        if (settings.apiKey() != null) {
            builder.header("x-api-key", settings.apiKey());
        }
        return builder;
    }

    @Override
    protected ParsedCompletion parseResponse(JsonNode body) {
        JsonNode content = body.path("content");
        String text = null;
        if (content.isArray()) {
            StringBuilder joined = new StringBuilder();
            boolean found = false;
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                    joined.append(block.path("text").asText());
                    found = true;
                }
            }
            text = found ? joined.toString() : null;
        }
        JsonNode usage = body.path("usage");
        return new ParsedCompletion(
                text,
                new TokenUsage(intOrZero(usage.path("input_tokens")), intOrZero(usage.path("output_tokens"))),
                textOrNull(body.path("stop_reason")),
                textOrNull(body.path("model"))
        );
    }

    @Override
    void parseStreamEvent(JsonNode event, StreamAccumulator stream) {
        switch (event.path("type").asText()) {
            case "message_start":
                JsonNode message = event.path("message");
                stream.model(textOrNull(message.path("model")));
                stream.inputTokens(intOrZero(message.path("usage").path("input_tokens")));
                stream.outputTokens(intOrZero(message.path("usage").path("output_tokens")));
                break;
            case "content_block_delta":
                if ("text_delta".equals(event.path("delta").path("type").asText())) {
                    stream.text(textOrNull(event.path("delta").path("text")));
                }
                break;
            case "message_delta":
                stream.finishReason(textOrNull(event.path("delta").path("stop_reason")));
                stream.outputTokens(intOrZero(event.path("usage").path("output_tokens")));
                break;
            case "message_stop":
                stream.markDone();
                break;
            case "error":
                JsonNode error = event.path("error");
                ErrorType type = "overloaded_error".equals(error.path("type").asText())
                        || "api_error".equals(error.path("type").asText())
                        ? ErrorType.PROVIDER_UNAVAILABLE
                        : ErrorType.INVALID_RESPONSE;
                throw new ProviderException(getProviderId(), type, "Stream error: " + error.path("message").asText());
            default:
                // ping, content_block_start, content_block_stop
                break;
        }
    }
}
