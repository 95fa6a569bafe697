package fr.lapetina.aigateway.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * OpenAI chat completions API. Also the wire format of the Grok and Copilot adapters.
 */
public class OpenAiAdapter extends AbstractHttpProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAdapter.class);

    public static final String DEFAULT_BASE_URL = "https://api.openai.com";
    public static final String DEFAULT_MODEL = "gpt-4o-2024-11-20";

    public OpenAiAdapter(AdapterSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        super(settings, httpClient, objectMapper);
    }

    @Override
    protected String defaultBaseUrl() {
        return DEFAULT_BASE_URL;
    }

    protected URI completionsUri(String model) {
        return uri("/v1/chat/completions");
    }

    protected HttpRequest.Builder authenticate(HttpRequest.Builder builder) {
        return settings.apiKey() != null ? builder.header("Authorization", "Bearer " + settings.apiKey()) : builder;
    }

    @Override
    protected HttpRequest.Builder buildRequest(CompletionRequest request, String model) throws JsonProcessingException {
        return post(requestBody(request, model), model);
    }

    @Override
    protected HttpRequest.Builder buildStreamingRequest(CompletionRequest request, String model) throws JsonProcessingException {
        ObjectNode body = requestBody(request, model);
        body.put("stream", true);
        // Usage arrives in a final chunk with an empty choices array
        body.putObject("stream_options").put("include_usage", true);
        return post(body, model);
    }

    private ObjectNode requestBody(CompletionRequest request, String model) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.messages()) {
            messages.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        body.put("max_tokens", request.effectiveMaxTokens());
        body.put("temperature", request.effectiveTemperature());
        return body;
    }

    private HttpRequest.Builder post(ObjectNode body, String model) throws JsonProcessingException {
        return authenticate(HttpRequest.newBuilder()
                .uri(completionsUri(model))
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body))));
    }

    @Override
    protected ParsedCompletion parseResponse(JsonNode body) {
        JsonNode choice = body.path("choices").path(0);
        JsonNode usage = body.path("usage");
        return new ParsedCompletion(
                textOrNull(choice.path("message").path("content")),
                new TokenUsage(intOrZero(usage.path("prompt_tokens")), intOrZero(usage.path("completion_tokens"))),
                textOrNull(choice.path("finish_reason")),
                textOrNull(body.path("model"))
        );
    }

    @Override
    void parseStreamEvent(JsonNode event, StreamAccumulator stream) {
        stream.model(textOrNull(event.path("model")));
        JsonNode choice = event.path("choices").path(0);
        stream.text(textOrNull(choice.path("delta").path("content")));
        stream.finishReason(textOrNull(choice.path("finish_reason")));
        JsonNode usage = event.path("usage");
        if (usage.isObject()) {
            stream.inputTokens(intOrZero(usage.path("prompt_tokens")));
            stream.outputTokens(intOrZero(usage.path("completion_tokens")));
        }
    }

    /**
     * Lists models instead of spending tokens on a completion.
     */
    @Override
    public CompletableFuture<Boolean> healthCheck() {
        HttpRequest request = authenticate(HttpRequest.newBuilder()
                .uri(uri("/v1/models"))
                .timeout(settings.requestTimeout())
                .GET())
                .build();

        log.debug("Health check started: providerId={}, uri={}", getProviderId(), request.uri());

        CompletableFuture<HttpResponse<Void>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        return cancelling(exchange, exchange.thenApply(response -> {
            boolean healthy = response.statusCode() == 200;
            if (!healthy) {
                log.warn("Health check failed: providerId={}, status={}", getProviderId(), response.statusCode());
            }
            return healthy;
        }));
    }
}
