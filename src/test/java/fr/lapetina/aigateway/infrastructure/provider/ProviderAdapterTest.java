package fr.lapetina.aigateway.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aigateway.domain.error.ErrorType;
import fr.lapetina.aigateway.domain.error.ProviderException;
import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.domain.model.ProviderKind;
import fr.lapetina.aigateway.domain.model.TokenUsage;
import fr.lapetina.aigateway.infrastructure.json.ObjectMappers;
import fr.lapetina.aigateway.support.PendingHttpClient;
import fr.lapetina.aigateway.support.StubHttpBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class ProviderAdapterTest {

    private final ObjectMapper objectMapper = ObjectMappers.create();
    private final HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private StubHttpBackend backend;

    @BeforeEach
    void setUp() throws Exception {
        backend = new StubHttpBackend();
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private AdapterSettings settings(String id, ProviderKind kind, String baseUrl, String model) {
        return new AdapterSettings(id, kind, baseUrl, "secret-key", model, Set.of(model),
                "my-project", "us-central1", null, "2024-06-01", Duration.ofSeconds(5));
    }

    private ProviderAdapter adapter(ProviderKind kind, String model) {
        return ProviderAdapters.create(settings(kind.name().toLowerCase(), kind, backend.baseUrl(), model),
                httpClient, objectMapper);
    }

    private static CompletionRequest request() {
        return CompletionRequest.builder()
                .requestId("req-42")
                .messages(List.of(
                        ChatMessage.system("Answer briefly."),
                        ChatMessage.user("What is a circuit breaker?")))
                .maxTokens(256)
                .temperature(0.3)
                .build();
    }

    private JsonNode sentBody() throws Exception {
        return objectMapper.readTree(backend.getLastBody());
    }

    private static ProviderException failureOf(Runnable call) {
        Throwable thrown = catchThrowable(call::run);
        assertThat(thrown).isInstanceOf(CompletionException.class);
        assertThat(thrown.getCause()).isInstanceOf(ProviderException.class);
        return (ProviderException) thrown.getCause();
    }

    private static final String OPENAI_OK = """
            {"id":"chatcmpl-1","model":"gpt-4o-2024-11-20",
             "choices":[{"index":0,"message":{"role":"assistant","content":"It stops calls."},"finish_reason":"stop"}],
             "usage":{"prompt_tokens":21,"completion_tokens":4,"total_tokens":25}}
            """;

    @Nested
    @DisplayName("OpenAiAdapter")
    class OpenAi {

        @Test
        @DisplayName("should send a chat completion and parse the answer")
        void shouldCompleteRequest() throws Exception {
            backend.respond(200, OPENAI_OK);
            ProviderAdapter adapter = adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20");

            CompletionResult result = adapter.execute(request()).join();

            assertThat(result.content()).isEqualTo("It stops calls.");
            assertThat(result.usage()).isEqualTo(new TokenUsage(21, 4));
            assertThat(result.finishReason()).isEqualTo("stop");
            assertThat(result.provider()).isEqualTo("openai");
            assertThat(result.requestId()).isEqualTo("req-42");
            assertThat(result.cached()).isFalse();

            assertThat(backend.getLastUri()).isEqualTo("/v1/chat/completions");
            assertThat(backend.getLastHeader("Authorization")).isEqualTo("Bearer secret-key");
            assertThat(backend.getLastHeader("X-Request-ID")).isEqualTo("req-42");
            JsonNode body = sentBody();
            assertThat(body.path("model").asText()).isEqualTo("gpt-4o-2024-11-20");
            assertThat(body.path("max_tokens").asInt()).isEqualTo(256);
            assertThat(body.path("messages")).hasSize(2);
            assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
        }

        @Test
        @DisplayName("should fall back to the default model for an unknown hint")
        void shouldUseDefaultModel() throws Exception {
            backend.respond(200, OPENAI_OK);

            adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20")
                    .execute(request().toBuilder().model("claude-4.5-sonnet-20250514").build())
                    .join();

            assertThat(sentBody().path("model").asText()).isEqualTo("gpt-4o-2024-11-20");
        }

        @Test
        @DisplayName("should report healthy when the model list answers 200")
        void shouldCheckHealth() {
            backend.respond(200, "{\"data\":[]}");

            assertThat(adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20").healthCheck().join()).isTrue();
            assertThat(backend.getLastMethod()).isEqualTo("GET");
            assertThat(backend.getLastUri()).isEqualTo("/v1/models");
        }
    }

    @Nested
    @DisplayName("error classification")
    class Classification {

        @Test
        @DisplayName("should classify 401 as AUTH")
        void shouldClassifyAuth() {
            backend.respond(401, "{\"error\":{\"message\":\"Invalid API key\"}}");
            ProviderAdapter adapter = adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20");

            ProviderException failure = failureOf(() -> adapter.execute(request()).join());

            assertThat(failure.getErrorType()).isEqualTo(ErrorType.AUTH);
            assertThat(failure.getDetail()).contains("Invalid API key");
            assertThat(failure.isRetryable()).isFalse();
        }

        @Test
        @DisplayName("should classify 429 as RATE_LIMIT with Retry-After")
        void shouldClassifyRateLimit() {
            backend.respond(429, "{\"error\":{\"message\":\"slow down\"}}", Map.of("Retry-After", "7"));
            ProviderAdapter adapter = adapter(ProviderKind.ANTHROPIC, "claude-4.5-sonnet-20250514");

            ProviderException failure = failureOf(() -> adapter.execute(request()).join());

            assertThat(failure.getErrorType()).isEqualTo(ErrorType.RATE_LIMIT);
            assertThat(failure.getRetryAfter()).contains(Duration.ofSeconds(7));
            assertThat(failure.getProviderId()).isEqualTo("anthropic");
        }

        @Test
        @DisplayName("should classify 5xx as PROVIDER_UNAVAILABLE")
        void shouldClassifyServerError() {
            backend.respond(503, "overloaded");
            ProviderAdapter adapter = adapter(ProviderKind.GROK, "grok-4.1-eq");

            assertThat(failureOf(() -> adapter.execute(request()).join()).getErrorType())
                    .isEqualTo(ErrorType.PROVIDER_UNAVAILABLE);
        }

        @Test
        @DisplayName("should classify 504 as TIMEOUT")
        void shouldClassifyGatewayTimeout() {
            backend.respond(504, "");
            ProviderAdapter adapter = adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20");

            assertThat(failureOf(() -> adapter.execute(request()).join()).getErrorType())
                    .isEqualTo(ErrorType.TIMEOUT);
        }

        @Test
        @DisplayName("should classify an unparseable body as INVALID_RESPONSE")
        void shouldClassifyGarbage() {
            backend.respond(200, "<html>not json</html>");
            ProviderAdapter adapter = adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20");

            assertThat(failureOf(() -> adapter.execute(request()).join()).getErrorType())
                    .isEqualTo(ErrorType.INVALID_RESPONSE);
        }

        @Test
        @DisplayName("should classify a body without content as INVALID_RESPONSE")
        void shouldClassifyMissingContent() {
            backend.respond(200, "{\"choices\":[]}");
            ProviderAdapter adapter = adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20");

            assertThat(failureOf(() -> adapter.execute(request()).join()).getErrorType())
                    .isEqualTo(ErrorType.INVALID_RESPONSE);
        }

        @Test
        @DisplayName("should classify a refused connection as PROVIDER_UNAVAILABLE")
        void shouldClassifyConnectionRefused() {
            ProviderAdapter adapter = ProviderAdapters.create(
                    settings("openai", ProviderKind.OPENAI, "http://127.0.0.1:1", "gpt-4o-2024-11-20"),
                    httpClient, objectMapper);

            assertThat(failureOf(() -> adapter.execute(request()).join()).getErrorType())
                    .isEqualTo(ErrorType.PROVIDER_UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("AnthropicAdapter")
    class Anthropic {

        @Test
        @DisplayName("should lift system messages and join text blocks")
        void shouldTranslateMessages() throws Exception {
            backend.respond(200, """
                    {"id":"msg_1","model":"claude-4.5-sonnet-20250514","stop_reason":"end_turn",
                     "content":[{"type":"text","text":"It stops "},{"type":"text","text":"calls."}],
                     "usage":{"input_tokens":30,"output_tokens":6}}
                    """);
            ProviderAdapter adapter = adapter(ProviderKind.ANTHROPIC, "claude-4.5-sonnet-20250514");

            CompletionResult result = adapter.execute(request().toBuilder().temperature(1.6).build()).join();

            assertThat(result.content()).isEqualTo("It stops calls.");
            assertThat(result.usage()).isEqualTo(new TokenUsage(30, 6));
            assertThat(result.finishReason()).isEqualTo("end_turn");

            assertThat(backend.getLastUri()).isEqualTo("/v1/messages");
            assertThat(backend.getLastHeader("x-api-key")).isEqualTo("secret-key");
            assertThat(backend.getLastHeader("anthropic-version")).isEqualTo(AnthropicAdapter.API_VERSION);
            JsonNode body = sentBody();
            assertThat(body.path("system").asText()).isEqualTo("Answer briefly.");
            assertThat(body.path("messages")).hasSize(1);
            assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("user");
            assertThat(body.path("temperature").asDouble()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("VertexAdapter")
    class Vertex {

        @Test
        @DisplayName("should call generateContent on the project model path")
        void shouldCallGenerateContent() throws Exception {
            backend.respond(200, """
                    {"candidates":[{"content":{"role":"model","parts":[{"text":"It stops calls."}]},"finishReason":"STOP"}],
                     "usageMetadata":{"promptTokenCount":18,"candidatesTokenCount":5},
                     "modelVersion":"gemini-2.5-flash-002"}
                    """);
            ProviderAdapter adapter = adapter(ProviderKind.VERTEX, "gemini-2.5-flash-002");

            CompletionResult result = adapter.execute(request()).join();

            assertThat(result.content()).isEqualTo("It stops calls.");
            assertThat(result.usage()).isEqualTo(new TokenUsage(18, 5));
            assertThat(result.finishReason()).isEqualTo("STOP");
            assertThat(backend.getLastUri()).isEqualTo(
                    "/v1/projects/my-project/locations/us-central1/publishers/google/models/gemini-2.5-flash-002:generateContent");
            JsonNode body = sentBody();
            assertThat(body.path("systemInstruction").path("parts").path(0).path("text").asText())
                    .isEqualTo("Answer briefly.");
            assertThat(body.path("generationConfig").path("maxOutputTokens").asInt()).isEqualTo(256);
        }

        @Test
        @DisplayName("should refuse a configuration without project")
        void shouldRequireProject() {
            AdapterSettings noProject = new AdapterSettings("vertex", ProviderKind.VERTEX, null, null,
                    "gemini-2.5-flash-002", Set.of(), null, "us-central1", null, null, Duration.ofSeconds(5));

            assertThatThrownBy(() -> new VertexAdapter(noProject, httpClient, objectMapper))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("project");
        }
    }

    @Nested
    @DisplayName("CopilotAdapter")
    class Copilot {

        @Test
        @DisplayName("should call the deployment endpoint with an api-key header")
        void shouldCallDeployment() {
            backend.respond(200, OPENAI_OK);
            ProviderAdapter adapter = adapter(ProviderKind.COPILOT, "copilot-365-gpt4");

            CompletionResult result = adapter.execute(request()).join();

            assertThat(result.content()).isEqualTo("It stops calls.");
            assertThat(backend.getLastUri())
                    .isEqualTo("/openai/deployments/copilot-365-gpt4/chat/completions?api-version=2024-06-01");
            assertThat(backend.getLastHeader("api-key")).isEqualTo("secret-key");
            assertThat(backend.getLastHeader("Authorization")).isNull();
        }

        @Test
        @DisplayName("should check health with a minimal completion")
        void shouldPingForHealth() throws Exception {
            backend.respond(200, OPENAI_OK);

            assertThat(adapter(ProviderKind.COPILOT, "copilot-365-gpt4").healthCheck().join()).isTrue();
            assertThat(backend.getLastMethod()).isEqualTo("POST");
            assertThat(sentBody().path("max_tokens").asInt()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("streaming")
    class Streaming {

        private final List<String> chunks = new CopyOnWriteArrayList<>();

        @Test
        @DisplayName("should stream OpenAI deltas and read usage from the final chunk")
        void shouldStreamOpenAi() throws Exception {
            backend.respond(200, """
                    data: {"id":"c1","model":"gpt-4o-2024-11-20","choices":[{"index":0,"delta":{"role":"assistant"},"finish_reason":null}]}

                    data: {"id":"c1","model":"gpt-4o-2024-11-20","choices":[{"index":0,"delta":{"content":"It stops "},"finish_reason":null}]}

                    data: {"id":"c1","model":"gpt-4o-2024-11-20","choices":[{"index":0,"delta":{"content":"calls."},"finish_reason":"stop"}]}

                    data: {"id":"c1","model":"gpt-4o-2024-11-20","choices":[],"usage":{"prompt_tokens":21,"completion_tokens":4}}

                    data: [DONE]

                    """);
            ProviderAdapter adapter = adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20");

            CompletionResult result = adapter.executeStreaming(request(), chunks::add).join();

            assertThat(chunks).containsExactly("It stops ", "calls.");
            assertThat(result.content()).isEqualTo("It stops calls.");
            assertThat(result.usage()).isEqualTo(new TokenUsage(21, 4));
            assertThat(result.finishReason()).isEqualTo("stop");
            assertThat(backend.getLastHeader("Accept")).isEqualTo("text/event-stream");
            JsonNode body = sentBody();
            assertThat(body.path("stream").asBoolean()).isTrue();
            assertThat(body.path("stream_options").path("include_usage").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should estimate usage when the stream reports none")
        void shouldEstimateMissingUsage() {
            backend.respond(200, """
                    data: {"choices":[{"index":0,"delta":{"content":"Hi there"},"finish_reason":"stop"}]}

                    data: [DONE]

                    """);
            ProviderAdapter adapter = adapter(ProviderKind.GROK, "grok-4.1-eq");

            CompletionResult result = adapter.executeStreaming(request(), chunks::add).join();

            assertThat(result.model()).isEqualTo("grok-4.1-eq");
            assertThat(result.usage()).isEqualTo(new TokenUsage(request().estimatedInputTokens(), 2));
        }

        @Test
        @DisplayName("should stream Anthropic text deltas and skip other events")
        void shouldStreamAnthropic() throws Exception {
            backend.respond(200, """
                    event: message_start
                    data: {"type":"message_start","message":{"id":"msg_1","model":"claude-4.5-sonnet-20250514","usage":{"input_tokens":30,"output_tokens":1}}}

                    event: content_block_start
                    data: {"type":"content_block_start","index":0,"content_block":{"type":"text","text":""}}

                    event: ping
                    data: {"type":"ping"}

                    event: content_block_delta
                    data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"It stops "}}

                    event: content_block_delta
                    data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"calls."}}

                    event: message_delta
                    data: {"type":"message_delta","delta":{"stop_reason":"end_turn"},"usage":{"output_tokens":6}}

                    event: message_stop
                    data: {"type":"message_stop"}

                    """);
            ProviderAdapter adapter = adapter(ProviderKind.ANTHROPIC, "claude-4.5-sonnet-20250514");

            CompletionResult result = adapter.executeStreaming(request(), chunks::add).join();

            assertThat(chunks).containsExactly("It stops ", "calls.");
            assertThat(result.usage()).isEqualTo(new TokenUsage(30, 6));
            assertThat(result.finishReason()).isEqualTo("end_turn");
            assertThat(sentBody().path("stream").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("should fail on an Anthropic error event after the chunks already delivered")
        void shouldFailOnErrorEvent() {
            backend.respond(200, """
                    event: content_block_delta
                    data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"It stops "}}

                    event: error
                    data: {"type":"error","error":{"type":"overloaded_error","message":"Overloaded"}}

                    """);
            ProviderAdapter adapter = adapter(ProviderKind.ANTHROPIC, "claude-4.5-sonnet-20250514");

            ProviderException failure = failureOf(() -> adapter.executeStreaming(request(), chunks::add).join());

            assertThat(failure.getErrorType()).isEqualTo(ErrorType.PROVIDER_UNAVAILABLE);
            assertThat(failure.getDetail()).contains("Overloaded");
            assertThat(chunks).containsExactly("It stops ");
        }

        @Test
        @DisplayName("should call streamGenerateContent with server-sent events on Vertex")
        void shouldStreamVertex() {
            backend.respond(200, """
                    data: {"candidates":[{"content":{"role":"model","parts":[{"text":"It stops "}]}}],"usageMetadata":{"promptTokenCount":18}}

                    data: {"candidates":[{"content":{"role":"model","parts":[{"text":"calls."}]},"finishReason":"STOP"}],"usageMetadata":{"promptTokenCount":18,"candidatesTokenCount":5},"modelVersion":"gemini-2.5-flash-002"}

                    """);
            ProviderAdapter adapter = adapter(ProviderKind.VERTEX, "gemini-2.5-flash-002");

            CompletionResult result = adapter.executeStreaming(request(), chunks::add).join();

            assertThat(chunks).containsExactly("It stops ", "calls.");
            assertThat(result.usage()).isEqualTo(new TokenUsage(18, 5));
            assertThat(result.finishReason()).isEqualTo("STOP");
            assertThat(backend.getLastUri()).isEqualTo(
                    "/v1/projects/my-project/locations/us-central1/publishers/google/models/gemini-2.5-flash-002:streamGenerateContent?alt=sse");
        }

        @Test
        @DisplayName("should classify an HTTP error before the stream starts")
        void shouldClassifyStreamingHttpError() {
            backend.respond(429, "{\"error\":{\"message\":\"slow down\"}}", Map.of("Retry-After", "4"));
            ProviderAdapter adapter = adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20");

            ProviderException failure = failureOf(() -> adapter.executeStreaming(request(), chunks::add).join());

            assertThat(failure.getErrorType()).isEqualTo(ErrorType.RATE_LIMIT);
            assertThat(failure.getRetryAfter()).contains(Duration.ofSeconds(4));
            assertThat(failure.getDetail()).contains("slow down");
            assertThat(chunks).isEmpty();
        }

        @Test
        @DisplayName("should report a stream without any text as INVALID_RESPONSE")
        void shouldRejectEmptyStream() {
            backend.respond(200, "data: [DONE]\n\n");
            ProviderAdapter adapter = adapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20");

            assertThat(failureOf(() -> adapter.executeStreaming(request(), chunks::add).join()).getErrorType())
                    .isEqualTo(ErrorType.INVALID_RESPONSE);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        private final PendingHttpClient pendingClient = new PendingHttpClient();

        private ProviderAdapter pendingAdapter(ProviderKind kind, String model) {
            return ProviderAdapters.create(settings(kind.name().toLowerCase(), kind, "http://127.0.0.1:1", model),
                    pendingClient, objectMapper);
        }

        @Test
        @DisplayName("should abort the HTTP exchange when a completion is cancelled")
        void shouldCancelExchange() {
            CompletableFuture<CompletionResult> future =
                    pendingAdapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20").execute(request());

            future.cancel(true);

            assertThat(pendingClient.lastExchange()).isCancelled();
        }

        @Test
        @DisplayName("should abort the HTTP exchange when a stream is cancelled")
        void shouldCancelStreamingExchange() {
            CompletableFuture<CompletionResult> future = pendingAdapter(ProviderKind.ANTHROPIC, "claude-4.5-sonnet-20250514")
                    .executeStreaming(request(), chunk -> { });

            future.cancel(true);

            assertThat(pendingClient.lastExchange()).isCancelled();
        }

        @Test
        @DisplayName("should abort the model listing when a health check is cancelled")
        void shouldCancelHealthCheck() {
            CompletableFuture<Boolean> future = pendingAdapter(ProviderKind.OPENAI, "gpt-4o-2024-11-20").healthCheck();

            future.cancel(true);

            assertThat(pendingClient.lastExchange()).isCancelled();
        }
    }

    @Test
    @DisplayName("should parse Retry-After seconds and ignore dates")
    void shouldParseRetryAfter() {
        assertThat(AbstractHttpProviderAdapter.parseRetryAfter(
                HttpHeaders.of(Map.of("retry-after", List.of("3")), (a, b) -> true)))
                .isEqualTo(Duration.ofSeconds(3));
        assertThat(AbstractHttpProviderAdapter.parseRetryAfter(
                HttpHeaders.of(Map.of("retry-after", List.of("Wed, 21 Oct 2015 07:28:00 GMT")), (a, b) -> true)))
                .isNull();
    }
}
