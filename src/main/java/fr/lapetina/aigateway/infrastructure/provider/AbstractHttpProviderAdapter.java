package fr.lapetina.aigateway.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aigateway.domain.error.ErrorType;
import fr.lapetina.aigateway.domain.error.ProviderException;
import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.domain.model.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Base class for adapters speaking JSON over HTTP.
 *
 * Subclasses build the vendor request and parse the vendor response; this class sends it with
 * {@link HttpClient#sendAsync} and classifies every failure exactly once. Streamed responses are
 * read as server-sent events, one {@code data:} line per vendor event.
 *
 * Cancelling a future returned by this class cancels the HTTP exchange behind it, and closes the
 * event stream once one is open.
 */
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProviderAdapter.class);

    /** Prompt sent by the default health check. */
    static final String PING_PROMPT = "ping";
    static final int PING_MAX_TOKENS = 5;

    protected final AdapterSettings settings;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpProviderAdapter(AdapterSettings settings, HttpClient httpClient, ObjectMapper objectMapper) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return settings.providerId();
    }

    @Override
    public ProviderKind getKind() {
        return settings.kind();
    }

    public AdapterSettings getSettings() {
        return settings;
    }

    @Override
    public CompletableFuture<CompletionResult> execute(CompletionRequest request) {
        String model = settings.resolveModel(request.model());
        HttpRequest httpRequest;
        try {
            httpRequest = prepare(buildRequest(request, model), request).build();
        } catch (JsonProcessingException | RuntimeException e) {
            return buildFailure(request, e);
        }

        long start = System.nanoTime();
        log.debug("Sending request: providerId={}, requestId={}, model={}, endpoint={}",
                getProviderId(), request.requestId(), model, httpRequest.uri());

        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        return cancelling(exchange, exchange.handle((response, ex) -> {
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (ex != null) {
                throw transportFailure(request, model, ex, latencyMs);
            }
            return handleResponse(request, model, response, latencyMs);
        }));
    }

    @Override
    public CompletableFuture<CompletionResult> executeStreaming(CompletionRequest request, Consumer<String> onChunk) {
        String model = settings.resolveModel(request.model());
        HttpRequest httpRequest;
        try {
            httpRequest = prepare(buildStreamingRequest(request, model), request)
                    .header("Accept", "text/event-stream")
                    .build();
        } catch (JsonProcessingException | RuntimeException e) {
            return buildFailure(request, e);
        }

        long start = System.nanoTime();
        log.debug("Sending streaming request: providerId={}, requestId={}, model={}, endpoint={}",
                getProviderId(), request.requestId(), model, httpRequest.uri());

        AtomicReference<Stream<String>> openBody = new AtomicReference<>();
        CompletableFuture<HttpResponse<Stream<String>>> exchange =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofLines());
        CompletableFuture<CompletionResult> result = exchange.handle((response, ex) -> {
            if (ex != null) {
                throw transportFailure(request, model, ex,
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            }
            openBody.set(response.body());
            return handleStream(request, model, response, onChunk, start);
        });
        result.whenComplete((value, ex) -> {
            Stream<String> body = openBody.get();
            if (result.isCancelled() && body != null) {
                body.close();
            }
        });
        return cancelling(exchange, result);
    }

    private HttpRequest.Builder prepare(HttpRequest.Builder builder, CompletionRequest request) {
        return builder
                .timeout(settings.requestTimeout())
                .header("Content-Type", "application/json")
                .header("X-Request-ID", request.requestId());
    }

    private <T> CompletableFuture<T> buildFailure(CompletionRequest request, Exception e) {
        log.error("Failed to build request: providerId={}, requestId={}", getProviderId(), request.requestId(), e);
        return CompletableFuture.failedFuture(new ProviderException(getProviderId(), ErrorType.INVALID_RESPONSE,
                "Failed to build request: " + e.getMessage(), e));
    }

    private ProviderException transportFailure(CompletionRequest request, String model, Throwable ex, long latencyMs) {
        ProviderException failure = classifyFailure(ex);
        log.warn("Request failed: providerId={}, requestId={}, model={}, errorType={}, latencyMs={}, error={}",
                getProviderId(), request.requestId(), model, failure.getErrorType(), latencyMs, failure.getDetail());
        return failure;
    }

    /**
     * Cancels the exchange when the derived future is cancelled.
     */
    protected static <T> CompletableFuture<T> cancelling(CompletableFuture<?> exchange, CompletableFuture<T> derived) {
        derived.whenComplete((value, ex) -> {
            if (derived.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return derived;
    }

    private CompletionResult handleStream(
            CompletionRequest request,
            String model,
            HttpResponse<Stream<String>> response,
            Consumer<String> onChunk,
            long start
    ) {
        int status = response.statusCode();
        StreamAccumulator stream = new StreamAccumulator(onChunk);
        try (Stream<String> lines = response.body()) {
            if (status < 200 || status >= 300) {
                String body = lines.collect(Collectors.joining("\n"));
                ProviderException failure = classifyStatus(status, body, response.headers());
                log.warn("Streaming request failed with HTTP error: providerId={}, requestId={}, model={}, status={}, errorType={}",
                        getProviderId(), request.requestId(), model, status, failure.getErrorType());
                throw failure;
            }
            Iterator<String> it = lines.iterator();
            while (!stream.isDone() && it.hasNext()) {
                readEventLine(it.next(), stream);
            }
        } catch (UncheckedIOException e) {
            throw transportFailure(request, model, e.getCause(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }

        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (!stream.hasContent()) {
            throw new ProviderException(getProviderId(), ErrorType.INVALID_RESPONSE, "Stream carried no content");
        }
        CompletionResult result = CompletionResult.fromProvider(
                request.requestId(),
                getProviderId(),
                stream.model() != null ? stream.model() : model,
                stream.content(),
                stream.usage(request),
                latencyMs,
                stream.finishReason()
        );
        log.info("Streaming request successful: providerId={}, requestId={}, model={}, latencyMs={}, inputTokens={}, outputTokens={}",
                getProviderId(), request.requestId(), result.model(), latencyMs,
                result.usage().inputTokens(), result.usage().outputTokens());
        return result;
    }

    private void readEventLine(String line, StreamAccumulator stream) {
        // Event names, comments and keep-alives carry no payload
        if (!line.startsWith("data:")) {
            return;
        }
        String data = line.substring("data:".length()).trim();
        if (data.isEmpty()) {
            return;
        }
        if ("[DONE]".equals(data)) {
            stream.markDone();
            return;
        }
        JsonNode event;
        try {
            event = objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new ProviderException(getProviderId(), ErrorType.INVALID_RESPONSE,
                    "Unparseable stream event: " + e.getOriginalMessage(), e);
        }
        parseStreamEvent(event, stream);
    }

    private CompletionResult handleResponse(CompletionRequest request, String model, HttpResponse<String> response, long latencyMs) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            ProviderException failure = classifyStatus(status, response.body(), response.headers());
            log.warn("Request failed with HTTP error: providerId={}, requestId={}, model={}, status={}, errorType={}, latencyMs={}",
                    getProviderId(), request.requestId(), model, status, failure.getErrorType(), latencyMs);
            throw failure;
        }

        ParsedCompletion parsed;
        try {
            parsed = parseResponse(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            throw new ProviderException(getProviderId(), ErrorType.INVALID_RESPONSE,
                    "Unparseable response body: " + e.getOriginalMessage(), e);
        }
        if (parsed.content() == null) {
            throw new ProviderException(getProviderId(), ErrorType.INVALID_RESPONSE, "Response carries no content");
        }

        log.info("Request successful: providerId={}, requestId={}, model={}, status={}, latencyMs={}, inputTokens={}, outputTokens={}",
                getProviderId(), request.requestId(), model, status, latencyMs,
                parsed.usage().inputTokens(), parsed.usage().outputTokens());
        return CompletionResult.fromProvider(
                request.requestId(),
                getProviderId(),
                parsed.model() != null ? parsed.model() : model,
                parsed.content(),
                parsed.usage(),
                latencyMs,
                parsed.finishReason()
        );
    }

    /**
     * Maps a non-2xx status to its error class.
     */
    protected ProviderException classifyStatus(int status, String body, HttpHeaders headers) {
        String message = "HTTP " + status + extractErrorMessage(body).map(m -> ": " + m).orElse("");
        if (status == 401 || status == 403) {
            return new ProviderException(getProviderId(), ErrorType.AUTH, message);
        }
        if (status == 429) {
            return ProviderException.rateLimited(getProviderId(), message, parseRetryAfter(headers));
        }
        if (status == 408 || status == 504) {
            return new ProviderException(getProviderId(), ErrorType.TIMEOUT, message);
        }
        if (status >= 500) {
            return new ProviderException(getProviderId(), ErrorType.PROVIDER_UNAVAILABLE, message);
        }
        return new ProviderException(getProviderId(), ErrorType.INVALID_RESPONSE, message);
    }

    /**
     * Maps a transport failure to its error class.
     */
    protected ProviderException classifyFailure(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProviderException) {
            return (ProviderException) cause;
        }
        String message = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        if (cause instanceof HttpConnectTimeoutException || cause instanceof ConnectException) {
            return new ProviderException(getProviderId(), ErrorType.PROVIDER_UNAVAILABLE, message, cause);
        }
        if (cause instanceof HttpTimeoutException) {
            return new ProviderException(getProviderId(), ErrorType.TIMEOUT, message, cause);
        }
        if (cause instanceof IOException) {
            // The request may have reached the provider; the outcome is unknown
            return new ProviderException(getProviderId(), ErrorType.TIMEOUT, message, cause);
        }
        return new ProviderException(getProviderId(), ErrorType.INVALID_RESPONSE, message, cause);
    }

    private Optional<String> extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return Optional.of(error.asText());
            }
            JsonNode message = error.path("message");
            return message.isTextual() ? Optional.of(message.asText()) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: providerId={}", getProviderId());
            return Optional.empty();
        }
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        Optional<String> value = headers.firstValue("retry-after");
        if (value.isEmpty()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.get().trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            // HTTP-date form is not honored
            return null;
        }
    }

    @Override
    public CompletableFuture<Boolean> healthCheck() {
        return pingHealthCheck();
    }

    /**
     * Minimal completion on the default model.
     */
    protected CompletableFuture<Boolean> pingHealthCheck() {
        CompletionRequest ping = CompletionRequest.builder()
                .addMessage(ChatMessage.user(PING_PROMPT))
                .model(settings.defaultModel())
                .maxTokens(PING_MAX_TOKENS)
                .build();
        return execute(ping).thenApply(result -> true);
    }

    protected URI uri(String path) {
        return URI.create(settings.baseUrlOr(defaultBaseUrl()) + path);
    }

    protected String toJson(Object body) throws JsonProcessingException {
        return objectMapper.writeValueAsString(body);
    }

    protected static int intOrZero(JsonNode node) {
        return node.isNumber() ? node.asInt() : 0;
    }

    protected static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }

    /**
     * Vendor endpoint used when the configuration sets no base URL.
     */
    protected abstract String defaultBaseUrl();

    /**
     * Builds the vendor request: URI, method, body and authentication headers.
     */
    protected abstract HttpRequest.Builder buildRequest(CompletionRequest request, String model) throws JsonProcessingException;

    /**
     * Extracts the completion from a 2xx body. A null content is reported as INVALID_RESPONSE.
     */
    protected abstract ParsedCompletion parseResponse(JsonNode body);

    /**
     * Builds the vendor request asking for a server-sent event stream.
     */
    protected abstract HttpRequest.Builder buildStreamingRequest(CompletionRequest request, String model) throws JsonProcessingException;

    /**
     * Applies one decoded stream event. Throws a {@link ProviderException} for an error event.
     */
    abstract void parseStreamEvent(JsonNode event, StreamAccumulator stream);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{providerId='" + getProviderId() + "', model='" + settings.defaultModel() + "'}";
    }
}
