package fr.lapetina.aigateway.infrastructure.provider;

import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.domain.model.ProviderKind;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Normalizes one backend's completion API into the canonical request/result shape.
 *
 * Adapters never retry. A failed future always carries a
 * {@link fr.lapetina.aigateway.domain.error.ProviderException} classified as AUTH, RATE_LIMIT,
 * TIMEOUT, PROVIDER_UNAVAILABLE or INVALID_RESPONSE. Results are returned unpriced; the router
 * prices them from the registered profile. Cancelling a returned future aborts the underlying
 * exchange.
 */
public interface ProviderAdapter extends AutoCloseable {

    String getProviderId();

    ProviderKind getKind();

    /**
     * Sends one completion request.
     */
    CompletableFuture<CompletionResult> execute(CompletionRequest request);

    /**
     * Sends one completion request, delivering text deltas to {@code onChunk} in arrival order.
     * The returned result carries the full content. Without a streaming endpoint the whole
     * content is delivered as a single chunk.
     */
    default CompletableFuture<CompletionResult> executeStreaming(CompletionRequest request, Consumer<String> onChunk) {
        return execute(request).thenApply(result -> {
            onChunk.accept(result.content());
            return result;
        });
    }

    /**
     * Cheap liveness check. Completes with false, or fails, when the backend is unusable.
     */
    CompletableFuture<Boolean> healthCheck();

    @Override
    default void close() {
        // Default no-op
    }
}
