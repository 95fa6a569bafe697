package fr.lapetina.aigateway.infrastructure.resilience;

import fr.lapetina.aigateway.domain.error.ErrorType;
import fr.lapetina.aigateway.domain.error.ProviderException;
import fr.lapetina.aigateway.domain.error.QueueFullException;
import fr.lapetina.aigateway.domain.error.QueueFullException.QueueFullReason;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.domain.model.CompletionResult;
import fr.lapetina.aigateway.infrastructure.provider.ProviderAdapter;
import fr.lapetina.aigateway.infrastructure.provider.StreamSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one routed request against one provider with bounded retries.
 *
 * At most {@code maxAttempts} attempts are made. Retryable failures (RATE_LIMIT, TIMEOUT,
 * PROVIDER_UNAVAILABLE) are retried after an exponential, jittered backoff that honors a
 * provider's Retry-After hint; non-retryable ones are thrown at once. Every attempt holds a
 * concurrency slot for its duration and is bounded by the request {@link Deadline}; a backoff
 * that would overrun the deadline is not taken. A streamed attempt that already delivered output
 * is never retried.
 */
public final class RetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    private final RetryPolicy policy;
    private final ConcurrencyLimiter limiter;
    private final Sleeper sleeper;
    private final Random random;
    private final Duration attemptTimeout;
    private final Duration slotWaitTimeout;

    public RetryCoordinator(
            RetryPolicy policy,
            ConcurrencyLimiter limiter,
            Sleeper sleeper,
            Random random,
            Duration attemptTimeout,
            Duration slotWaitTimeout
    ) {
        this.policy = policy;
        this.limiter = limiter;
        this.sleeper = sleeper;
        this.random = random;
        this.attemptTimeout = attemptTimeout;
        this.slotWaitTimeout = slotWaitTimeout;
    }

    /**
     * Executes the request on the adapter, retrying as the policy allows.
     *
     * @return the provider's result
     * @throws ProviderException   the last failure, annotated with the number of attempts made
     * @throws QueueFullException  if no concurrency slot could be obtained
     */
    public CompletionResult execute(ProviderAdapter adapter, CompletionRequest request, Deadline deadline) {
        return execute(adapter, request, deadline, null);
    }

    /**
     * Same as {@link #execute(ProviderAdapter, CompletionRequest, Deadline)}, streaming text
     * deltas to {@code sink} when it is not null.
     */
    public CompletionResult execute(ProviderAdapter adapter, CompletionRequest request, Deadline deadline, StreamSink sink) {
        String providerId = adapter.getProviderId();
        int attempt = 0;

        while (true) {
            if (deadline.isExpired()) {
                throw new ProviderException(providerId, ErrorType.TIMEOUT,
                        "Request deadline exceeded before attempt " + (attempt + 1))
                        .withAttempts(attempt);
            }
            attempt++;

            ProviderException failure;
            acquireSlot(providerId, deadline);
            try {
                CompletionResult result = invoke(adapter, request, deadline.cap(attemptTimeout), sink);
                if (attempt > 1) {
                    log.info("Request succeeded after retry: providerId={}, requestId={}, attempt={}",
                            providerId, request.requestId(), attempt);
                }
                return result;
            } catch (ProviderException e) {
                failure = e;
            } finally {
                limiter.release(providerId);
            }

            if (sink != null && sink.hasEmitted()) {
                log.warn("Stream failed after output was delivered: providerId={}, requestId={}, attempt={}, errorType={}",
                        providerId, request.requestId(), attempt, failure.getErrorType());
                throw failure.withAttempts(attempt);
            }
            if (!failure.isRetryable()) {
                log.warn("Non-retryable failure: providerId={}, requestId={}, attempt={}, errorType={}, error={}",
                        providerId, request.requestId(), attempt, failure.getErrorType(), failure.getDetail());
                throw failure.withAttempts(attempt);
            }
            if (attempt >= policy.maxAttempts()) {
                log.warn("Retries exhausted: providerId={}, requestId={}, attempts={}, errorType={}",
                        providerId, request.requestId(), attempt, failure.getErrorType());
                throw failure.withAttempts(attempt);
            }

            Duration delay = backoffFor(attempt, failure);
            if (delay.compareTo(deadline.remaining()) >= 0) {
                log.warn("Backoff would exceed deadline: providerId={}, requestId={}, attempt={}, delayMs={}, remainingMs={}",
                        providerId, request.requestId(), attempt, delay.toMillis(), deadline.remaining().toMillis());
                throw failure.withAttempts(attempt);
            }

            log.info("Retrying request: providerId={}, requestId={}, attempt={}, errorType={}, delayMs={}",
                    providerId, request.requestId(), attempt, failure.getErrorType(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException(providerId, ErrorType.TIMEOUT, "Interrupted during backoff", e)
                        .withAttempts(attempt);
            }
        }
    }

    private Duration backoffFor(int attempt, ProviderException failure) {
        Duration delay;
        synchronized (random) {
            delay = policy.delayFor(attempt - 1, random);
        }
        Duration hint = failure.getRetryAfter().orElse(Duration.ZERO);
        return hint.compareTo(delay) > 0 ? hint : delay;
    }

    private void acquireSlot(String providerId, Deadline deadline) {
        boolean acquired;
        try {
            acquired = limiter.acquire(providerId, deadline.cap(slotWaitTimeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueFullException(QueueFullReason.SLOT_WAIT_TIMEOUT, "interrupted, providerId=" + providerId);
        }
        if (!acquired) {
            throw new QueueFullException(QueueFullReason.SLOT_WAIT_TIMEOUT, "providerId=" + providerId);
        }
    }

    /**
     * Waits for one attempt. On timeout or interrupt the adapter's future is cancelled, which
     * aborts its HTTP exchange.
     */
    private CompletionResult invoke(ProviderAdapter adapter, CompletionRequest request, Duration timeout, StreamSink sink) {
        String providerId = adapter.getProviderId();
        CompletableFuture<CompletionResult> future = sink != null
                ? adapter.executeStreaming(request, sink)
                : adapter.execute(request);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(providerId, ErrorType.TIMEOUT,
                    "No response within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(providerId, ErrorType.TIMEOUT, "Interrupted while waiting for response", e);
        } catch (CancellationException e) {
            throw new ProviderException(providerId, ErrorType.TIMEOUT, "Request cancelled", e);
        } catch (ExecutionException e) {
            throw asProviderException(providerId, e.getCause());
        }
    }

    private static ProviderException asProviderException(String providerId, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProviderException) {
            return (ProviderException) cause;
        }
        // Adapters classify their own failures; anything else is an unusable answer
        return new ProviderException(providerId, ErrorType.INVALID_RESPONSE,
                "Unexpected adapter failure: " + cause, cause);
    }
}
