package fr.lapetina.aigateway.infrastructure.resilience;

import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff policy.
 *
 * @param maxAttempts  maximum attempts on one provider for one request, the first one included
 * @param jitterFactor fraction of the computed delay that may be randomly subtracted
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double backoffMultiplier,
        double jitterFactor
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1)");
        }
    }

    public static RetryPolicy fromConfig(GatewayConfig.RetryConfig config) {
        return new RetryPolicy(
                config.getMaxRetries(),
                Duration.ofMillis(config.getInitialDelayMs()),
                Duration.ofMillis(config.getMaxDelayMs()),
                config.getBackoffMultiplier(),
                config.getJitterFactor()
        );
    }

    /**
     * Delay before the retry that follows the given failed attempt.
     *
     * @param failedAttempt zero-based index of the attempt that just failed
     */
    public Duration delayFor(int failedAttempt, Random random) {
        double base = initialDelay.toMillis() * Math.pow(backoffMultiplier, failedAttempt);
        double capped = Math.min(maxDelay.toMillis(), base);
        double jitter = jitterFactor > 0 ? capped * jitterFactor * random.nextDouble() : 0;
        return Duration.ofMillis(Math.max(0, Math.round(capped - jitter)));
    }
}
